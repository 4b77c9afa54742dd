package work.lcod.thoughts.document;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.thoughts.graph.Level;
import work.lcod.thoughts.path.Step;

/**
 * Builds a {@link MergedGraph} from an annotated reasoning document: the ground truth first,
 * then every result in order, with input nodes for each factual-assignment name.
 *
 * <p>A dependency edge is typed {@code GROUND_TRUTH} when both of its nodes already belong to the
 * ground truth at the time the edge is added, {@code SAMPLE} otherwise.
 */
public final class MergedGraphBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(MergedGraphBuilder.class);

    private final Map<String, NodeState> nodes = new LinkedHashMap<>();
    private final Set<MergedGraph.Edge> edges = new LinkedHashSet<>();

    private MergedGraphBuilder() {}

    public static MergedGraph build(JsonNode document) {
        if (document == null || !document.isObject()) {
            throw new IllegalArgumentException("reasoning document must be a JSON object");
        }
        var builder = new MergedGraphBuilder();
        var inputs = new ArrayList<String>();
        document.path(ReasoningDocumentProcessor.FACTUAL_ASSIGNMENT).fieldNames().forEachRemaining(inputs::add);

        JsonNode groundTruth = document.path(ReasoningDocumentProcessor.GROUND_TRUTH_FUNCTION);
        if (groundTruth.isObject()) {
            builder.add(
                ReasoningDocumentProcessor.GROUND_TRUTH_SOURCE,
                StepRecords.fromLevelSequence(groundTruth.path(ReasoningDocumentProcessor.LEVELS)),
                inputs
            );
        }
        JsonNode results = document.path(ReasoningDocumentProcessor.RESULTS);
        if (results.isArray()) {
            for (JsonNode result : results) {
                JsonNode sampleId = result.path(ReasoningDocumentProcessor.SAMPLE_ID);
                String source = "sample_" + (sampleId.isMissingNode() || sampleId.isNull() ? "unknown" : sampleId.asText());
                builder.add(source, StepRecords.fromLevelSequence(result.path(ReasoningDocumentProcessor.LEVELS)), inputs);
            }
        }
        var graph = builder.toGraph();
        LOG.debug("Merged graph has {} nodes and {} edges", graph.nodes().size(), graph.edges().size());
        return graph;
    }

    private void add(String source, List<Level> levels, List<String> inputs) {
        for (String input : inputs) {
            node("input:" + input, MergedGraph.NodeKind.INPUT, input, "Input: " + input).sources.add(source);
        }

        int maxLevel = levels.stream().mapToInt(Level::level).max().orElse(-1);
        var local = new HashMap<Integer, NodeState>();
        for (Level level : levels) {
            for (Step step : level.steps()) {
                NodeState state = node(stepKey(step), MergedGraph.NodeKind.STEP, step.variable(), step.expression());
                state.sources.add(source);
                state.levels.put(source, level.level());
                if (level.level() == maxLevel) {
                    state.terminalIn.add(source);
                }
                local.put(step.stepId(), state);
            }
        }

        for (Level level : levels) {
            for (Step step : level.steps()) {
                NodeState target = nodes.get(stepKey(step));
                for (int dependency : step.dependencies()) {
                    NodeState origin = local.get(dependency);
                    if (origin == null) {
                        continue;
                    }
                    boolean groundTruth = origin.isGroundTruth() && target.isGroundTruth();
                    edges.add(new MergedGraph.Edge(
                        origin.id,
                        target.id,
                        groundTruth ? MergedGraph.EdgeType.GROUND_TRUTH : MergedGraph.EdgeType.SAMPLE
                    ));
                }
                for (String input : step.dependenciesInput()) {
                    NodeState origin = nodes.get("input:" + input);
                    if (origin != null) {
                        edges.add(new MergedGraph.Edge(origin.id, target.id, MergedGraph.EdgeType.INPUT));
                    }
                }
            }
        }
    }

    private NodeState node(String key, MergedGraph.NodeKind kind, String variable, String expression) {
        return nodes.computeIfAbsent(key, ignored -> new NodeState("node_" + nodes.size(), kind, variable, expression));
    }

    private static String stepKey(Step step) {
        return "step:" + step.variable() + "\u0000" + step.expression();
    }

    private MergedGraph toGraph() {
        var merged = new ArrayList<MergedGraph.Node>();
        for (NodeState state : nodes.values()) {
            merged.add(new MergedGraph.Node(
                state.id,
                state.kind,
                state.variable,
                state.expression,
                state.sources,
                state.levels,
                state.terminalIn
            ));
        }
        return new MergedGraph(merged, new ArrayList<>(edges));
    }

    private static final class NodeState {
        private final String id;
        private final MergedGraph.NodeKind kind;
        private final String variable;
        private final String expression;
        private final Set<String> sources = new TreeSet<>();
        private final Map<String, Integer> levels = new TreeMap<>();
        private final Set<String> terminalIn = new TreeSet<>();

        private NodeState(String id, MergedGraph.NodeKind kind, String variable, String expression) {
            this.id = id;
            this.kind = kind;
            this.variable = variable;
            this.expression = expression;
        }

        private boolean isGroundTruth() {
            return sources.contains(ReasoningDocumentProcessor.GROUND_TRUTH_SOURCE);
        }
    }
}
