package work.lcod.thoughts.document;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Steps of many computations merged into one graph for visualization. Step nodes are keyed by
 * {@code (variable, expression)}, input nodes by parameter name. Nothing here renders.
 */
public record MergedGraph(List<Node> nodes, List<Edge> edges) {
    public MergedGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public Optional<Node> step(String variable, String expression) {
        return nodes.stream()
            .filter(node -> node.kind() == NodeKind.STEP && node.variable().equals(variable) && node.expression().equals(expression))
            .findFirst();
    }

    public Optional<Node> input(String name) {
        return nodes.stream()
            .filter(node -> node.kind() == NodeKind.INPUT && node.variable().equals(name))
            .findFirst();
    }

    public ObjectNode toJsonNode() {
        var root = StepRecords.MAPPER.createObjectNode();
        var nodeArray = root.putArray("nodes");
        for (Node node : nodes) {
            var json = nodeArray.addObject();
            json.put("id", node.id());
            json.put("kind", node.kind().name().toLowerCase(Locale.ROOT));
            json.put("variable", node.variable());
            json.put("expression", node.expression());
            var sources = json.putArray("sources");
            node.sources().forEach(sources::add);
            var levels = json.putObject("levels");
            node.levels().forEach(levels::put);
            var terminal = json.putArray("terminal_in");
            node.terminalIn().forEach(terminal::add);
        }
        var edgeArray = root.putArray("edges");
        for (Edge edge : edges) {
            var json = edgeArray.addObject();
            json.put("from", edge.from());
            json.put("to", edge.to());
            json.put("type", edge.type().name().toLowerCase(Locale.ROOT));
        }
        return root;
    }

    public enum NodeKind {
        STEP,
        INPUT
    }

    public enum EdgeType {
        GROUND_TRUTH,
        SAMPLE,
        INPUT
    }

    /**
     * @param sources source ids that produced this node, sorted
     * @param levels topological level of the node per source
     * @param terminalIn sources in which the node sits on the highest level
     */
    public record Node(
        String id,
        NodeKind kind,
        String variable,
        String expression,
        Set<String> sources,
        Map<String, Integer> levels,
        Set<String> terminalIn
    ) {
        public Node {
            sources = Collections.unmodifiableSet(new TreeSet<>(sources));
            levels = Collections.unmodifiableMap(new TreeMap<>(levels));
            terminalIn = Collections.unmodifiableSet(new TreeSet<>(terminalIn));
        }

        public boolean isGroundTruth() {
            return sources.contains(ReasoningDocumentProcessor.GROUND_TRUTH_SOURCE);
        }
    }

    public record Edge(String from, String to, EdgeType type) {}
}
