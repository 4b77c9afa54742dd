package work.lcod.thoughts.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.thoughts.path.ReasoningPath;
import work.lcod.thoughts.path.Step;

/**
 * Layered Kahn scheduling over step-to-step dependency edges. Input dependencies are not edges.
 * Every frontier is processed in ascending step id order, so the layering is deterministic.
 */
public final class TopologicalLeveler {
    private static final Logger LOG = LoggerFactory.getLogger(TopologicalLeveler.class);

    private TopologicalLeveler() {}

    public static Leveling levels(ReasoningPath path) {
        return levels(path.steps());
    }

    /**
     * Levels an arbitrary step list, e.g. one decoded from external records. Edges to ids that
     * are not part of the list are ignored. Of several steps sharing an id only the first is
     * leveled, and the result carries a warning.
     */
    public static Leveling levels(List<Step> steps) {
        var byId = new TreeMap<Integer, Step>();
        var duplicates = new TreeSet<Integer>();
        for (var step : steps) {
            if (byId.putIfAbsent(step.stepId(), step) != null) {
                duplicates.add(step.stepId());
            }
        }
        Map<Integer, Integer> inDegree = new TreeMap<>();
        Map<Integer, List<Integer>> dependents = new TreeMap<>();
        for (int id : byId.keySet()) {
            inDegree.put(id, 0);
            dependents.put(id, new ArrayList<>());
        }
        for (var step : byId.values()) {
            for (int dependency : step.dependencies()) {
                if (byId.containsKey(dependency)) {
                    dependents.get(dependency).add(step.stepId());
                    inDegree.merge(step.stepId(), 1, Integer::sum);
                }
            }
        }

        var frontier = new ArrayList<Integer>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                frontier.add(id);
            }
        });

        var levels = new ArrayList<Level>();
        int leveled = 0;
        int depth = 0;
        List<Integer> current = frontier;
        while (!current.isEmpty()) {
            var levelSteps = new ArrayList<Step>();
            var next = new ArrayList<Integer>();
            for (int id : current) {
                levelSteps.add(byId.get(id));
                for (int dependent : dependents.get(id)) {
                    int remaining = inDegree.merge(dependent, -1, Integer::sum);
                    if (remaining == 0) {
                        next.add(dependent);
                    }
                }
            }
            levels.add(new Level(depth, levelSteps));
            leveled += levelSteps.size();
            Collections.sort(next);
            current = next;
            depth++;
        }

        Optional<GraphIntegrityWarning> warning = Optional.empty();
        if (leveled != steps.size()) {
            var unleveled = new ArrayList<Integer>();
            inDegree.forEach((id, degree) -> {
                if (degree > 0) {
                    unleveled.add(id);
                }
            });
            var report = new GraphIntegrityWarning(steps.size(), leveled, unleveled, new ArrayList<>(duplicates));
            LOG.warn(report.message());
            warning = Optional.of(report);
        }
        return new Leveling(levels, warning);
    }
}
