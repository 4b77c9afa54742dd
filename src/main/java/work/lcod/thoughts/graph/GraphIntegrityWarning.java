package work.lcod.thoughts.graph;

import java.util.List;

/**
 * Reported when leveling could not place every step: the dependency edges contain a cycle or a
 * self reference, or several steps share an id and only the first of them was kept.
 */
public record GraphIntegrityWarning(
    int totalSteps,
    int leveledSteps,
    List<Integer> unleveledStepIds,
    List<Integer> duplicateStepIds
) {
    public GraphIntegrityWarning {
        unleveledStepIds = List.copyOf(unleveledStepIds);
        duplicateStepIds = List.copyOf(duplicateStepIds);
    }

    public String message() {
        var text = new StringBuilder("Cycle detected or node missing in topological sort: leveled ")
            .append(leveledSteps).append(" of ").append(totalSteps).append(" steps, unleveled ").append(unleveledStepIds);
        if (!duplicateStepIds.isEmpty()) {
            text.append(", duplicate ids ").append(duplicateStepIds);
        }
        return text.toString();
    }
}
