package work.lcod.thoughts.graph;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import work.lcod.thoughts.path.Step;

/**
 * Levels computed by {@link TopologicalLeveler}, plus the integrity warning when some steps could
 * not be placed (the levels then hold only the steps that could).
 */
public record Leveling(List<Level> levels, Optional<GraphIntegrityWarning> warning) {
    public Leveling {
        levels = List.copyOf(levels);
        Objects.requireNonNull(warning, "warning");
    }

    public boolean isComplete() {
        return warning.isEmpty();
    }

    public OptionalInt levelOf(int stepId) {
        for (var level : levels) {
            for (Step step : level.steps()) {
                if (step.stepId() == stepId) {
                    return OptionalInt.of(level.level());
                }
            }
        }
        return OptionalInt.empty();
    }

    public int leveledStepCount() {
        return levels.stream().mapToInt(level -> level.steps().size()).sum();
    }
}
