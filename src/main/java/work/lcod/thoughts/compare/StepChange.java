package work.lcod.thoughts.compare;

import java.util.List;
import java.util.Objects;

/**
 * A variable assigned in both paths whose final steps differ.
 */
public record StepChange(String variable, StepShape first, StepShape second) {
    public StepChange {
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
    }

    public boolean expressionChanged() {
        return !first.expression().equals(second.expression());
    }

    public boolean dependenciesChanged() {
        return !first.dependencies().equals(second.dependencies()) || !first.inputs().equals(second.inputs());
    }

    /**
     * Comparable view of a step: its expression, the variable names of the steps it depends on
     * and its input parameters. Step ids are not comparable across paths.
     */
    public record StepShape(String expression, List<String> dependencies, List<String> inputs) {
        public StepShape {
            dependencies = List.copyOf(dependencies);
            inputs = List.copyOf(inputs);
        }
    }
}
