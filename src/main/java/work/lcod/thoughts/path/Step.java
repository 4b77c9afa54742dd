package work.lcod.thoughts.path;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * One assignment of a computation with its resolved dependencies. Both dependency collections
 * are stored deduplicated and sorted.
 *
 * @param stepId positive id, unique within a path
 * @param variable assigned identifier
 * @param expression canonical text of the right-hand side
 * @param dependencies ids of earlier steps read by the expression
 * @param dependenciesInput declared parameters read by the expression
 */
public record Step(
    int stepId,
    String variable,
    String expression,
    List<Integer> dependencies,
    List<String> dependenciesInput
) {
    public Step {
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(expression, "expression");
        if (stepId < 1) {
            throw new IllegalArgumentException("step id must be positive: " + stepId);
        }
        dependencies = normalize(dependencies);
        dependenciesInput = normalize(dependenciesInput);
    }

    private static <T extends Comparable<T>> List<T> normalize(Collection<T> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        return List.copyOf(new TreeSet<>(values));
    }

    @Override
    public String toString() {
        var text = new StringBuilder("Step ").append(stepId).append(": Calculate ").append(variable)
            .append(" = ").append(expression);
        if (!dependencies.isEmpty()) {
            text.append(" (depends on ")
                .append(dependencies.stream().map(id -> "Step " + id).collect(Collectors.joining(", ")))
                .append(')');
        }
        if (!dependenciesInput.isEmpty()) {
            text.append(" (input deps: ").append(String.join(", ", dependenciesInput)).append(')');
        }
        return text.toString();
    }
}
