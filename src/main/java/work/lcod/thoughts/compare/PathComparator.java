package work.lcod.thoughts.compare;

import java.util.ArrayList;
import java.util.TreeSet;
import work.lcod.thoughts.path.ReasoningPath;
import work.lcod.thoughts.path.Step;

/**
 * Diffs two reasoning paths by variable-name equality over their symbol tables.
 *
 * <p>Matching is purely nominal: same-named steps computing unrelated values are reported as
 * changed, and differently named steps computing the same value are reported as unrelated.
 */
public final class PathComparator {
    private PathComparator() {}

    public static PathDiff compare(ReasoningPath first, ReasoningPath second) {
        var firstNames = new TreeSet<>(first.symbolTable().keySet());
        var secondNames = new TreeSet<>(second.symbolTable().keySet());

        var changed = new ArrayList<StepChange>();
        var unchanged = new ArrayList<String>();
        var onlyInFirst = new ArrayList<String>();
        for (String variable : firstNames) {
            if (!secondNames.contains(variable)) {
                onlyInFirst.add(variable);
                continue;
            }
            var a = shape(first, first.symbolTable().get(variable));
            var b = shape(second, second.symbolTable().get(variable));
            if (a.equals(b)) {
                unchanged.add(variable);
            } else {
                changed.add(new StepChange(variable, a, b));
            }
        }
        var onlyInSecond = new ArrayList<String>();
        for (String variable : secondNames) {
            if (!firstNames.contains(variable)) {
                onlyInSecond.add(variable);
            }
        }
        return new PathDiff(
            changed,
            unchanged,
            onlyInFirst,
            onlyInSecond,
            first.returnVars().equals(second.returnVars())
        );
    }

    private static StepChange.StepShape shape(ReasoningPath path, Step step) {
        var dependencies = new TreeSet<String>();
        for (int id : step.dependencies()) {
            path.step(id).ifPresent(dependency -> dependencies.add(dependency.variable()));
        }
        return new StepChange.StepShape(
            step.expression(),
            new ArrayList<>(dependencies),
            step.dependenciesInput()
        );
    }
}
