package work.lcod.thoughts.compare;

import java.util.List;

/**
 * Structural difference between two reasoning paths aligned by variable name.
 * Variable lists are sorted.
 */
public record PathDiff(
    List<StepChange> changed,
    List<String> unchanged,
    List<String> onlyInFirst,
    List<String> onlyInSecond,
    boolean returnVarsMatch
) {
    public PathDiff {
        changed = List.copyOf(changed);
        unchanged = List.copyOf(unchanged);
        onlyInFirst = List.copyOf(onlyInFirst);
        onlyInSecond = List.copyOf(onlyInSecond);
    }

    public boolean isIdentical() {
        return changed.isEmpty() && onlyInFirst.isEmpty() && onlyInSecond.isEmpty() && returnVarsMatch;
    }
}
