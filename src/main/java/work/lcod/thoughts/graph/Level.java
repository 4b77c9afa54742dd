package work.lcod.thoughts.graph;

import java.util.List;
import work.lcod.thoughts.path.Step;

/**
 * One layer of a topological layering; steps are ordered by ascending id.
 */
public record Level(int level, List<Step> steps) {
    public Level {
        if (level < 0) {
            throw new IllegalArgumentException("level must be non-negative: " + level);
        }
        steps = List.copyOf(steps);
    }
}
