package work.lcod.thoughts.path;

import java.util.List;
import java.util.Objects;

/**
 * Result of {@link StepExtractor#extractDetailed}: the path plus the statements that were skipped.
 */
public record Extraction(ReasoningPath path, List<SkippedConstruct> skipped) {
    public Extraction {
        Objects.requireNonNull(path, "path");
        skipped = List.copyOf(skipped);
    }
}
