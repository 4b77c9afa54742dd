package work.lcod.thoughts.path;

/**
 * A statement that was not turned into a step because it lies outside the restricted grammar.
 * Skipping is not an error.
 */
public record SkippedConstruct(String construct, int line) {}
