package work.lcod.thoughts.api;

import java.util.Objects;
import work.lcod.thoughts.eval.ConsistencyChecker;
import work.lcod.thoughts.path.StepExtractor;

/**
 * Immutable settings for a {@link ThoughtGraphAnalyzer}.
 *
 * @param simplify whether paths are simplified before leveling
 * @param entryFunction name of the function treated as the computation
 * @param verify whether simplified paths are checked against the originals by evaluation
 * @param tolerance absolute tolerance used when comparing evaluated results
 */
public record AnalyzerConfiguration(boolean simplify, String entryFunction, boolean verify, double tolerance) {
    public AnalyzerConfiguration {
        Objects.requireNonNull(entryFunction, "entryFunction");
        if (entryFunction.isBlank()) {
            throw new IllegalArgumentException("entryFunction must not be blank");
        }
        if (!(tolerance >= 0) || Double.isInfinite(tolerance)) {
            throw new IllegalArgumentException("tolerance must be a finite non-negative number: " + tolerance);
        }
    }

    public static AnalyzerConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .simplify(simplify)
            .entryFunction(entryFunction)
            .verify(verify)
            .tolerance(tolerance);
    }

    public static final class Builder {
        private boolean simplify = true;
        private String entryFunction = StepExtractor.DEFAULT_ENTRY_FUNCTION;
        private boolean verify = true;
        private double tolerance = ConsistencyChecker.DEFAULT_TOLERANCE;

        public Builder simplify(boolean simplify) {
            this.simplify = simplify;
            return this;
        }

        public Builder entryFunction(String entryFunction) {
            this.entryFunction = entryFunction;
            return this;
        }

        public Builder verify(boolean verify) {
            this.verify = verify;
            return this;
        }

        public Builder tolerance(double tolerance) {
            this.tolerance = tolerance;
            return this;
        }

        public AnalyzerConfiguration build() {
            return new AnalyzerConfiguration(simplify, entryFunction, verify, tolerance);
        }
    }
}
