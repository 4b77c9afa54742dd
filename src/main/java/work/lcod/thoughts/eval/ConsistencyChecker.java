package work.lcod.thoughts.eval;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.thoughts.path.ReasoningPath;

/**
 * Checks that two computations agree on a binding, or that a computation reproduces an expected
 * answer. Disagreement is reported as {@link Verification.Status#MISMATCH}, never thrown.
 */
public final class ConsistencyChecker {
    public static final double DEFAULT_TOLERANCE = 1e-6;

    private static final Logger LOG = LoggerFactory.getLogger(ConsistencyChecker.class);

    private final double tolerance;

    public ConsistencyChecker() {
        this(DEFAULT_TOLERANCE);
    }

    public ConsistencyChecker(double tolerance) {
        if (!(tolerance >= 0) || Double.isInfinite(tolerance)) {
            throw new IllegalArgumentException("tolerance must be a finite non-negative number");
        }
        this.tolerance = tolerance;
    }

    public double tolerance() {
        return tolerance;
    }

    /**
     * Evaluates both paths on {@code binding} and compares every return variable.
     */
    public Verification compare(ReasoningPath original, ReasoningPath candidate, Map<String, ?> binding) {
        Map<String, Object> expected;
        Map<String, Object> actual;
        try {
            expected = PathEvaluator.evaluate(original, binding);
            actual = PathEvaluator.evaluate(candidate, binding);
        } catch (EvaluationException ex) {
            return new Verification(Verification.Status.ERROR, null, null, ex.getMessage());
        }
        if (!expected.keySet().equals(actual.keySet())) {
            return mismatch(expected, actual, "return variables differ: " + expected.keySet() + " vs " + actual.keySet());
        }
        for (var entry : expected.entrySet()) {
            if (!matches(entry.getValue(), actual.get(entry.getKey()))) {
                return mismatch(expected, actual, "return variable '" + entry.getKey() + "' differs");
            }
        }
        return new Verification(Verification.Status.CONSISTENT, expected, actual, null);
    }

    /**
     * Like {@link #compare} but tolerates differently named return variables when each side
     * returns exactly one value, as happens between independently written computations.
     */
    public Verification compareAnswers(ReasoningPath reference, ReasoningPath candidate, Map<String, ?> binding) {
        if (reference.returnVars().size() != 1 || candidate.returnVars().size() != 1) {
            return compare(reference, candidate, binding);
        }
        Map<String, Object> expected;
        Map<String, Object> actual;
        try {
            expected = PathEvaluator.evaluate(reference, binding);
            actual = PathEvaluator.evaluate(candidate, binding);
        } catch (EvaluationException ex) {
            return new Verification(Verification.Status.ERROR, null, null, ex.getMessage());
        }
        Object expectedValue = expected.values().iterator().next();
        Object actualValue = actual.values().iterator().next();
        if (!matches(expectedValue, actualValue)) {
            return mismatch(expected, actual, "returned values differ");
        }
        return new Verification(Verification.Status.CONSISTENT, expected, actual, null);
    }

    /**
     * Evaluates {@code path} on {@code binding}; consistent when a return variable equals
     * {@code expectedAnswer} within the tolerance.
     */
    public Verification checkAnswer(ReasoningPath path, Map<String, ?> binding, double expectedAnswer) {
        Map<String, Object> actual;
        try {
            actual = PathEvaluator.evaluate(path, binding);
        } catch (EvaluationException ex) {
            return new Verification(Verification.Status.ERROR, Map.of("answer", expectedAnswer), null, ex.getMessage());
        }
        var expected = new LinkedHashMap<String, Object>();
        expected.put("answer", expectedAnswer);
        if (actual.isEmpty()) {
            return new Verification(Verification.Status.ERROR, expected, actual, "computation declares no return variable");
        }
        for (Object value : actual.values()) {
            if (matches(expectedAnswer, value)) {
                return new Verification(Verification.Status.CONSISTENT, expected, actual, null);
            }
        }
        return mismatch(expected, actual, "no return variable equals the expected answer");
    }

    public boolean matches(Object expected, Object actual) {
        if (expected instanceof Number number) {
            expected = number.doubleValue();
        }
        if (actual instanceof Number number) {
            actual = number.doubleValue();
        }
        if (Values.isNumeric(expected) && Values.isNumeric(actual)) {
            double a = Values.toDouble(expected, "compare");
            double b = Values.toDouble(actual, "compare");
            if (Double.isNaN(a) || Double.isNaN(b)) {
                return Double.isNaN(a) && Double.isNaN(b);
            }
            return a == b || Math.abs(a - b) <= tolerance;
        }
        return Objects.equals(expected, actual) || Values.equal(expected, actual);
    }

    private Verification mismatch(Map<String, Object> expected, Map<String, Object> actual, String message) {
        LOG.warn("Evaluation mismatch: {} (expected {}, actual {})", message, expected, actual);
        return new Verification(Verification.Status.MISMATCH, expected, actual, message);
    }
}
