package work.lcod.thoughts.eval;

/**
 * Raised when a step expression cannot be evaluated over the given binding.
 */
public final class EvaluationException extends RuntimeException {
    public static final String CODE = "evaluation_error";

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }

    public String code() {
        return CODE;
    }
}
