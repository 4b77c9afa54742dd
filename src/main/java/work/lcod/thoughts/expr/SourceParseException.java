package work.lcod.thoughts.expr;

/**
 * Raised when source text does not conform to the restricted computation grammar.
 */
public final class SourceParseException extends RuntimeException {
    public static final String CODE = "parse_error";

    private final int line;
    private final int column;

    public SourceParseException(String message, int line, int column) {
        super(message + " (line " + line + ", column " + column + ")");
        this.line = line;
        this.column = column;
    }

    public String code() {
        return CODE;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
