package work.lcod.thoughts.document;

import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.thoughts.eval.EvaluationException;
import work.lcod.thoughts.expr.SourceParseException;

/**
 * Converts failures into the {@code {code, message[, data]}} shape attached to document items
 * and analysis results.
 */
public final class ErrorReports {
    public static final String INVALID_INPUT = "invalid_input";
    public static final String UNEXPECTED_ERROR = "unexpected_error";

    private ErrorReports() {}

    public static Map<String, Object> normalize(Throwable error) {
        if (error instanceof SourceParseException parse) {
            var data = new LinkedHashMap<String, Object>();
            data.put("line", parse.line());
            data.put("column", parse.column());
            return toMap(parse.code(), parse.getMessage(), data);
        }
        if (error instanceof EvaluationException evaluation) {
            return toMap(evaluation.code(), evaluation.getMessage(), null);
        }
        if (error instanceof IllegalArgumentException) {
            return toMap(INVALID_INPUT, messageOf(error), null);
        }
        if (error == null) {
            return toMap(UNEXPECTED_ERROR, "Unexpected error", null);
        }
        return toMap(UNEXPECTED_ERROR, messageOf(error), null);
    }

    private static String messageOf(Throwable error) {
        return error.getMessage() != null && !error.getMessage().isBlank()
            ? error.getMessage()
            : "Unexpected error";
    }

    private static Map<String, Object> toMap(String code, String message, Object data) {
        var map = new LinkedHashMap<String, Object>();
        map.put("code", code);
        map.put("message", message);
        if (data != null) {
            map.put("data", data);
        }
        return map;
    }
}
