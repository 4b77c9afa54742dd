package work.lcod.thoughts.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.thoughts.eval.EvaluationException;
import work.lcod.thoughts.expr.SourceParseException;
import work.lcod.thoughts.expr.SourceParser;

class ErrorReportsTest {
    @Test
    void parseErrorsCarryTheirPosition() {
        var error = assertThrows(SourceParseException.class, () -> SourceParser.parseProgram("x = (1 +\n"));

        var report = ErrorReports.normalize(error);

        assertEquals("parse_error", report.get("code"));
        @SuppressWarnings("unchecked")
        var data = (Map<String, Object>) report.get("data");
        assertEquals(error.line(), data.get("line"));
        assertEquals(error.column(), data.get("column"));
    }

    @Test
    void mapsKnownFailureTypes() {
        assertEquals("evaluation_error", ErrorReports.normalize(new EvaluationException("division by zero")).get("code"));
        assertEquals("invalid_input", ErrorReports.normalize(new IllegalArgumentException("bad")).get("code"));

        var unexpected = ErrorReports.normalize(new IllegalStateException());
        assertEquals("unexpected_error", unexpected.get("code"));
        assertEquals("Unexpected error", unexpected.get("message"));
        assertFalse(unexpected.containsKey("data"));
    }
}
