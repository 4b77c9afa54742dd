package work.lcod.thoughts.eval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.thoughts.path.StepExtractor;
import work.lcod.thoughts.support.ThoughtTestSupport;

class PathEvaluatorTest {
    @Test
    void evaluatesStepsInOrder() {
        var path = new StepExtractor().extract("""
            def solution(eggs_per_day, price):
                eaten = 3
                baked = 4
                sold = eggs_per_day - eaten - baked
                revenue = sold * price
                return revenue
            """);

        assertEquals(Map.of("revenue", 18.0), PathEvaluator.evaluate(path, Map.of("eggs_per_day", 16, "price", 2)));
    }

    @Test
    void laterAssignmentsShadowEarlierOnes() {
        var path = new StepExtractor().extract("x = a; x = x * 10; y = x + 1; return y", List.of("a"));

        assertEquals(Map.of("y", 21.0), PathEvaluator.evaluate(path, Map.of("a", 2.0)));
    }

    @Test
    void requiresEveryParameter() {
        var error = assertThrows(
            EvaluationException.class,
            () -> PathEvaluator.evaluate(ThoughtTestSupport.scenarioPath(), Map.of("a", 1.0))
        );

        assertTrue(error.getMessage().contains("'b'"));
    }

    @Test
    void namesTheFailingStep() {
        var path = new StepExtractor().extract("x = a - a; y = a / x; return y", List.of("a"));

        var error = assertThrows(EvaluationException.class, () -> PathEvaluator.evaluate(path, Map.of("a", 5.0)));

        assertTrue(error.getMessage().startsWith("step 2 (y = a / x)"), error.getMessage());
    }

    @Test
    void failsWhenAReturnVariableIsNeverAssigned() {
        var path = new StepExtractor().extract("def solution(a):\n    x = a\n    return missing\n");

        assertThrows(EvaluationException.class, () -> PathEvaluator.evaluate(path, Map.of("a", 1.0)));
    }
}
