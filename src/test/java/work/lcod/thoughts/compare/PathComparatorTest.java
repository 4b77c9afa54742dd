package work.lcod.thoughts.compare;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.thoughts.path.StepExtractor;
import work.lcod.thoughts.support.ThoughtTestSupport;

class PathComparatorTest {
    private final StepExtractor extractor = new StepExtractor();

    @Test
    void identicalPathsHaveNoDifferences() {
        var diff = PathComparator.compare(ThoughtTestSupport.scenarioPath(), ThoughtTestSupport.scenarioPath());

        assertTrue(diff.isIdentical());
        assertEquals(List.of("unused", "x", "y", "z"), diff.unchanged());
    }

    @Test
    void reportsChangedAndUniqueVariables() {
        var first = extractor.extract("""
            def solution(a, b):
                x = a + b
                y = x * 2
                only_first = y - 1
                return y
            """);
        var second = extractor.extract("""
            def solution(a, b):
                x = a + b
                w = a
                y = w * 2
                only_second = 0
                return y
            """);

        var diff = PathComparator.compare(first, second);

        assertEquals(List.of("x"), diff.unchanged());
        assertEquals(List.of("only_first"), diff.onlyInFirst());
        assertEquals(List.of("only_second", "w"), diff.onlyInSecond());
        assertTrue(diff.returnVarsMatch());
        assertEquals(1, diff.changed().size());
        var change = diff.changed().get(0);
        assertEquals("y", change.variable());
        assertTrue(change.expressionChanged());
        assertTrue(change.dependenciesChanged());
        assertEquals(List.of("x"), change.first().dependencies());
        assertEquals(List.of("w"), change.second().dependencies());
    }

    @Test
    void comparesDependenciesByVariableNameNotStepId() {
        var first = extractor.extract("p = 1; q = 2; r = p + q; return r", List.of());
        var second = extractor.extract("q = 2; p = 1; r = p + q; return r", List.of());

        var diff = PathComparator.compare(first, second);

        assertTrue(diff.isIdentical());
    }

    @Test
    void sameValueUnderDifferentNamesIsNotMatched() {
        var first = extractor.extract("total = a * b; return total", List.of("a", "b"));
        var second = extractor.extract("product = a * b; return product", List.of("a", "b"));

        var diff = PathComparator.compare(first, second);

        assertEquals(List.of("total"), diff.onlyInFirst());
        assertEquals(List.of("product"), diff.onlyInSecond());
        assertFalse(diff.returnVarsMatch());
        assertFalse(diff.isIdentical());
    }
}
