package work.lcod.thoughts.path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.thoughts.expr.SourceParseException;
import work.lcod.thoughts.support.ThoughtTestSupport;

class StepExtractorTest {
    @Test
    void extractsTheWorkedExample() {
        var path = ThoughtTestSupport.scenarioPath();

        assertEquals(List.of(
            new Step(1, "x", "a + b", List.of(), List.of("a", "b")),
            new Step(2, "y", "x", List.of(1), List.of()),
            new Step(3, "z", "y * 2", List.of(2), List.of()),
            new Step(4, "unused", "a - b", List.of(), List.of("a", "b"))
        ), path.steps());
        assertEquals(List.of("z"), path.returnVars());
        assertEquals(4, path.symbolTable().get("unused").stepId());
    }

    @Test
    void extractionIsDeterministic() {
        String source = """
            def solution(price, quantity, discount):
                subtotal = price * quantity
                savings = subtotal * discount
                total = subtotal - savings
                return total
            """;
        var extractor = new StepExtractor();

        assertEquals(extractor.extract(source), extractor.extract(source));
    }

    @Test
    void usesFunctionParametersAndIgnoresOtherTopLevelCode() {
        var extraction = new StepExtractor().extractDetailed("""
            import math

            def helper(q):
                return q

            def solution(eggs_per_day, price):
                eaten = 3
                sold = eggs_per_day - eaten
                revenue = sold * price
                return revenue

            print(solution(16, 2))
            """, List.of());
        var path = extraction.path();

        assertEquals(List.of("eggs_per_day", "price"), path.parameters());
        assertEquals(3, path.size());
        var sold = path.stepByVariable("sold").orElseThrow();
        assertEquals(List.of(1), sold.dependencies());
        assertEquals(List.of("eggs_per_day"), sold.dependenciesInput());
        assertEquals(List.of("revenue"), path.returnVars());
        assertEquals(3, extraction.skipped().size());
    }

    @Test
    void honorsConfiguredEntryFunction() {
        String source = """
            def first(a):
                x = a + 1
                return x

            def second(b):
                y = b * 2
                return y
            """;

        assertEquals("x", new StepExtractor("missing").extract(source).steps().get(0).variable());
        assertEquals("y", new StepExtractor("second").extract(source).steps().get(0).variable());
    }

    @Test
    void parametersWinOverLocalsAndUnresolvedNamesAreDropped() {
        var path = new StepExtractor().extract("""
            def solution(a):
                a2 = a * 2
                a = a2 + 1
                b = a + unknown + round(a2)
                return b
            """);

        var reassigned = path.steps().get(1);
        assertEquals(List.of(1), reassigned.dependencies());
        assertEquals(List.of(), reassigned.dependenciesInput());

        var b = path.stepByVariable("b").orElseThrow();
        assertEquals(List.of(1), b.dependencies());
        assertEquals(List.of("a"), b.dependenciesInput());
    }

    @Test
    void latestAssignmentWinsForLaterSteps() {
        var path = ThoughtTestSupport.extract("x = 1\ny = x + 1\nx = y * 3\nz = x + y\nreturn z");

        var z = path.stepByVariable("z").orElseThrow();
        assertEquals(List.of(2, 3), z.dependencies());
        assertEquals(3, path.symbolTable().get("x").stepId());
        assertEquals(4, path.size());
    }

    @Test
    void selfReferenceIsNotADependency() {
        var path = new StepExtractor().extract("total = 1\ntotal = total + 2\nreturn total", List.of());

        assertEquals(List.of(), path.steps().get(1).dependencies());
    }

    @Test
    void skipsUnsupportedStatementsButCollectsTheirReturns() {
        var extraction = new StepExtractor().extractDetailed("""
            def solution(a, b):
                big, small = a, b
                a += 1
                if a > b:
                    winner = a
                    return winner
                else:
                    return b
                result = a * b
                return result
            """, List.of());
        var path = extraction.path();

        assertEquals(List.of("result"), path.steps().stream().map(Step::variable).toList());
        assertEquals(List.of("b", "result", "winner"), path.returnVars());
        var constructs = extraction.skipped().stream().map(SkippedConstruct::construct).toList();
        assertEquals(List.of("destructuring assignment", "augmented assignment", "if block", "else block"), constructs);
    }

    @Test
    void compoundReturnsContributeNoReturnVariables() {
        var path = ThoughtTestSupport.extract("def solution(a):\n    x = a\n    return x + 1\n");

        assertTrue(path.returnVars().isEmpty());
    }

    @Test
    void failsOnSourceThatDoesNotParse() {
        var error = assertThrows(SourceParseException.class, () -> new StepExtractor().extract("x = (a +", List.of("a")));
        assertEquals("parse_error", error.code());
    }
}
