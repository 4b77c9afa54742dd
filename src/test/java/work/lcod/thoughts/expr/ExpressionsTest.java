package work.lcod.thoughts.expr;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ExpressionsTest {
    @Test
    void collectsIdentifiersInEncounterOrder() {
        var expression = SourceParser.parseExpression("round(b * a + b, digits) + math.pi + f(x=c)");

        assertEquals(List.of("round", "b", "a", "digits", "math", "f", "c"), List.copyOf(Expressions.referencedNames(expression)));
    }

    @Test
    void literalsReferenceNothing() {
        assertEquals(List.of(), List.copyOf(Expressions.referencedNames(SourceParser.parseExpression("1 + 2.5 * 'x'"))));
    }

    @Test
    void renamesIdentifiersButNotAttributesOrKeywords() {
        var expression = SourceParser.parseExpression("y * 2 + y.y + g(y=y)");

        var renamed = Expressions.rename(expression, Map.of("y", "x"));

        assertEquals("x * 2 + x.y + g(y=x)", renamed.render());
        assertEquals("y * 2 + y.y + g(y=y)", expression.render());
    }
}
