package work.lcod.thoughts.expr;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.thoughts.path.StepExtractor;

class SourceParserTest {
    @Test
    void parsesFunctionHeaderAndBody() {
        var program = SourceParser.parseProgram("""
            def solution(price: float, count=2, *args, **kwargs) -> float:
                total = price * count
                return total
            """);

        var function = program.function("solution").orElseThrow();
        assertEquals(List.of("price", "count"), function.parameters());
        assertEquals(2, function.body().size());
        var assignment = assertInstanceOf(Statement.Assignment.class, function.body().get(0));
        assertEquals("total", assignment.target());
        assertEquals("price * count", assignment.value().render());
        var ret = assertInstanceOf(Statement.Return.class, function.body().get(1));
        assertEquals("total", ret.variable().orElseThrow());
    }

    @Test
    void normalizesWhitespaceAndRedundantParentheses() {
        assertEquals("a + b * c", SourceParser.parseExpression("a+(b*c)").render());
        assertEquals("(a + b) * c", SourceParser.parseExpression("( a + b )*c").render());
        assertEquals("a - (b - c)", SourceParser.parseExpression("a-(b-c)").render());
        assertEquals("a - b - c", SourceParser.parseExpression("(a-b)-c").render());
        assertEquals("(a ** b) ** c", SourceParser.parseExpression("(a**b)**c").render());
        assertEquals("a ** b ** c", SourceParser.parseExpression("a**(b**c)").render());
        assertEquals("(-2) ** 2", SourceParser.parseExpression("(-2)**2").render());
        assertEquals("-x ** 2", SourceParser.parseExpression("-(x**2)").render());
        assertEquals("round(total / 3, 2)", SourceParser.parseExpression("round( total/3 ,2 )").render());
        assertEquals("math.sqrt(x)", SourceParser.parseExpression("math . sqrt(x)").render());
        assertEquals("values[0] + values[-1]", SourceParser.parseExpression("values[0]+values[-1]").render());
        assertEquals("'it\\'s'", SourceParser.parseExpression("\"it's\"").render());
        assertEquals("[1, 2, 3]", SourceParser.parseExpression("[1,2,3]").render());
        assertEquals("(1,)", SourceParser.parseExpression("(1,)").render());
        assertEquals("min(a, b, key=c)", SourceParser.parseExpression("min(a,b,key=c)").render());
    }

    @Test
    void normalizesNumericLiterals() {
        assertEquals("1000", SourceParser.parseExpression("1_000").render());
        assertEquals("2.5", SourceParser.parseExpression("2.50").render());
        assertEquals("100.0", SourceParser.parseExpression("100.").render());
        assertEquals("1000.0", SourceParser.parseExpression("1e3").render());
        assertEquals("0.5", SourceParser.parseExpression(".5").render());
    }

    @Test
    void rendersBooleanAndComparisonOperators() {
        assertEquals("a < b <= c", SourceParser.parseExpression("a<b<=c").render());
        assertEquals("x not in items and y is not None", SourceParser.parseExpression("x not in items and (y is not None)").render());
        assertEquals("(a or b) and not c", SourceParser.parseExpression("(a or b) and not c").render());
        assertEquals("a or b and c", SourceParser.parseExpression("a or (b and c)").render());
    }

    @Test
    void renderingIsStableUnderReparsing() {
        for (String text : List.of(
            "(a + b) * -c / 2",
            "a // b % c ** -d",
            "max(a, b) - min(c, d) + abs(e)",
            "not (a == b) or c != d",
            "items[i + 1].value * 1.5",
            "'x' + \"y\\n\""
        )) {
            String rendered = SourceParser.parseExpression(text).render();
            assertEquals(rendered, SourceParser.parseExpression(rendered).render(), text);
        }
    }

    @Test
    void treatsStatementsOutsideTheGrammarAsUnsupported() {
        var program = SourceParser.parseProgram("""
            import math
            a, b = 1, 2
            items[0] = 3
            obj.value = 4
            x = y = 5
            count += 1
            total: float = 2.0
            print(total)
            if total > 1:
                return total
            else:
                pass
            for i in range(3):
                count = count + i
            """);

        var constructs = program.statements().stream()
            .map(statement -> assertInstanceOf(Statement.Unsupported.class, statement).construct())
            .toList();
        assertEquals(List.of(
            "import",
            "destructuring assignment",
            "subscript assignment",
            "attribute assignment",
            "multi-target assignment",
            "augmented assignment",
            "annotated assignment",
            "expression statement",
            "if block",
            "else block",
            "for block"
        ), constructs);
        var ifBlock = (Statement.Unsupported) program.statements().get(8);
        assertInstanceOf(Statement.Return.class, ifBlock.body().get(0));
    }

    @Test
    void joinsBracketedLinesAndIgnoresComments() {
        var program = SourceParser.parseProgram("""
            # header comment
            total = (a +
                     b)  # trailing

            other = total * \\
                2
            """);

        assertEquals(2, program.statements().size());
        var other = (Statement.Assignment) program.statements().get(1);
        assertEquals("total * 2", other.value().render());
    }

    @Test
    void rejectsUnsupportedExpressions() {
        var lambda = assertThrows(SourceParseException.class, () -> SourceParser.parseProgram("f = lambda x: x"));
        assertTrue(lambda.getMessage().contains("lambda"));
        assertThrows(SourceParseException.class, () -> SourceParser.parseExpression("a if b else c"));
        assertThrows(SourceParseException.class, () -> SourceParser.parseExpression("[x for x in items]"));
        assertThrows(SourceParseException.class, () -> SourceParser.parseExpression("{'a': 1}"));
        assertThrows(SourceParseException.class, () -> SourceParser.parseExpression("items[1:2]"));
    }

    @Test
    void reportsPositionOfSyntaxErrors() {
        var error = assertThrows(SourceParseException.class, () -> SourceParser.parseProgram("x = 1\ny = (2 +\n"));
        assertEquals(SourceParseException.CODE, error.code());
        assertTrue(error.line() >= 2);

        var dangling = assertThrows(SourceParseException.class, () -> SourceParser.parseProgram("x = 1 +"));
        assertEquals(1, dangling.line());
    }

    @Test
    void rejectsNonAsciiDigits() {
        var error = assertThrows(
            SourceParseException.class,
            () -> new StepExtractor().extract("x = \u0661.\u0665 * a\nreturn x", List.of("a"))
        );
        assertEquals(1, error.line());
        assertEquals(5, error.column());

        assertThrows(SourceParseException.class, () -> SourceParser.parseExpression("1\u0665"));
    }

    @Test
    void rejectsInconsistentIndentation() {
        assertThrows(SourceParseException.class, () -> SourceParser.parseProgram("""
            def solution(a):
                x = a
              return x
            """));
    }
}
