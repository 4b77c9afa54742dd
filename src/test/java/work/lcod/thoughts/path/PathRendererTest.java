package work.lcod.thoughts.path;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.thoughts.support.ThoughtTestSupport;

class PathRendererTest {
    @Test
    void rendersFunctionSource() {
        assertEquals("""
            def solution(a, b):
                x = a + b
                y = x
                z = y * 2
                unused = a - b
                return z
            """, PathRenderer.render(ThoughtTestSupport.scenarioPath()));
    }

    @Test
    void extractingTheRenderingReproducesThePath() {
        var original = new StepExtractor().extract("""
            def solution(hours, rate, bonus):
                base = hours * rate
                rate = rate * 1.5
                overtime = max(hours - 40, 0) * rate
                total = base + overtime + bonus
                base = total
                return base
            """);

        var reconstructed = new StepExtractor().extract(PathRenderer.render(original, "solution"));

        assertEquals(original, reconstructed);
    }

    @Test
    void rendersAnEmptyPath() {
        assertEquals("def f():\n    pass\n", PathRenderer.render(ReasoningPath.builder(List.of()).build(), "f"));
    }
}
