package work.lcod.thoughts.path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class ReasoningPathTest {
    @Test
    void rejectsNonIncreasingIds() {
        var builder = ReasoningPath.builder(List.of("a"))
            .append(new Step(2, "x", "a", List.of(), List.of("a")));

        assertThrows(IllegalArgumentException.class, () -> builder.append(new Step(2, "y", "x", List.of(2), List.of())));
    }

    @Test
    void rejectsForwardSelfAndUndeclaredReferences() {
        var builder = ReasoningPath.builder(List.of("a"))
            .append(new Step(1, "x", "a", List.of(), List.of("a")));

        assertThrows(IllegalArgumentException.class, () -> builder.append(new Step(2, "y", "y", List.of(2), List.of())));
        assertThrows(IllegalArgumentException.class, () -> builder.append(new Step(2, "y", "z", List.of(5), List.of())));
        assertThrows(IllegalArgumentException.class, () -> builder.append(new Step(2, "y", "q", List.of(), List.of("q"))));
        assertThrows(IllegalArgumentException.class, () -> new Step(0, "y", "1", List.of(), List.of()));
    }

    @Test
    void normalizesDependencyCollections() {
        var step = new Step(3, "z", "b + a + y", List.of(2, 1, 2), List.of("b", "a", "b"));

        assertEquals(List.of(1, 2), step.dependencies());
        assertEquals(List.of("a", "b"), step.dependenciesInput());
        assertEquals("Step 3: Calculate z = b + a + y (depends on Step 1, Step 2) (input deps: a, b)", step.toString());
    }

    @Test
    void symbolTableTracksLatestStepAndKeepsShadowedOnes() {
        var path = ReasoningPath.builder(List.of())
            .append(new Step(1, "x", "1", List.of(), List.of()))
            .append(new Step(2, "x", "2", List.of(), List.of()))
            .returnVar("x")
            .returnVar("x")
            .build();

        assertEquals(2, path.size());
        assertEquals(2, path.symbolTable().get("x").stepId());
        assertEquals(List.of("x"), path.returnVars());
        assertTrue(path.step(1).isPresent());
    }

    @Test
    void collectsInputDependencies() {
        var path = ReasoningPath.builder(List.of("b", "a"))
            .append(new Step(1, "x", "b", List.of(), List.of("b")))
            .append(new Step(2, "y", "a + x", List.of(1), List.of("a")))
            .build();

        assertEquals(List.of("a", "b"), path.inputDependencies());
        assertEquals(List.of("b", "a"), path.parameters());
    }
}
