package work.lcod.thoughts.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.thoughts.path.Step;
import work.lcod.thoughts.path.StepExtractor;
import work.lcod.thoughts.support.ThoughtTestSupport;

class TopologicalLevelerTest {
    @Test
    void levelsTheWorkedExample() {
        var leveling = TopologicalLeveler.levels(ThoughtTestSupport.scenarioPath());

        assertTrue(leveling.isComplete());
        assertEquals(List.of(0, 1, 2), leveling.levels().stream().map(Level::level).toList());
        assertEquals(List.of(List.of(1, 4), List.of(2), List.of(3)), stepIds(leveling));
    }

    @Test
    void everyStepSitsOneAboveItsDeepestDependency() {
        var path = new StepExtractor().extract("""
            def solution(a, b, c):
                p = a * b
                q = b + c
                r = p - q
                s = p * 2
                t = r + s + q
                u = c / 4
                v = t + u
                return v
            """);

        var leveling = TopologicalLeveler.levels(path);

        assertTrue(leveling.isComplete());
        assertEquals(path.size(), leveling.leveledStepCount());
        for (Step step : path.steps()) {
            int expected = step.dependencies().stream()
                .mapToInt(id -> leveling.levelOf(id).orElseThrow() + 1)
                .max()
                .orElse(0);
            assertEquals(expected, leveling.levelOf(step.stepId()).orElseThrow(), step.variable());
        }
    }

    @Test
    void reportsCyclesWithoutInventingLevels() {
        var steps = List.of(
            new Step(1, "x", "y + 1", List.of(2), List.of()),
            new Step(2, "y", "x + 1", List.of(1), List.of()),
            new Step(3, "z", "5", List.of(), List.of())
        );

        var leveling = TopologicalLeveler.levels(steps);

        assertEquals(List.of(List.of(3)), stepIds(leveling));
        var warning = leveling.warning().orElseThrow();
        assertEquals(3, warning.totalSteps());
        assertEquals(1, warning.leveledSteps());
        assertEquals(List.of(1, 2), warning.unleveledStepIds());
        assertTrue(warning.message().contains("leveled 1 of 3"));
        assertTrue(leveling.levelOf(1).isEmpty());
    }

    @Test
    void reportsSelfReferences() {
        var leveling = TopologicalLeveler.levels(List.of(new Step(1, "x", "x + 1", List.of(1), List.of())));

        assertTrue(leveling.levels().isEmpty());
        assertEquals(List.of(1), leveling.warning().orElseThrow().unleveledStepIds());
    }

    @Test
    void warnsWhenStepsShareAnId() {
        var leveling = TopologicalLeveler.levels(List.of(
            new Step(1, "x", "a + 1", List.of(), List.of("a")),
            new Step(1, "y", "b + 1", List.of(), List.of("b"))
        ));

        assertFalse(leveling.isComplete());
        assertEquals(List.of(List.of(1)), stepIds(leveling));
        assertEquals("x", leveling.levels().get(0).steps().get(0).variable());
        var warning = leveling.warning().orElseThrow();
        assertEquals(2, warning.totalSteps());
        assertEquals(1, warning.leveledSteps());
        assertEquals(List.of(1), warning.duplicateStepIds());
        assertTrue(warning.unleveledStepIds().isEmpty());
        assertTrue(warning.message().contains("duplicate ids [1]"));
    }

    @Test
    void ignoresEdgesToUnknownSteps() {
        var leveling = TopologicalLeveler.levels(List.of(
            new Step(2, "y", "x * 2", List.of(1), List.of()),
            new Step(3, "z", "y + 1", List.of(2), List.of())
        ));

        assertTrue(leveling.isComplete());
        assertEquals(List.of(List.of(2), List.of(3)), stepIds(leveling));
    }

    @Test
    void emptyPathHasNoLevels() {
        var leveling = TopologicalLeveler.levels(List.of());

        assertTrue(leveling.isComplete());
        assertTrue(leveling.levels().isEmpty());
    }

    private static List<List<Integer>> stepIds(Leveling leveling) {
        return leveling.levels().stream()
            .map(level -> level.steps().stream().map(Step::stepId).toList())
            .toList();
    }
}
