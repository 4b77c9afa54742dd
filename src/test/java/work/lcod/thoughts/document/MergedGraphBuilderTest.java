package work.lcod.thoughts.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.lcod.thoughts.eval.ConsistencyChecker;
import work.lcod.thoughts.path.StepExtractor;
import work.lcod.thoughts.support.ThoughtTestSupport;

class MergedGraphBuilderTest {
    private MergedGraph graph;

    @BeforeEach
    void buildGraph() {
        var processor = new ReasoningDocumentProcessor(new StepExtractor(), true, new ConsistencyChecker());
        var annotated = processor.process(ThoughtTestSupport.json("documents/egg-sales.json")).document();
        graph = MergedGraphBuilder.build(annotated);
    }

    @Test
    void createsInputNodesFirst() {
        var eggs = graph.input("eggs_per_day").orElseThrow();

        assertEquals("node_0", eggs.id());
        assertEquals("Input: eggs_per_day", eggs.expression());
        assertEquals(Set.of("ground_truth", "sample_0", "sample_1", "sample_2"), eggs.sources());
    }

    @Test
    void sharesStepsWithTheSameVariableAndExpression() {
        var remaining = graph.step("remaining", "eggs_per_day - eaten - baked").orElseThrow();

        assertEquals(Set.of("ground_truth", "sample_2"), remaining.sources());
        assertTrue(remaining.isGroundTruth());
        assertEquals(0, remaining.levels().get("sample_2"));

        var sampleRevenue = graph.step("revenue", "remaining * price + 8").orElseThrow();
        assertFalse(sampleRevenue.isGroundTruth());
        assertEquals(Set.of("sample_2"), sampleRevenue.terminalIn());
    }

    @Test
    void typesEdgesByOrigin() {
        var remaining = graph.step("remaining", "eggs_per_day - eaten - baked").orElseThrow();
        var revenue = graph.step("revenue", "remaining * price").orElseThrow();
        var sampleRevenue = graph.step("revenue", "remaining * price + 8").orElseThrow();
        var price = graph.input("price").orElseThrow();

        assertTrue(graph.edges().contains(new MergedGraph.Edge(remaining.id(), revenue.id(), MergedGraph.EdgeType.GROUND_TRUTH)));
        assertTrue(graph.edges().contains(new MergedGraph.Edge(remaining.id(), sampleRevenue.id(), MergedGraph.EdgeType.SAMPLE)));
        assertTrue(graph.edges().contains(new MergedGraph.Edge(price.id(), revenue.id(), MergedGraph.EdgeType.INPUT)));
        assertEquals(graph.edges().size(), Set.copyOf(graph.edges()).size());
    }

    @Test
    void serializesToJson() {
        var json = graph.toJsonNode();

        assertEquals(graph.nodes().size(), json.get("nodes").size());
        assertEquals("input", json.get("nodes").get(0).get("kind").textValue());
        assertEquals(graph.edges().size(), json.get("edges").size());
    }
}
