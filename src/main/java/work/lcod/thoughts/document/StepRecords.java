package work.lcod.thoughts.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import work.lcod.thoughts.graph.Level;
import work.lcod.thoughts.path.Step;

/**
 * JSON codec for step records and level sequences ({@code [[level, [step, ...]], ...]}).
 *
 * <p>Decoding is lenient: entries with the wrong shape are skipped rather than rejected, since
 * level sequences usually come from files written by other tools.
 */
public final class StepRecords {
    public static final String STEP_ID = "step_id";
    public static final String VARIABLE = "variable";
    public static final String EXPRESSION = "expression";
    public static final String DEPENDENCIES = "dependencies";
    public static final String DEPENDENCIES_INPUT = "dependencies_input";

    static final ObjectMapper MAPPER = new ObjectMapper();

    private StepRecords() {}

    public static ObjectNode toNode(Step step) {
        var node = MAPPER.createObjectNode();
        node.put(STEP_ID, step.stepId());
        node.put(VARIABLE, step.variable());
        node.put(EXPRESSION, step.expression());
        var dependencies = node.putArray(DEPENDENCIES);
        step.dependencies().forEach(dependencies::add);
        var inputs = node.putArray(DEPENDENCIES_INPUT);
        step.dependenciesInput().forEach(inputs::add);
        return node;
    }

    public static ArrayNode toLevelSequence(List<Level> levels) {
        var sequence = MAPPER.createArrayNode();
        for (Level level : levels) {
            var pair = sequence.addArray();
            pair.add(level.level());
            var steps = pair.addArray();
            level.steps().forEach(step -> steps.add(toNode(step)));
        }
        return sequence;
    }

    public static Optional<Step> fromNode(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        JsonNode id = node.get(STEP_ID);
        JsonNode variable = node.get(VARIABLE);
        JsonNode expression = node.get(EXPRESSION);
        if (id == null || !id.canConvertToInt() || !id.isIntegralNumber() || id.intValue() < 1) {
            return Optional.empty();
        }
        if (variable == null || !variable.isTextual() || expression == null || !expression.isTextual()) {
            return Optional.empty();
        }
        var dependencies = new ArrayList<Integer>();
        JsonNode dependencyNodes = node.path(DEPENDENCIES);
        if (dependencyNodes.isArray()) {
            dependencyNodes.forEach(dependency -> {
                if (dependency.isIntegralNumber() && dependency.canConvertToInt()) {
                    dependencies.add(dependency.intValue());
                }
            });
        }
        var inputs = new ArrayList<String>();
        JsonNode inputNodes = node.path(DEPENDENCIES_INPUT);
        if (inputNodes.isArray()) {
            inputNodes.forEach(input -> {
                if (input.isTextual()) {
                    inputs.add(input.textValue());
                }
            });
        }
        return Optional.of(new Step(id.intValue(), variable.textValue(), expression.textValue(), dependencies, inputs));
    }

    /**
     * Decodes a level sequence; levels are returned in ascending order and steps by ascending id.
     */
    public static List<Level> fromLevelSequence(JsonNode sequence) {
        var byLevel = new TreeMap<Integer, TreeMap<Integer, Step>>();
        if (sequence == null || !sequence.isArray()) {
            return List.of();
        }
        for (JsonNode pair : sequence) {
            if (!pair.isArray() || pair.size() != 2 || !pair.get(0).isIntegralNumber() || !pair.get(1).isArray()) {
                continue;
            }
            int level = pair.get(0).intValue();
            if (level < 0) {
                continue;
            }
            for (JsonNode stepNode : pair.get(1)) {
                fromNode(stepNode).ifPresent(step ->
                    byLevel.computeIfAbsent(level, ignored -> new TreeMap<>()).put(step.stepId(), step)
                );
            }
        }
        var levels = new ArrayList<Level>();
        byLevel.forEach((level, steps) -> levels.add(new Level(level, new ArrayList<>(steps.values()))));
        return levels;
    }

    /**
     * All steps of a level sequence, ordered by id; feed to the leveler to re-check a file.
     */
    public static List<Step> flatten(List<Level> levels) {
        var steps = new TreeMap<Integer, Step>();
        levels.forEach(level -> level.steps().forEach(step -> steps.putIfAbsent(step.stepId(), step)));
        return new ArrayList<>(steps.values());
    }
}
