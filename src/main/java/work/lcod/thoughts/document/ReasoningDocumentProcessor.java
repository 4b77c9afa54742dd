package work.lcod.thoughts.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.thoughts.eval.AnswerExtractor;
import work.lcod.thoughts.eval.ConsistencyChecker;
import work.lcod.thoughts.eval.Verification;
import work.lcod.thoughts.graph.TopologicalLeveler;
import work.lcod.thoughts.path.ReasoningPath;
import work.lcod.thoughts.path.StepExtractor;
import work.lcod.thoughts.simplify.Simplifier;

/**
 * Annotates a reasoning document with the topological levels of its ground-truth computation and
 * of every sampled computation.
 *
 * <p>The input node is never modified. A computation that fails to parse or evaluate gets an
 * {@code error} object and processing moves on to the next one.
 */
public final class ReasoningDocumentProcessor {
    public static final String FACTUAL_ASSIGNMENT = "factual_assignment";
    public static final String GROUND_TRUTH_FUNCTION = "ground_truth_function";
    public static final String RESULTS = "results";
    public static final String FUNCTION = "function";
    public static final String FUNCTION_STR = "function_str";
    public static final String SAMPLE_ID = "sample_id";
    public static final String LEVELS = "reasoning_path_topological_levels";
    public static final String STALE_REASONING_PATH = "reasoning_path";
    public static final String GROUND_TRUTH_SOURCE = "ground_truth";

    private static final Logger LOG = LoggerFactory.getLogger(ReasoningDocumentProcessor.class);

    private final StepExtractor extractor;
    private final boolean simplify;
    private final Optional<ConsistencyChecker> verifier;

    public ReasoningDocumentProcessor(StepExtractor extractor, boolean simplify, ConsistencyChecker verifier) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.simplify = simplify;
        this.verifier = Optional.ofNullable(verifier);
    }

    public DocumentReport process(JsonNode input) {
        if (input == null || !input.isObject()) {
            throw new IllegalArgumentException("reasoning document must be a JSON object");
        }
        ObjectNode document = ((ObjectNode) input).deepCopy();
        Map<String, Object> binding = factualAssignment(document);
        var failures = new LinkedHashMap<String, Map<String, Object>>();
        int processed = 0;

        ReasoningPath groundTruth = null;
        JsonNode groundTruthNode = document.get(GROUND_TRUTH_FUNCTION);
        if (groundTruthNode != null && !groundTruthNode.isNull()) {
            ObjectNode item = normalizeGroundTruth(document, groundTruthNode);
            groundTruth = annotate(GROUND_TRUTH_SOURCE, item, item.path(FUNCTION_STR), binding, failures);
            processed++;
        }

        JsonNode results = document.path(RESULTS);
        if (results.isArray()) {
            int index = 0;
            for (JsonNode result : results) {
                String source = sourceId(result, index++);
                if (!result.isObject()) {
                    failures.put(source, ErrorReports.normalize(new IllegalArgumentException("result entry is not an object")));
                    continue;
                }
                ObjectNode item = (ObjectNode) result;
                ReasoningPath path = annotate(source, item, item.path(FUNCTION).path(FUNCTION_STR), binding, failures);
                processed++;
                if (path != null) {
                    verifySample(item, path, groundTruth, binding);
                }
            }
        }
        LOG.info("Processed {} computations, {} failed", processed, failures.size());
        return new DocumentReport(document, processed, failures);
    }

    private ObjectNode normalizeGroundTruth(ObjectNode document, JsonNode node) {
        if (node.isObject()) {
            return (ObjectNode) node;
        }
        ObjectNode normalized = document.objectNode();
        normalized.set(FUNCTION_STR, node.isTextual() ? node : document.textNode(node.toString()));
        document.set(GROUND_TRUTH_FUNCTION, normalized);
        return normalized;
    }

    private ReasoningPath annotate(
        String source,
        ObjectNode item,
        JsonNode functionStr,
        Map<String, Object> binding,
        Map<String, Map<String, Object>> failures
    ) {
        item.remove(STALE_REASONING_PATH);
        try {
            if (!functionStr.isTextual()) {
                throw new IllegalArgumentException("missing function_str for " + source);
            }
            ReasoningPath extracted = extractor.extract(functionStr.textValue(), binding.keySet());
            ReasoningPath path = simplify ? Simplifier.simplify(extracted) : extracted;
            item.set(LEVELS, StepRecords.toLevelSequence(TopologicalLeveler.levels(path).levels()));
            if (simplify && !binding.isEmpty()) {
                verifier.ifPresent(checker -> item.set(
                    "verification",
                    StepRecords.MAPPER.valueToTree(checker.compare(extracted, path, binding).toSerializableMap())
                ));
            }
            return path;
        } catch (RuntimeException ex) {
            Map<String, Object> error = ErrorReports.normalize(ex);
            LOG.warn("Skipping {}: {}", source, error.get("message"));
            item.set("error", StepRecords.MAPPER.valueToTree(error));
            failures.put(source, error);
            return null;
        }
    }

    private void verifySample(ObjectNode item, ReasoningPath path, ReasoningPath groundTruth, Map<String, Object> binding) {
        if (verifier.isEmpty() || binding.isEmpty()) {
            return;
        }
        ConsistencyChecker checker = verifier.get();
        if (groundTruth != null) {
            Verification verification = checker.compareAnswers(groundTruth, path, binding);
            if (verification.status() != Verification.Status.ERROR) {
                item.put("matches_ground_truth", verification.isConsistent());
            }
        }
        JsonNode reasoning = item.path(FUNCTION).path("source").path("reasoning_process");
        if (reasoning.isTextual()) {
            AnswerExtractor.extract(reasoning.textValue()).ifPresent(answer -> {
                Verification verification = checker.checkAnswer(path, binding, answer);
                if (verification.status() != Verification.Status.ERROR) {
                    item.put("matches_reasoning_process", verification.isConsistent());
                }
            });
        }
    }

    private static Map<String, Object> factualAssignment(ObjectNode document) {
        var binding = new LinkedHashMap<String, Object>();
        JsonNode assignment = document.path(FACTUAL_ASSIGNMENT);
        if (assignment.isObject()) {
            assignment.fields().forEachRemaining(entry -> {
                JsonNode value = entry.getValue();
                binding.put(entry.getKey(), value.isNumber() ? value.doubleValue() : StepRecords.MAPPER.convertValue(value, Object.class));
            });
        }
        return binding;
    }

    private static String sourceId(JsonNode result, int index) {
        JsonNode id = result.path(SAMPLE_ID);
        return "sample_" + (id.isMissingNode() || id.isNull() ? String.valueOf(index) : id.asText());
    }
}
