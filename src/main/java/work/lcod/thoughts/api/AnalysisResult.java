package work.lcod.thoughts.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.thoughts.document.StepRecords;
import work.lcod.thoughts.eval.Verification;
import work.lcod.thoughts.graph.Leveling;
import work.lcod.thoughts.path.ReasoningPath;
import work.lcod.thoughts.path.SkippedConstruct;

/**
 * Outcome of {@link ThoughtGraphAnalyzer#analyze}. {@code path} is the simplified path when
 * simplification is enabled, {@code extracted} the path as extracted.
 */
public record AnalysisResult(
    Status status,
    ReasoningPath extracted,
    ReasoningPath path,
    Leveling leveling,
    List<SkippedConstruct> skipped,
    Optional<Verification> verification,
    Map<String, Object> error
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public AnalysisResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(extracted, "extracted");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(leveling, "leveling");
        skipped = List.copyOf(skipped);
        Objects.requireNonNull(verification, "verification");
        error = Collections.unmodifiableMap(new LinkedHashMap<>(error));
    }

    public static AnalysisResult failure(Map<String, Object> error) {
        return new AnalysisResult(
            Status.FAILURE,
            ReasoningPath.empty(),
            ReasoningPath.empty(),
            new Leveling(List.of(), Optional.empty()),
            List.of(),
            Optional.empty(),
            error
        );
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        if (status == Status.FAILURE) {
            serializable.put("error", error);
            return serializable;
        }
        serializable.put("return_vars", path.returnVars());
        serializable.put(
            "reasoning_path_topological_levels",
            StepRecords.toLevelSequence(leveling.levels())
        );
        leveling.warning().ifPresent(warning -> serializable.put("warning", warning.message()));
        if (!skipped.isEmpty()) {
            var constructs = new ArrayList<Map<String, Object>>();
            for (SkippedConstruct construct : skipped) {
                var entry = new LinkedHashMap<String, Object>();
                entry.put("construct", construct.construct());
                entry.put("line", construct.line());
                constructs.add(entry);
            }
            serializable.put("skipped", constructs);
        }
        verification.ifPresent(value -> serializable.put("verification", value.toSerializableMap()));
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public enum Status {
        SUCCESS,
        WARNING,
        FAILURE
    }
}
