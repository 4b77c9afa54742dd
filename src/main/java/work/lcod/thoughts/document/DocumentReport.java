package work.lcod.thoughts.document;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Annotated copy of a reasoning document plus the per-computation failures met while processing
 * it, keyed by source id ({@code ground_truth}, {@code sample_N}).
 */
public record DocumentReport(ObjectNode document, int processed, Map<String, Map<String, Object>> failures) {
    public DocumentReport {
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
