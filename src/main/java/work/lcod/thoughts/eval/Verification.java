package work.lcod.thoughts.eval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Outcome of an evaluation-based consistency check.
 */
public record Verification(Status status, Map<String, Object> expected, Map<String, Object> actual, String message) {
    public enum Status {
        CONSISTENT,
        MISMATCH,
        ERROR
    }

    public Verification {
        expected = expected == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(expected));
        actual = actual == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(actual));
        message = message == null ? "" : message;
    }

    public boolean isConsistent() {
        return status == Status.CONSISTENT;
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("status", status.name().toLowerCase(Locale.ROOT));
        map.put("expected", expected);
        map.put("actual", actual);
        if (!message.isEmpty()) {
            map.put("message", message);
        }
        return map;
    }
}
