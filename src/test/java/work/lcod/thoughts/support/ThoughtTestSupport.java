package work.lcod.thoughts.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import work.lcod.thoughts.path.ReasoningPath;
import work.lcod.thoughts.path.StepExtractor;

/**
 * Shared fixtures for the test suites.
 */
public final class ThoughtTestSupport {
    /** The worked example: one alias step and one dead step. */
    public static final String SCENARIO = "x = a + b; y = x; z = y * 2; unused = a - b; return z";

    public static final List<String> SCENARIO_PARAMETERS = List.of("a", "b");

    private static final ObjectMapper JSON = new ObjectMapper();

    private ThoughtTestSupport() {}

    public static ReasoningPath scenarioPath() {
        return new StepExtractor().extract(SCENARIO, SCENARIO_PARAMETERS);
    }

    public static ReasoningPath extract(String source) {
        return new StepExtractor().extract(source);
    }

    public static String resource(String name) {
        try (InputStream in = ThoughtTestSupport.class.getResourceAsStream("/" + name)) {
            if (in == null) {
                throw new IllegalStateException("missing test resource " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    public static JsonNode json(String resourceName) {
        try {
            return JSON.readTree(resource(resourceName));
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    public static Path resourcePath(String name) {
        return Path.of("src", "test", "resources").resolve(name).toAbsolutePath();
    }
}
