package work.lcod.thoughts.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;

/**
 * Reads {@link AnalyzerConfiguration} from TOML:
 *
 * <pre>
 * [analysis]
 * simplify = true
 * entry_function = "solution"
 *
 * [verification]
 * enabled = true
 * tolerance = 1e-6
 * </pre>
 *
 * Missing keys keep their defaults. Unreadable files, syntax errors, mistyped values and
 * out-of-range values all yield {@link Optional#empty()}.
 */
public final class AnalyzerConfigurationLoader {
    private static final Logger LOG = LoggerFactory.getLogger(AnalyzerConfigurationLoader.class);

    private AnalyzerConfigurationLoader() {}

    public static Optional<AnalyzerConfiguration> load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return parse(Files.readString(path));
        } catch (IOException ex) {
            LOG.warn("Unable to read analyzer configuration {}: {}", path, ex.getMessage());
            return Optional.empty();
        }
    }

    public static Optional<AnalyzerConfiguration> parse(String toml) {
        TomlParseResult result = Toml.parse(toml == null ? "" : toml);
        if (result.hasErrors()) {
            result.errors().forEach(error -> LOG.warn("Invalid analyzer configuration: {}", error.toString()));
            return Optional.empty();
        }
        return fromToml(result);
    }

    public static Optional<AnalyzerConfiguration> fromToml(TomlParseResult result) {
        if (result == null) {
            return Optional.empty();
        }
        var builder = AnalyzerConfiguration.builder();
        try {
            Boolean simplify = result.getBoolean("analysis.simplify");
            if (simplify != null) {
                builder.simplify(simplify);
            }
            String entryFunction = result.getString("analysis.entry_function");
            if (entryFunction != null) {
                builder.entryFunction(entryFunction);
            }
            Boolean verify = result.getBoolean("verification.enabled");
            if (verify != null) {
                builder.verify(verify);
            }
            Object tolerance = result.get("verification.tolerance");
            if (tolerance != null) {
                if (!(tolerance instanceof Number number)) {
                    LOG.warn("verification.tolerance must be a number, got {}", tolerance);
                    return Optional.empty();
                }
                builder.tolerance(number.doubleValue());
            }
            return Optional.of(builder.build());
        } catch (TomlInvalidTypeException | IllegalArgumentException ex) {
            LOG.warn("Invalid analyzer configuration: {}", ex.getMessage());
            return Optional.empty();
        }
    }
}
