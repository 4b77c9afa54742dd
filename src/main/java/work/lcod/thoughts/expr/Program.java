package work.lcod.thoughts.expr;

import java.util.List;
import java.util.Optional;

/**
 * Parsed source: top-level statements, possibly including function definitions.
 */
public record Program(List<Statement> statements) {
    public Program {
        statements = List.copyOf(statements);
    }

    /**
     * The function named {@code preferredName}, else the first top-level function.
     */
    public Optional<Statement.FunctionDefinition> function(String preferredName) {
        Statement.FunctionDefinition first = null;
        for (var statement : statements) {
            if (statement instanceof Statement.FunctionDefinition def) {
                if (def.name().equals(preferredName)) {
                    return Optional.of(def);
                }
                if (first == null) {
                    first = def;
                }
            }
        }
        return Optional.ofNullable(first);
    }
}
