package work.lcod.thoughts.expr;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Statements of a computation body. Only {@link Assignment} and {@link Return} carry meaning for
 * step extraction; everything else parses to {@link Unsupported} and is skipped.
 */
public sealed interface Statement
    permits Statement.Assignment, Statement.Return, Statement.FunctionDefinition, Statement.Unsupported {

    int line();

    /**
     * Single-identifier assignment {@code target = value}.
     */
    record Assignment(String target, Expression value, int line) implements Statement {
        public Assignment {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(value, "value");
        }
    }

    record Return(Optional<Expression> value, int line) implements Statement {
        public Return {
            Objects.requireNonNull(value, "value");
        }

        /**
         * Name of the returned variable when the statement returns a bare identifier.
         */
        public Optional<String> variable() {
            return value.filter(Expression.Name.class::isInstance).map(e -> ((Expression.Name) e).id());
        }
    }

    record FunctionDefinition(String name, List<String> parameters, List<Statement> body, int line) implements Statement {
        public FunctionDefinition {
            Objects.requireNonNull(name, "name");
            parameters = List.copyOf(parameters);
            body = List.copyOf(body);
        }
    }

    /**
     * A statement outside the restricted grammar (control flow, imports, augmented or
     * multi-target assignment, ...). Nested statements of a block are kept so returns inside
     * them can still be discovered.
     */
    record Unsupported(String construct, List<Statement> body, int line) implements Statement {
        public Unsupported {
            Objects.requireNonNull(construct, "construct");
            body = List.copyOf(body);
        }

        public Unsupported(String construct, int line) {
            this(construct, List.of(), line);
        }
    }
}
