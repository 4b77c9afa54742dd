package work.lcod.thoughts.path;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.thoughts.expr.Expressions;
import work.lcod.thoughts.expr.SourceParser;
import work.lcod.thoughts.expr.Statement;

/**
 * Turns computation source text into a {@link ReasoningPath}.
 *
 * <p>When the source defines a function, the function named {@link #entryFunction()} (or the
 * first one) is the computation and its parameters are declared parameters. Each
 * single-identifier assignment becomes a step; identifiers on the right-hand side resolve to a
 * declared parameter first, then to the latest earlier step, and are dropped otherwise.
 * Identifiers returned by {@code return NAME} anywhere in the body become return variables.
 */
public final class StepExtractor {
    public static final String DEFAULT_ENTRY_FUNCTION = "solution";

    private static final Logger LOG = LoggerFactory.getLogger(StepExtractor.class);

    private final String entryFunction;

    public StepExtractor() {
        this(DEFAULT_ENTRY_FUNCTION);
    }

    public StepExtractor(String entryFunction) {
        this.entryFunction = Objects.requireNonNull(entryFunction, "entryFunction");
    }

    public String entryFunction() {
        return entryFunction;
    }

    public ReasoningPath extract(String source) {
        return extract(source, List.of());
    }

    /**
     * @throws work.lcod.thoughts.expr.SourceParseException when the source does not parse
     */
    public ReasoningPath extract(String source, Collection<String> parameterNames) {
        return extractDetailed(source, parameterNames).path();
    }

    public Extraction extractDetailed(String source, Collection<String> parameterNames) {
        var program = SourceParser.parseProgram(source);
        var skipped = new ArrayList<SkippedConstruct>();
        var parameters = new LinkedHashSet<String>();
        List<Statement> body;

        var function = program.function(entryFunction);
        if (function.isPresent()) {
            var definition = function.get();
            parameters.addAll(definition.parameters());
            body = definition.body();
            for (var statement : program.statements()) {
                if (statement != definition) {
                    skipped.add(new SkippedConstruct(describeTopLevel(statement), statement.line()));
                }
            }
        } else {
            body = program.statements();
        }
        if (parameterNames != null) {
            parameters.addAll(parameterNames);
        }

        var builder = ReasoningPath.builder(parameters);
        var returnVars = new TreeSet<String>();
        for (var statement : body) {
            if (statement instanceof Statement.Assignment assignment) {
                builder.append(toStep(builder, assignment));
            } else if (statement instanceof Statement.Return ret) {
                ret.variable().ifPresent(returnVars::add);
            } else if (statement instanceof Statement.FunctionDefinition nested) {
                skipped.add(new SkippedConstruct("nested function " + nested.name(), nested.line()));
                collectReturns(nested.body(), returnVars);
            } else if (statement instanceof Statement.Unsupported unsupported) {
                skipped.add(new SkippedConstruct(unsupported.construct(), unsupported.line()));
                collectReturns(unsupported.body(), returnVars);
            }
        }
        builder.returnVars(returnVars);

        for (var construct : skipped) {
            LOG.debug("Skipped {} at line {}", construct.construct(), construct.line());
        }
        var path = builder.build();
        LOG.debug("Extracted {} steps, return vars {}", path.size(), path.returnVars());
        return new Extraction(path, skipped);
    }

    private Step toStep(ReasoningPath.Builder builder, Statement.Assignment assignment) {
        var dependencies = new ArrayList<Integer>();
        var inputs = new ArrayList<String>();
        for (String name : Expressions.referencedNames(assignment.value())) {
            if (name.equals(assignment.target())) {
                continue;
            }
            if (builder.isParameter(name)) {
                inputs.add(name);
            } else {
                builder.lookup(name).ifPresent(step -> dependencies.add(step.stepId()));
            }
        }
        return new Step(
            builder.nextStepId(),
            assignment.target(),
            assignment.value().render(),
            dependencies,
            inputs
        );
    }

    private void collectReturns(List<Statement> statements, Collection<String> returnVars) {
        for (var statement : statements) {
            if (statement instanceof Statement.Return ret) {
                ret.variable().ifPresent(returnVars::add);
            } else if (statement instanceof Statement.FunctionDefinition nested) {
                collectReturns(nested.body(), returnVars);
            } else if (statement instanceof Statement.Unsupported unsupported) {
                collectReturns(unsupported.body(), returnVars);
            }
        }
    }

    private String describeTopLevel(Statement statement) {
        if (statement instanceof Statement.FunctionDefinition other) {
            return "function " + other.name();
        }
        if (statement instanceof Statement.Unsupported unsupported) {
            return unsupported.construct();
        }
        return "top-level statement outside " + entryFunction;
    }
}
