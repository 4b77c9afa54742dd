package work.lcod.thoughts.eval;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.thoughts.expr.SourceParseException;
import work.lcod.thoughts.expr.SourceParser;
import work.lcod.thoughts.path.ReasoningPath;
import work.lcod.thoughts.path.Step;

/**
 * Executes the steps of a {@link ReasoningPath} in order over a parameter binding.
 */
public final class PathEvaluator {
    private static final Logger LOG = LoggerFactory.getLogger(PathEvaluator.class);

    private PathEvaluator() {}

    /**
     * @return value of each return variable, in return-variable order
     * @throws EvaluationException when a parameter is unbound, a name is undefined or an
     *     operation fails
     */
    public static Map<String, Object> evaluate(ReasoningPath path, Map<String, ?> binding) {
        var environment = new HashMap<String, Object>();
        for (String parameter : path.parameters()) {
            if (binding == null || !binding.containsKey(parameter)) {
                throw new EvaluationException("missing value for parameter '" + parameter + "'");
            }
            environment.put(parameter, Values.normalize(binding.get(parameter)));
        }
        for (Step step : path.steps()) {
            environment.put(step.variable(), evaluateStep(step, environment));
        }
        var results = new LinkedHashMap<String, Object>();
        for (String returnVar : path.returnVars()) {
            if (!environment.containsKey(returnVar)) {
                throw new EvaluationException("return variable '" + returnVar + "' is never assigned");
            }
            results.put(returnVar, environment.get(returnVar));
        }
        LOG.debug("Evaluated {} steps, results {}", path.size(), results);
        return results;
    }

    private static Object evaluateStep(Step step, Map<String, Object> environment) {
        try {
            return ExpressionEvaluator.evaluate(SourceParser.parseExpression(step.expression()), environment);
        } catch (SourceParseException ex) {
            throw new EvaluationException("step " + step.stepId() + " has an unparsable expression", ex);
        } catch (EvaluationException ex) {
            throw new EvaluationException(
                "step " + step.stepId() + " (" + step.variable() + " = " + step.expression() + "): " + ex.getMessage(),
                ex
            );
        }
    }
}
