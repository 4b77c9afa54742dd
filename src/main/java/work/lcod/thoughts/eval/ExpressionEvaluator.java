package work.lcod.thoughts.eval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import work.lcod.thoughts.expr.Expression;

/**
 * Evaluates {@link Expression} trees over an environment of runtime values with Python
 * arithmetic semantics ({@code /} is true division, {@code //} and {@code %} floor).
 */
public final class ExpressionEvaluator {
    private ExpressionEvaluator() {}

    public static Object evaluate(Expression expression, Map<String, Object> environment) {
        if (expression instanceof Expression.Name name) {
            return lookup(name.id(), environment);
        }
        if (expression instanceof Expression.NumberLiteral number) {
            return number.value();
        }
        if (expression instanceof Expression.StringLiteral string) {
            return string.value();
        }
        if (expression instanceof Expression.Constant constant) {
            switch (constant.kind()) {
                case TRUE:
                    return Boolean.TRUE;
                case FALSE:
                    return Boolean.FALSE;
                default:
                    return null;
            }
        }
        if (expression instanceof Expression.ListDisplay list) {
            return evaluateAll(list.elements(), environment);
        }
        if (expression instanceof Expression.TupleDisplay tuple) {
            return Collections.unmodifiableList(evaluateAll(tuple.elements(), environment));
        }
        if (expression instanceof Expression.Unary unary) {
            return unary(unary, evaluate(unary.operand(), environment));
        }
        if (expression instanceof Expression.Binary binary) {
            return binary(binary.operator(), evaluate(binary.left(), environment), evaluate(binary.right(), environment));
        }
        if (expression instanceof Expression.BoolOp boolOp) {
            return boolOp(boolOp, environment);
        }
        if (expression instanceof Expression.Compare compare) {
            return compare(compare, environment);
        }
        if (expression instanceof Expression.Call call) {
            return call(call, environment);
        }
        if (expression instanceof Expression.Subscript subscript) {
            return subscript(evaluate(subscript.target(), environment), evaluate(subscript.index(), environment));
        }
        if (expression instanceof Expression.Attribute attribute) {
            return attribute(attribute);
        }
        throw new EvaluationException("cannot evaluate " + expression.render());
    }

    private static Object lookup(String name, Map<String, Object> environment) {
        if (environment.containsKey(name)) {
            return environment.get(name);
        }
        throw new EvaluationException("name '" + name + "' is not defined");
    }

    private static List<Object> evaluateAll(List<Expression> expressions, Map<String, Object> environment) {
        var values = new ArrayList<Object>(expressions.size());
        expressions.forEach(element -> values.add(evaluate(element, environment)));
        return values;
    }

    private static Object unary(Expression.Unary unary, Object operand) {
        switch (unary.operator()) {
            case NOT:
                return !Values.truthy(operand);
            case MINUS:
                return -Values.toDouble(operand, "unary -");
            default:
                return Values.toDouble(operand, "unary +");
        }
    }

    static Object binary(Expression.BinaryOperator operator, Object left, Object right) {
        switch (operator) {
            case ADD:
                if (left instanceof String a && right instanceof String b) {
                    return a + b;
                }
                if (left instanceof List<?> a && right instanceof List<?> b) {
                    var joined = new ArrayList<Object>(a);
                    joined.addAll(b);
                    return joined;
                }
                return number(left, "+") + number(right, "+");
            case SUBTRACT:
                return number(left, "-") - number(right, "-");
            case MULTIPLY:
                if (left instanceof String || left instanceof List<?>) {
                    return repeat(left, right);
                }
                if (right instanceof String || right instanceof List<?>) {
                    return repeat(right, left);
                }
                return number(left, "*") * number(right, "*");
            case DIVIDE:
                return number(left, "/") / nonZero(right, "division");
            case FLOOR_DIVIDE:
                return Math.floor(number(left, "//") / nonZero(right, "integer division"));
            case MODULO: {
                double divisor = nonZero(right, "modulo");
                double dividend = number(left, "%");
                return dividend - divisor * Math.floor(dividend / divisor);
            }
            case POWER:
                return BuiltinFunctions.power(List.of(number(left, "**"), number(right, "**")));
            default:
                throw new EvaluationException("unsupported operator " + operator.symbol());
        }
    }

    private static Object repeat(Object sequence, Object times) {
        int count = Math.max(0, Values.toIndex(times, "*"));
        if (sequence instanceof String text) {
            return text.repeat(count);
        }
        var repeated = new ArrayList<Object>();
        for (int i = 0; i < count; i++) {
            repeated.addAll((List<?>) sequence);
        }
        return repeated;
    }

    private static Object boolOp(Expression.BoolOp boolOp, Map<String, Object> environment) {
        boolean isAnd = boolOp.operator() == Expression.BoolOperator.AND;
        Object value = null;
        for (Expression operand : boolOp.values()) {
            value = evaluate(operand, environment);
            if (Values.truthy(value) != isAnd) {
                return value;
            }
        }
        return value;
    }

    private static Object compare(Expression.Compare compare, Map<String, Object> environment) {
        Object left = evaluate(compare.left(), environment);
        for (int i = 0; i < compare.operators().size(); i++) {
            Object right = evaluate(compare.comparators().get(i), environment);
            if (!compareOnce(compare.operators().get(i), left, right)) {
                return false;
            }
            left = right;
        }
        return true;
    }

    private static boolean compareOnce(Expression.ComparisonOperator operator, Object left, Object right) {
        switch (operator) {
            case EQUAL:
                return Values.equal(left, right);
            case NOT_EQUAL:
                return !Values.equal(left, right);
            case IS:
                return left == null ? right == null : Values.equal(left, right) && Values.typeName(left).equals(Values.typeName(right));
            case IS_NOT:
                return !compareOnce(Expression.ComparisonOperator.IS, left, right);
            case IN:
                return contains(right, left);
            case NOT_IN:
                return !contains(right, left);
            default:
                return ordered(operator, order(left, right, operator.symbol()));
        }
    }

    private static int order(Object left, Object right, String symbol) {
        if (left instanceof String a && right instanceof String b) {
            return a.compareTo(b);
        }
        return Double.compare(number(left, symbol), number(right, symbol));
    }

    private static boolean ordered(Expression.ComparisonOperator operator, int cmp) {
        switch (operator) {
            case LESS:
                return cmp < 0;
            case LESS_EQUAL:
                return cmp <= 0;
            case GREATER:
                return cmp > 0;
            default:
                return cmp >= 0;
        }
    }

    private static boolean contains(Object container, Object item) {
        if (container instanceof String text) {
            if (!(item instanceof String needle)) {
                throw new EvaluationException("'in <string>' requires string as left operand");
            }
            return text.contains(needle);
        }
        for (Object element : Values.toList(container, "in")) {
            if (Values.equal(element, item)) {
                return true;
            }
        }
        return false;
    }

    private static Object call(Expression.Call call, Map<String, Object> environment) {
        String target = call.function().render();
        if (!call.keywords().isEmpty()) {
            throw new EvaluationException(target + "() does not accept keyword arguments here");
        }
        var builtin = resolveFunction(call.function())
            .orElseThrow(() -> new EvaluationException("unknown function " + target));
        return builtin.apply(evaluateAll(call.arguments(), environment));
    }

    private static Optional<Function<List<Object>, Object>> resolveFunction(Expression function) {
        if (function instanceof Expression.Name name) {
            return BuiltinFunctions.global(name.id());
        }
        if (function instanceof Expression.Attribute attribute && isMathModule(attribute.target())) {
            return BuiltinFunctions.math(attribute.attribute());
        }
        return Optional.empty();
    }

    private static Object subscript(Object target, Object index) {
        List<Object> sequence = Values.toList(target, "subscript");
        int position = Values.toIndex(index, "subscript");
        int resolved = position < 0 ? sequence.size() + position : position;
        if (resolved < 0 || resolved >= sequence.size()) {
            throw new EvaluationException("index " + position + " out of range");
        }
        return sequence.get(resolved);
    }

    private static Object attribute(Expression.Attribute attribute) {
        if (isMathModule(attribute.target())) {
            return BuiltinFunctions.mathConstant(attribute.attribute())
                .orElseThrow(() -> new EvaluationException("module 'math' has no constant '" + attribute.attribute() + "'"));
        }
        throw new EvaluationException("attribute access " + attribute.render() + " is not supported");
    }

    private static boolean isMathModule(Expression expression) {
        return expression instanceof Expression.Name name && BuiltinFunctions.MATH_MODULE.equals(name.id());
    }

    private static double number(Object value, String symbol) {
        return Values.toDouble(value, "operator " + symbol);
    }

    private static double nonZero(Object value, String what) {
        double divisor = Values.toDouble(value, what);
        if (divisor == 0.0) {
            throw new EvaluationException(what + " by zero");
        }
        return divisor;
    }
}
