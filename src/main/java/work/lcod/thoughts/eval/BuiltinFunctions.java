package work.lcod.thoughts.eval;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Builtins available to step expressions: a handful of global functions plus the
 * {@code math} module.
 */
final class BuiltinFunctions {
    static final String MATH_MODULE = "math";

    private static final Map<String, Function<List<Object>, Object>> GLOBALS = Map.of(
        "abs", args -> Math.abs(Values.toDouble(single("abs", args), "abs")),
        "min", args -> extreme("min", args, -1),
        "max", args -> extreme("max", args, 1),
        "sum", BuiltinFunctions::sum,
        "round", BuiltinFunctions::round,
        "int", BuiltinFunctions::toInt,
        "float", BuiltinFunctions::toFloat,
        "len", args -> (double) Values.toList(single("len", args), "len").size(),
        "pow", args -> power(arity("pow", args, 2))
    );

    private static final Map<String, Function<List<Object>, Object>> MATH = Map.of(
        "ceil", args -> Math.ceil(number("math.ceil", args)),
        "floor", args -> Math.floor(number("math.floor", args)),
        "sqrt", args -> sqrt(number("math.sqrt", args)),
        "pow", args -> {
            var pair = arity("math.pow", args, 2);
            return Math.pow(Values.toDouble(pair.get(0), "math.pow"), Values.toDouble(pair.get(1), "math.pow"));
        },
        "fabs", args -> Math.abs(number("math.fabs", args)),
        "exp", args -> Math.exp(number("math.exp", args)),
        "log", BuiltinFunctions::log,
        "log10", args -> positive("math.log10", number("math.log10", args), Math::log10)
    );

    private static final Map<String, Double> MATH_CONSTANTS = Map.of(
        "pi", Math.PI,
        "e", Math.E
    );

    private BuiltinFunctions() {}

    static Optional<Function<List<Object>, Object>> global(String name) {
        return Optional.ofNullable(GLOBALS.get(name));
    }

    static Optional<Function<List<Object>, Object>> math(String name) {
        return Optional.ofNullable(MATH.get(name));
    }

    static Optional<Double> mathConstant(String name) {
        return Optional.ofNullable(MATH_CONSTANTS.get(name));
    }

    static double power(List<Object> args) {
        double base = Values.toDouble(args.get(0), "**");
        double exponent = Values.toDouble(args.get(1), "**");
        if (base == 0.0 && exponent < 0) {
            throw new EvaluationException("0.0 cannot be raised to a negative power");
        }
        double result = Math.pow(base, exponent);
        if (Double.isNaN(result)) {
            throw new EvaluationException("power of a negative number to a fractional exponent");
        }
        return result;
    }

    private static Object extreme(String name, List<Object> args, int direction) {
        List<Object> candidates = args.size() == 1 ? Values.toList(args.get(0), name) : args;
        if (candidates.isEmpty()) {
            throw new EvaluationException(name + "() arg is an empty sequence");
        }
        Object best = candidates.get(0);
        for (Object candidate : candidates.subList(1, candidates.size())) {
            int cmp = Double.compare(Values.toDouble(candidate, name), Values.toDouble(best, name));
            if (cmp * direction > 0) {
                best = candidate;
            }
        }
        return Values.isNumeric(best) ? Values.toDouble(best, name) : best;
    }

    private static Object sum(List<Object> args) {
        if (args.isEmpty() || args.size() > 2) {
            throw new EvaluationException("sum() takes 1 or 2 arguments, got " + args.size());
        }
        double total = args.size() == 2 ? Values.toDouble(args.get(1), "sum") : 0.0;
        for (Object item : Values.toList(args.get(0), "sum")) {
            total += Values.toDouble(item, "sum");
        }
        return total;
    }

    private static Object round(List<Object> args) {
        if (args.isEmpty() || args.size() > 2) {
            throw new EvaluationException("round() takes 1 or 2 arguments, got " + args.size());
        }
        double value = Values.toDouble(args.get(0), "round");
        if (args.size() == 1 || args.get(1) == null) {
            return Math.rint(value);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        int digits = Values.toIndex(args.get(1), "round");
        return new BigDecimal(value).setScale(digits, RoundingMode.HALF_EVEN).doubleValue();
    }

    private static Object toInt(List<Object> args) {
        Object value = args.isEmpty() ? 0.0 : single("int", args);
        if (value instanceof String text) {
            try {
                return new BigDecimal(text.strip().replace("_", "")).toBigIntegerExact().doubleValue();
            } catch (NumberFormatException | ArithmeticException ex) {
                throw new EvaluationException("invalid literal for int(): '" + text + "'", ex);
            }
        }
        double number = Values.toDouble(value, "int");
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            throw new EvaluationException("cannot convert " + number + " to integer");
        }
        return number < 0 ? Math.ceil(number) : Math.floor(number);
    }

    private static Object toFloat(List<Object> args) {
        Object value = args.isEmpty() ? 0.0 : single("float", args);
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.strip());
            } catch (NumberFormatException ex) {
                throw new EvaluationException("could not convert string to float: '" + text + "'", ex);
            }
        }
        return Values.toDouble(value, "float");
    }

    private static Object log(List<Object> args) {
        if (args.isEmpty() || args.size() > 2) {
            throw new EvaluationException("math.log() takes 1 or 2 arguments, got " + args.size());
        }
        double value = positive("math.log", Values.toDouble(args.get(0), "math.log"), Math::log);
        if (args.size() == 1) {
            return value;
        }
        double base = positive("math.log", Values.toDouble(args.get(1), "math.log"), Math::log);
        if (base == 0.0) {
            throw new EvaluationException("math.log() base must not be 1");
        }
        return value / base;
    }

    private static double sqrt(double value) {
        if (value < 0) {
            throw new EvaluationException("math domain error: sqrt of " + value);
        }
        return Math.sqrt(value);
    }

    private static double positive(String name, double value, Function<Double, Double> function) {
        if (value <= 0) {
            throw new EvaluationException("math domain error: " + name + " of " + value);
        }
        return function.apply(value);
    }

    private static double number(String name, List<Object> args) {
        return Values.toDouble(single(name, args), name);
    }

    private static Object single(String name, List<Object> args) {
        return arity(name, args, 1).get(0);
    }

    private static List<Object> arity(String name, List<Object> args, int expected) {
        if (args.size() != expected) {
            throw new EvaluationException(
                name + "() takes exactly " + expected + " argument" + (expected == 1 ? "" : "s") + ", got " + args.size()
            );
        }
        return new ArrayList<>(args);
    }
}
