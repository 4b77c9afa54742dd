package work.lcod.thoughts.eval;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runtime value helpers. Values are {@code Double}, {@code Boolean}, {@code String},
 * {@code List<Object>} or {@code null} for {@code None}; integers are carried as doubles.
 */
final class Values {
    private Values() {}

    static Object normalize(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof List<?> list) {
            var normalized = new ArrayList<Object>(list.size());
            list.forEach(item -> normalized.add(normalize(item)));
            return normalized;
        }
        if (value == null || value instanceof Boolean || value instanceof String) {
            return value;
        }
        throw new EvaluationException("unsupported value type " + value.getClass().getSimpleName());
    }

    static boolean isNumeric(Object value) {
        return value instanceof Double || value instanceof Boolean;
    }

    static double toDouble(Object value, String context) {
        if (value instanceof Double number) {
            return number;
        }
        if (value instanceof Boolean flag) {
            return flag ? 1.0 : 0.0;
        }
        throw new EvaluationException(context + " expects a number, got " + typeName(value));
    }

    static int toIndex(Object value, String context) {
        double number = toDouble(value, context);
        if (number != Math.rint(number)) {
            throw new EvaluationException(context + " expects an integer, got " + number);
        }
        return (int) number;
    }

    @SuppressWarnings("unchecked")
    static List<Object> toList(Object value, String context) {
        if (value instanceof List<?> list) {
            return (List<Object>) list;
        }
        if (value instanceof String text) {
            var chars = new ArrayList<Object>(text.length());
            text.codePoints().forEach(cp -> chars.add(new String(Character.toChars(cp))));
            return chars;
        }
        throw new EvaluationException(context + " expects a sequence, got " + typeName(value));
    }

    static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof Double number) {
            return number != 0.0;
        }
        if (value instanceof String text) {
            return !text.isEmpty();
        }
        if (value instanceof List<?> list) {
            return !list.isEmpty();
        }
        return true;
    }

    static boolean equal(Object left, Object right) {
        if (isNumeric(left) && isNumeric(right)) {
            return toDouble(left, "==") == toDouble(right, "==");
        }
        if (left instanceof List<?> a && right instanceof List<?> b) {
            if (a.size() != b.size()) {
                return false;
            }
            for (int i = 0; i < a.size(); i++) {
                if (!equal(a.get(i), b.get(i))) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(left, right);
    }

    static String typeName(Object value) {
        if (value == null) {
            return "None";
        }
        if (value instanceof Double) {
            return "number";
        }
        if (value instanceof Boolean) {
            return "bool";
        }
        if (value instanceof String) {
            return "str";
        }
        if (value instanceof List<?>) {
            return "list";
        }
        if (value instanceof Map<?, ?>) {
            return "dict";
        }
        return value.getClass().getSimpleName();
    }
}
