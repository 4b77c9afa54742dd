package work.lcod.thoughts.expr;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Closed set of expression forms accepted on the right-hand side of an assignment.
 */
public sealed interface Expression
    permits Expression.Name, Expression.NumberLiteral, Expression.StringLiteral, Expression.Constant,
    Expression.ListDisplay, Expression.TupleDisplay, Expression.Unary, Expression.Binary,
    Expression.BoolOp, Expression.Compare, Expression.Call, Expression.Subscript, Expression.Attribute {

    /**
     * Canonical text, independent of the whitespace and parentheses of the original source.
     */
    default String render() {
        return ExpressionRenderer.render(this);
    }

    record Name(String id) implements Expression {
        public Name {
            Objects.requireNonNull(id, "id");
        }
    }

    /**
     * Numeric literal; {@code text} is already normalized (see {@link #of(String)}).
     */
    record NumberLiteral(String text, boolean integral) implements Expression {
        public NumberLiteral {
            Objects.requireNonNull(text, "text");
        }

        public static NumberLiteral of(String raw) {
            String cleaned = raw.replace("_", "");
            boolean integral = !(cleaned.contains(".") || cleaned.contains("e") || cleaned.contains("E"));
            if (integral) {
                return new NumberLiteral(new BigDecimal(cleaned).toBigInteger().toString(), true);
            }
            return new NumberLiteral(formatFloat(Double.parseDouble(cleaned)), false);
        }

        public double value() {
            return Double.parseDouble(text);
        }

        static String formatFloat(double value) {
            if (Double.isInfinite(value)) {
                return "1e309";
            }
            double magnitude = Math.abs(value);
            if (magnitude == 0.0 || (magnitude >= 1e-4 && magnitude < 1e16)) {
                String plain = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
                return plain.contains(".") ? plain : plain + ".0";
            }
            String java = Double.toString(value);
            int exp = java.indexOf('E');
            String mantissa = java.substring(0, exp);
            String exponent = java.substring(exp + 1);
            if (mantissa.endsWith(".0")) {
                mantissa = mantissa.substring(0, mantissa.length() - 2);
            }
            if (!exponent.startsWith("-")) {
                exponent = "+" + exponent;
            }
            if (exponent.length() == 2) {
                exponent = exponent.charAt(0) + "0" + exponent.charAt(1);
            }
            return mantissa + "e" + exponent;
        }
    }

    record StringLiteral(String value) implements Expression {
        public StringLiteral {
            Objects.requireNonNull(value, "value");
        }
    }

    record Constant(Kind kind) implements Expression {
        public enum Kind {
            TRUE("True"),
            FALSE("False"),
            NONE("None");

            private final String keyword;

            Kind(String keyword) {
                this.keyword = keyword;
            }

            public String keyword() {
                return keyword;
            }
        }
    }

    record ListDisplay(List<Expression> elements) implements Expression {
        public ListDisplay {
            elements = List.copyOf(elements);
        }
    }

    record TupleDisplay(List<Expression> elements) implements Expression {
        public TupleDisplay {
            elements = List.copyOf(elements);
        }
    }

    record Unary(UnaryOperator operator, Expression operand) implements Expression {}

    record Binary(BinaryOperator operator, Expression left, Expression right) implements Expression {}

    record BoolOp(BoolOperator operator, List<Expression> values) implements Expression {
        public BoolOp {
            values = List.copyOf(values);
            if (values.size() < 2) {
                throw new IllegalArgumentException("boolean operation needs at least two operands");
            }
        }
    }

    /**
     * Chained comparison {@code left op0 c0 op1 c1 ...}.
     */
    record Compare(Expression left, List<ComparisonOperator> operators, List<Expression> comparators) implements Expression {
        public Compare {
            operators = List.copyOf(operators);
            comparators = List.copyOf(comparators);
            if (operators.isEmpty() || operators.size() != comparators.size()) {
                throw new IllegalArgumentException("comparison operators and operands do not line up");
            }
        }
    }

    record Call(Expression function, List<Expression> arguments, List<Keyword> keywords) implements Expression {
        public Call {
            arguments = List.copyOf(arguments);
            keywords = List.copyOf(keywords);
        }
    }

    record Keyword(String name, Expression value) {}

    record Subscript(Expression target, Expression index) implements Expression {}

    record Attribute(Expression target, String attribute) implements Expression {}

    enum UnaryOperator {
        PLUS("+"),
        MINUS("-"),
        NOT("not");

        private final String symbol;

        UnaryOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    enum BinaryOperator {
        ADD("+", Precedence.ARITH),
        SUBTRACT("-", Precedence.ARITH),
        MULTIPLY("*", Precedence.TERM),
        DIVIDE("/", Precedence.TERM),
        FLOOR_DIVIDE("//", Precedence.TERM),
        MODULO("%", Precedence.TERM),
        POWER("**", Precedence.POWER);

        private final String symbol;
        private final int precedence;

        BinaryOperator(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }

        public String symbol() {
            return symbol;
        }

        public int precedence() {
            return precedence;
        }
    }

    enum BoolOperator {
        AND("and", Precedence.AND),
        OR("or", Precedence.OR);

        private final String symbol;
        private final int precedence;

        BoolOperator(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }

        public String symbol() {
            return symbol;
        }

        public int precedence() {
            return precedence;
        }
    }

    enum ComparisonOperator {
        LESS("<"),
        LESS_EQUAL("<="),
        GREATER(">"),
        GREATER_EQUAL(">="),
        EQUAL("=="),
        NOT_EQUAL("!="),
        IN("in"),
        NOT_IN("not in"),
        IS("is"),
        IS_NOT("is not");

        private final String symbol;

        ComparisonOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    /**
     * Binding strength used by the renderer; higher binds tighter.
     */
    final class Precedence {
        public static final int TUPLE = 0;
        public static final int OR = 1;
        public static final int AND = 2;
        public static final int NOT = 3;
        public static final int COMPARE = 4;
        public static final int ARITH = 5;
        public static final int TERM = 6;
        public static final int FACTOR = 7;
        public static final int POWER = 8;
        public static final int ATOM = 9;

        private Precedence() {}
    }
}
