package work.lcod.thoughts.expr;

import java.util.List;
import work.lcod.thoughts.expr.Expression.Precedence;

/**
 * Renders expressions to canonical text with the minimal parentheses needed to re-parse
 * them to the same tree.
 */
public final class ExpressionRenderer {
    private ExpressionRenderer() {}

    public static String render(Expression expression) {
        var out = new StringBuilder();
        write(out, expression, Precedence.TUPLE);
        return out.toString();
    }

    private static void write(StringBuilder out, Expression expression, int required) {
        int own = precedenceOf(expression);
        boolean parens = own < required;
        if (parens) {
            out.append('(');
        }
        writeBare(out, expression);
        if (parens) {
            out.append(')');
        }
    }

    private static void writeBare(StringBuilder out, Expression expression) {
        if (expression instanceof Expression.Name name) {
            out.append(name.id());
        } else if (expression instanceof Expression.NumberLiteral number) {
            out.append(number.text());
        } else if (expression instanceof Expression.StringLiteral string) {
            out.append(quote(string.value()));
        } else if (expression instanceof Expression.Constant constant) {
            out.append(constant.kind().keyword());
        } else if (expression instanceof Expression.ListDisplay list) {
            out.append('[');
            writeAll(out, list.elements());
            out.append(']');
        } else if (expression instanceof Expression.TupleDisplay tuple) {
            out.append('(');
            writeAll(out, tuple.elements());
            if (tuple.elements().size() == 1) {
                out.append(',');
            }
            out.append(')');
        } else if (expression instanceof Expression.Unary unary) {
            boolean word = unary.operator() == Expression.UnaryOperator.NOT;
            out.append(unary.operator().symbol());
            if (word) {
                out.append(' ');
            }
            write(out, unary.operand(), word ? Precedence.NOT : Precedence.FACTOR);
        } else if (expression instanceof Expression.Binary binary) {
            int p = binary.operator().precedence();
            if (binary.operator() == Expression.BinaryOperator.POWER) {
                write(out, binary.left(), Precedence.ATOM);
                out.append(" ** ");
                write(out, binary.right(), Precedence.FACTOR);
            } else {
                write(out, binary.left(), p);
                out.append(' ').append(binary.operator().symbol()).append(' ');
                write(out, binary.right(), p + 1);
            }
        } else if (expression instanceof Expression.BoolOp bool) {
            int p = bool.operator().precedence();
            for (int i = 0; i < bool.values().size(); i++) {
                if (i > 0) {
                    out.append(' ').append(bool.operator().symbol()).append(' ');
                }
                write(out, bool.values().get(i), p + 1);
            }
        } else if (expression instanceof Expression.Compare compare) {
            write(out, compare.left(), Precedence.COMPARE + 1);
            for (int i = 0; i < compare.operators().size(); i++) {
                out.append(' ').append(compare.operators().get(i).symbol()).append(' ');
                write(out, compare.comparators().get(i), Precedence.COMPARE + 1);
            }
        } else if (expression instanceof Expression.Call call) {
            write(out, call.function(), Precedence.ATOM);
            out.append('(');
            writeAll(out, call.arguments());
            for (int i = 0; i < call.keywords().size(); i++) {
                if (i > 0 || !call.arguments().isEmpty()) {
                    out.append(", ");
                }
                var keyword = call.keywords().get(i);
                out.append(keyword.name()).append('=');
                write(out, keyword.value(), Precedence.OR);
            }
            out.append(')');
        } else if (expression instanceof Expression.Subscript subscript) {
            write(out, subscript.target(), Precedence.ATOM);
            out.append('[');
            write(out, subscript.index(), Precedence.TUPLE);
            out.append(']');
        } else if (expression instanceof Expression.Attribute attribute) {
            write(out, attribute.target(), Precedence.ATOM);
            out.append('.').append(attribute.attribute());
        } else {
            throw new IllegalStateException("Unknown expression: " + expression);
        }
    }

    private static void writeAll(StringBuilder out, List<Expression> elements) {
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            write(out, elements.get(i), Precedence.OR);
        }
    }

    static int precedenceOf(Expression expression) {
        if (expression instanceof Expression.Binary binary) {
            return binary.operator().precedence();
        }
        if (expression instanceof Expression.BoolOp bool) {
            return bool.operator().precedence();
        }
        if (expression instanceof Expression.Compare) {
            return Precedence.COMPARE;
        }
        if (expression instanceof Expression.Unary unary) {
            return unary.operator() == Expression.UnaryOperator.NOT ? Precedence.NOT : Precedence.FACTOR;
        }
        return Precedence.ATOM;
    }

    static String quote(String value) {
        var out = new StringBuilder("'");
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '\'' -> out.append("\\'");
                case '\n' -> out.append("\\n");
                case '\t' -> out.append("\\t");
                case '\r' -> out.append("\\r");
                default -> out.append(c);
            }
        }
        return out.append('\'').toString();
    }
}
