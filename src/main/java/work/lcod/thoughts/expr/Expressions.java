package work.lcod.thoughts.expr;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural queries and rewrites over {@link Expression} trees.
 */
public final class Expressions {
    private Expressions() {}

    /**
     * Identifiers read by the expression, in first-encounter order. Attribute names and keyword
     * argument names are not identifiers.
     */
    public static Set<String> referencedNames(Expression expression) {
        var names = new LinkedHashSet<String>();
        collect(expression, names);
        return names;
    }

    /**
     * Returns the expression with every identifier found in {@code renames} replaced.
     */
    public static Expression rename(Expression expression, Map<String, String> renames) {
        if (renames.isEmpty()) {
            return expression;
        }
        if (expression instanceof Expression.Name name) {
            String replacement = renames.get(name.id());
            return replacement == null ? name : new Expression.Name(replacement);
        }
        if (expression instanceof Expression.NumberLiteral
            || expression instanceof Expression.StringLiteral
            || expression instanceof Expression.Constant) {
            return expression;
        }
        if (expression instanceof Expression.ListDisplay list) {
            return new Expression.ListDisplay(renameAll(list.elements(), renames));
        }
        if (expression instanceof Expression.TupleDisplay tuple) {
            return new Expression.TupleDisplay(renameAll(tuple.elements(), renames));
        }
        if (expression instanceof Expression.Unary unary) {
            return new Expression.Unary(unary.operator(), rename(unary.operand(), renames));
        }
        if (expression instanceof Expression.Binary binary) {
            return new Expression.Binary(
                binary.operator(),
                rename(binary.left(), renames),
                rename(binary.right(), renames)
            );
        }
        if (expression instanceof Expression.BoolOp bool) {
            return new Expression.BoolOp(bool.operator(), renameAll(bool.values(), renames));
        }
        if (expression instanceof Expression.Compare compare) {
            return new Expression.Compare(
                rename(compare.left(), renames),
                compare.operators(),
                renameAll(compare.comparators(), renames)
            );
        }
        if (expression instanceof Expression.Call call) {
            var keywords = new ArrayList<Expression.Keyword>();
            for (var keyword : call.keywords()) {
                keywords.add(new Expression.Keyword(keyword.name(), rename(keyword.value(), renames)));
            }
            return new Expression.Call(rename(call.function(), renames), renameAll(call.arguments(), renames), keywords);
        }
        if (expression instanceof Expression.Subscript subscript) {
            return new Expression.Subscript(rename(subscript.target(), renames), rename(subscript.index(), renames));
        }
        if (expression instanceof Expression.Attribute attribute) {
            return new Expression.Attribute(rename(attribute.target(), renames), attribute.attribute());
        }
        throw new IllegalStateException("Unknown expression: " + expression);
    }

    private static List<Expression> renameAll(List<Expression> expressions, Map<String, String> renames) {
        var renamed = new ArrayList<Expression>(expressions.size());
        for (var expression : expressions) {
            renamed.add(rename(expression, renames));
        }
        return renamed;
    }

    private static void collect(Expression expression, Set<String> names) {
        if (expression instanceof Expression.Name name) {
            names.add(name.id());
        } else if (expression instanceof Expression.ListDisplay list) {
            list.elements().forEach(e -> collect(e, names));
        } else if (expression instanceof Expression.TupleDisplay tuple) {
            tuple.elements().forEach(e -> collect(e, names));
        } else if (expression instanceof Expression.Unary unary) {
            collect(unary.operand(), names);
        } else if (expression instanceof Expression.Binary binary) {
            collect(binary.left(), names);
            collect(binary.right(), names);
        } else if (expression instanceof Expression.BoolOp bool) {
            bool.values().forEach(e -> collect(e, names));
        } else if (expression instanceof Expression.Compare compare) {
            collect(compare.left(), names);
            compare.comparators().forEach(e -> collect(e, names));
        } else if (expression instanceof Expression.Call call) {
            collect(call.function(), names);
            call.arguments().forEach(e -> collect(e, names));
            call.keywords().forEach(k -> collect(k.value(), names));
        } else if (expression instanceof Expression.Subscript subscript) {
            collect(subscript.target(), names);
            collect(subscript.index(), names);
        } else if (expression instanceof Expression.Attribute attribute) {
            collect(attribute.target(), names);
        }
    }
}
