package com.nestplan.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Utility methods for traversing and rewriting expression trees.
 */
public final class ExpressionUtils {

    private ExpressionUtils() {}

    /**
     * Rewrites an expression bottom-up: children are rewritten first, then the rebuilt
     * node is passed to the function.
     *
     * @param expr the expression to rewrite
     * @param fn the rewrite applied to every node
     * @return the rewritten expression
     */
    public static Expression transform(Expression expr, UnaryOperator<Expression> fn) {
        List<Expression> children = expr.children();
        Expression rebuilt = expr;
        if (!children.isEmpty()) {
            List<Expression> rewritten = new ArrayList<>(children.size());
            boolean changed = false;
            for (Expression child : children) {
                Expression next = transform(child, fn);
                changed |= next != child;
                rewritten.add(next);
            }
            if (changed) {
                rebuilt = expr.withChildren(rewritten);
            }
        }
        return fn.apply(rebuilt);
    }

    /**
     * Visits every node of an expression, parents before children.
     *
     * @param expr the expression
     * @param visitor the visitor
     */
    public static void walk(Expression expr, Consumer<Expression> visitor) {
        visitor.accept(expr);
        for (Expression child : expr.children()) {
            walk(child, visitor);
        }
    }

    /**
     * Moves every placeholder in the expression by the given delta.
     *
     * @param expr the expression
     * @param delta the amount added to every placeholder index
     * @return the shifted expression
     */
    public static Expression shiftParameters(Expression expr, int delta) {
        if (delta == 0) {
            return expr;
        }
        return transform(expr, e -> e instanceof Parameter p ? p.shift(delta) : e);
    }

    /**
     * Collects the placeholders of an expression in rendering order.
     *
     * @param expr the expression
     * @return the placeholders
     */
    public static List<Parameter> parameters(Expression expr) {
        List<Parameter> parameters = new ArrayList<>();
        walk(expr, e -> {
            if (e instanceof Parameter p) {
                parameters.add(p);
            }
        });
        return parameters;
    }

    /**
     * Collects the field accesses of an expression in rendering order.
     *
     * @param expr the expression
     * @return the field accesses
     */
    public static List<FieldAccess> fieldAccesses(Expression expr) {
        List<FieldAccess> accesses = new ArrayList<>();
        walk(expr, e -> {
            if (e instanceof FieldAccess f) {
                accesses.add(f);
            }
        });
        return accesses;
    }

    /**
     * Returns one past the highest placeholder index used by the expression.
     *
     * @param expr the expression
     * @return the placeholder count implied by the expression, 0 when there are none
     */
    public static int parameterSpan(Expression expr) {
        int span = 0;
        for (Parameter p : parameters(expr)) {
            span = Math.max(span, p.index() + 1);
        }
        return span;
    }
}
