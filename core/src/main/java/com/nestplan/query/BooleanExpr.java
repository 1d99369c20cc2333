package com.nestplan.query;

import com.nestplan.expression.Expression;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A where/having condition, combined with the previous conditions by {@link Op}.
 *
 * @param op how the condition combines with the preceding ones
 * @param expr the condition
 * @param params the bound values (may contain nulls)
 */
public record BooleanExpr(Op op, Expression expr, List<Object> params) {

    public enum Op {
        AND, OR
    }

    public BooleanExpr {
        Objects.requireNonNull(op, "op must not be null");
        Objects.requireNonNull(expr, "expr must not be null");
        Objects.requireNonNull(params, "params must not be null");
        params = Collections.unmodifiableList(new ArrayList<>(params));
    }

    public static BooleanExpr and(Expression expr, Object... params) {
        return new BooleanExpr(Op.AND, expr, Arrays.asList(params));
    }

    public static BooleanExpr or(Expression expr, Object... params) {
        return new BooleanExpr(Op.OR, expr, Arrays.asList(params));
    }

    public BooleanExpr withExpr(Expression newExpr) {
        return new BooleanExpr(op, newExpr, params);
    }

    public BooleanExpr withParams(List<Object> newParams) {
        return new BooleanExpr(op, expr, newParams);
    }
}
