package com.nestplan.query;

import com.nestplan.expression.Expression;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A clause expression together with the values its placeholders are bound to.
 *
 * <p>Used for group_by, order_by, limit, offset and join conditions. Placeholder
 * {@code ^i} refers to {@code params.get(i)} until the query is normalized.
 *
 * @param expr the expression
 * @param params the bound values (may contain nulls)
 */
public record QueryExpr(Expression expr, List<Object> params) {

    public QueryExpr {
        Objects.requireNonNull(expr, "expr must not be null");
        Objects.requireNonNull(params, "params must not be null");
        params = Collections.unmodifiableList(new ArrayList<>(params));
    }

    public static QueryExpr of(Expression expr, Object... params) {
        return new QueryExpr(expr, Arrays.asList(params));
    }

    public QueryExpr withExpr(Expression newExpr) {
        return new QueryExpr(newExpr, params);
    }

    public QueryExpr withParams(List<Object> newParams) {
        return new QueryExpr(expr, newParams);
    }
}
