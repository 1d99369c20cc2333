package com.nestplan.query;

import com.nestplan.expression.Expression;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The select clause.
 *
 * <p>{@code fields} is empty until normalization expands the select into the flat list
 * of expressions the adapter has to return.
 *
 * @param expr the select expression
 * @param params the bound values (may contain nulls)
 * @param fields the expanded field list
 */
public record SelectExpr(Expression expr, List<Object> params, List<Expression> fields) {

    public SelectExpr {
        Objects.requireNonNull(expr, "expr must not be null");
        Objects.requireNonNull(params, "params must not be null");
        Objects.requireNonNull(fields, "fields must not be null");
        params = Collections.unmodifiableList(new ArrayList<>(params));
        fields = List.copyOf(fields);
    }

    public static SelectExpr of(Expression expr, Object... params) {
        return new SelectExpr(expr, Arrays.asList(params), List.of());
    }

    public SelectExpr withExpr(Expression newExpr) {
        return new SelectExpr(newExpr, params, fields);
    }

    public SelectExpr withParams(List<Object> newParams) {
        return new SelectExpr(expr, newParams, fields);
    }

    public SelectExpr withFields(List<Expression> newFields) {
        return new SelectExpr(expr, params, newFields);
    }
}
