package com.nestplan.query;

import com.nestplan.expression.Expression;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An update clause: field assignments applied by update_all.
 *
 * @param ops the assignments
 * @param params the bound values (may contain nulls)
 */
public record UpdateExpr(List<UpdateOp> ops, List<Object> params) {

    public UpdateExpr {
        Objects.requireNonNull(ops, "ops must not be null");
        Objects.requireNonNull(params, "params must not be null");
        ops = List.copyOf(ops);
        params = Collections.unmodifiableList(new ArrayList<>(params));
    }

    public static UpdateExpr set(String field, Expression value, Object... params) {
        return new UpdateExpr(List.of(UpdateOp.set(field, value)), Arrays.asList(params));
    }

    public UpdateExpr withOps(List<UpdateOp> newOps) {
        return new UpdateExpr(newOps, params);
    }

    public UpdateExpr withParams(List<Object> newParams) {
        return new UpdateExpr(ops, newParams);
    }
}
