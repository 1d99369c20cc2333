package com.nestplan.query;

import com.nestplan.expression.Expression;
import com.nestplan.types.DataType;
import java.util.Objects;

/**
 * A field exposed by a compiled select.
 *
 * @param name the exposed field name
 * @param expr the expression producing the value, relative to the inner query
 * @param type the inferred type of the value
 */
public record ShapeField(String name, Expression expr, DataType type) {

    public ShapeField {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(expr, "expr must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    public ShapeField withExpr(Expression newExpr) {
        return new ShapeField(name, newExpr, type);
    }
}
