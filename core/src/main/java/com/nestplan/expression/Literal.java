package com.nestplan.expression;

import com.nestplan.types.TypeCaster;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a constant value written directly in the query.
 *
 * <p>Unlike parameters, literals are part of the query shape and contribute to the
 * cache key. Examples: {@code 42}, {@code "hello"}, {@code true}, {@code nil}.
 */
public final class Literal implements Expression {

    private static final Literal NIL = new Literal(null);

    private final Object value;

    public Literal(Object value) {
        this.value = value;
    }

    public static Literal of(Object value) {
        return value == null ? NIL : new Literal(value);
    }

    public static Literal nil() {
        return NIL;
    }

    public Object value() {
        return value;
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        return this;
    }

    @Override
    public String render(RenderContext context) {
        return TypeCaster.inspect(value);
    }

    @Override
    public String toString() {
        return render();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        return Objects.equals(value, ((Literal) obj).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }
}
