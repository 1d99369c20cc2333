package com.nestplan.expression;

import java.util.Collections;
import java.util.List;

/**
 * Placeholder for a bound value ({@code ^ix}).
 *
 * <p>Before normalization the index points into the parameter list of the enclosing
 * clause. Normalization rewrites it to the position of the value in the flat
 * parameter list of the whole query.
 */
public final class Parameter implements Expression {

    private final int index;

    public Parameter(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("parameter index must be non-negative: " + index);
        }
        this.index = index;
    }

    public int index() {
        return index;
    }

    /**
     * Returns a placeholder moved by the given delta.
     *
     * @param delta the amount to add to the index
     * @return the shifted placeholder
     */
    public Parameter shift(int delta) {
        return delta == 0 ? this : new Parameter(index + delta);
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
        return context.parameter(index);
    }

    @Override
    public String toString() {
        return render();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Parameter)) return false;
        return index == ((Parameter) obj).index;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(index) * 31 + 7;
    }
}
