package com.nestplan.expression;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing access to a field of a source binding ({@code &ix.field}).
 *
 * <p>The source is referenced by its position in the query (0 for {@code from},
 * 1..n for joins). Resolution against a schema or a compiled subquery happens in
 * the planner; the node itself carries no type.
 */
public final class FieldAccess implements Expression {

    private final int sourceIndex;
    private final String field;

    /**
     * Creates a field access.
     *
     * @param sourceIndex the position of the source binding
     * @param field the field name
     */
    public FieldAccess(int sourceIndex, String field) {
        if (sourceIndex < 0) {
            throw new IllegalArgumentException("source index must be non-negative: " + sourceIndex);
        }
        this.sourceIndex = sourceIndex;
        this.field = Objects.requireNonNull(field, "field must not be null");
    }

    public int sourceIndex() {
        return sourceIndex;
    }

    public String field() {
        return field;
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
        return context.source(sourceIndex) + "." + field;
    }

    @Override
    public String toString() {
        return render();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FieldAccess)) return false;
        FieldAccess that = (FieldAccess) obj;
        return sourceIndex == that.sourceIndex && field.equals(that.field);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceIndex, field);
    }
}
