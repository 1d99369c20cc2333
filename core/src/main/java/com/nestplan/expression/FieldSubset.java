package com.nestplan.expression;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Selection of a subset of the fields of a source binding ({@code select: [:title]}).
 */
public final class FieldSubset implements Expression {

    private final int sourceIndex;
    private final List<String> fields;

    public FieldSubset(int sourceIndex, List<String> fields) {
        if (sourceIndex < 0) {
            throw new IllegalArgumentException("source index must be non-negative: " + sourceIndex);
        }
        Objects.requireNonNull(fields, "fields must not be null");
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("field subset must name at least one field");
        }
        this.sourceIndex = sourceIndex;
        this.fields = List.copyOf(fields);
    }

    public static FieldSubset of(int sourceIndex, String... fields) {
        return new FieldSubset(sourceIndex, List.of(fields));
    }

    public int sourceIndex() {
        return sourceIndex;
    }

    public List<String> fields() {
        return fields;
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
        StringBuilder sb = new StringBuilder("take(").append(context.source(sourceIndex)).append(", [");
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(':').append(fields.get(i));
        }
        return sb.append("])").toString();
    }

    @Override
    public String toString() {
        return render();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FieldSubset)) return false;
        FieldSubset that = (FieldSubset) obj;
        return sourceIndex == that.sourceIndex && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceIndex, fields);
    }
}
