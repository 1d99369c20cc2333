package com.nestplan.expression;

import java.util.Collections;
import java.util.List;

/**
 * Reference to a whole source binding ({@code &ix}).
 *
 * <p>Selecting a source reference selects the entire row of that source.
 */
public final class SourceRef implements Expression {

    private final int index;

    public SourceRef(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("source index must be non-negative: " + index);
        }
        this.index = index;
    }

    public int index() {
        return index;
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
        return context.source(index);
    }

    @Override
    public String toString() {
        return render();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SourceRef)) return false;
        return index == ((SourceRef) obj).index;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(index);
    }
}
