package com.nestplan.expression;

import java.util.List;
import java.util.Objects;

/**
 * Expression merging two map-like values ({@code merge(left, right)}).
 *
 * <p>Keys of the right operand win over keys of the left operand.
 */
public final class Merge implements Expression {

    private final Expression left;
    private final Expression right;

    public Merge(Expression left, Expression right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    public static Merge of(Expression left, Expression right) {
        return new Merge(left, right);
    }

    public Expression left() {
        return left;
    }

    public Expression right() {
        return right;
    }

    @Override
    public List<Expression> children() {
        return List.of(left, right);
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        return new Merge(children.get(0), children.get(1));
    }

    @Override
    public String render(RenderContext context) {
        return "merge(" + left.render(context) + ", " + right.render(context) + ")";
    }

    @Override
    public String toString() {
        return render();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Merge)) return false;
        Merge that = (Merge) obj;
        return left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash("merge", left, right);
    }
}
