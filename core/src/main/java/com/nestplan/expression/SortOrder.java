package com.nestplan.expression;

import java.util.List;
import java.util.Objects;

/**
 * A single order_by term ({@code asc: &0.text}).
 */
public final class SortOrder implements Expression {

    public enum Direction {
        ASC, DESC;

        String keyword() {
            return name().toLowerCase();
        }
    }

    private final Direction direction;
    private final Expression expression;

    public SortOrder(Direction direction, Expression expression) {
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
    }

    public static SortOrder asc(Expression expression) {
        return new SortOrder(Direction.ASC, expression);
    }

    public static SortOrder desc(Expression expression) {
        return new SortOrder(Direction.DESC, expression);
    }

    public Direction direction() {
        return direction;
    }

    public Expression expression() {
        return expression;
    }

    @Override
    public List<Expression> children() {
        return List.of(expression);
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        return new SortOrder(direction, children.get(0));
    }

    @Override
    public String render(RenderContext context) {
        return direction.keyword() + ": " + expression.render(context);
    }

    @Override
    public String toString() {
        return render();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SortOrder)) return false;
        SortOrder that = (SortOrder) obj;
        return direction == that.direction && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(direction, expression);
    }
}
