package com.nestplan.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Expression representing a list of expressions ({@code [a, b]}).
 *
 * <p>Used for list selects such as {@code select: [p.title, ^"first"]} and for
 * order_by terms.
 */
public final class ListExpression implements Expression {

    private final List<Expression> elements;

    public ListExpression(List<Expression> elements) {
        Objects.requireNonNull(elements, "elements must not be null");
        this.elements = List.copyOf(elements);
    }

    public static ListExpression of(Expression... elements) {
        return new ListExpression(List.of(elements));
    }

    public List<Expression> elements() {
        return elements;
    }

    @Override
    public List<Expression> children() {
        return elements;
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        return new ListExpression(new ArrayList<>(children));
    }

    @Override
    public String render(RenderContext context) {
        return elements.stream()
            .map(e -> e.render(context))
            .collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public String toString() {
        return render();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ListExpression)) return false;
        return elements.equals(((ListExpression) obj).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }
}
