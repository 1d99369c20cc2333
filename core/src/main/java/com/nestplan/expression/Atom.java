package com.nestplan.expression;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A symbolic name, such as a map key ({@code title:}) or a field name in a subset.
 *
 * <p>Map literals selected by a subquery must use atoms as keys.
 */
public final class Atom implements Expression {

    private final String name;

    public Atom(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("atom name must not be empty");
        }
    }

    public static Atom of(String name) {
        return new Atom(name);
    }

    public String name() {
        return name;
    }

    /**
     * Returns whether this atom is {@code :true} or {@code :false}.
     *
     * @return true for boolean atoms
     */
    public boolean isBoolean() {
        return name.equals("true") || name.equals("false");
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
        return ":" + name;
    }

    @Override
    public String toString() {
        return render();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Atom)) return false;
        return name.equals(((Atom) obj).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
