package com.nestplan.expression;

import java.util.Objects;

/**
 * A key/value pair of a map literal, struct literal or map update.
 *
 * @param key the key expression, normally an {@link Atom}
 * @param value the value expression
 */
public record MapEntry(Expression key, Expression value) {

    public MapEntry {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    /**
     * Creates an entry with an atom key.
     *
     * @param key the key name
     * @param value the value expression
     * @return the entry
     */
    public static MapEntry of(String key, Expression value) {
        return new MapEntry(Atom.of(key), value);
    }

    /**
     * Returns whether the key is an atom.
     *
     * @return true for atom keys
     */
    public boolean hasAtomKey() {
        return key instanceof Atom;
    }

    /**
     * Returns the key name. Only valid for atom keys.
     *
     * @return the key name
     * @throws IllegalStateException if the key is not an atom
     */
    public String keyName() {
        if (key instanceof Atom atom) {
            return atom.name();
        }
        throw new IllegalStateException("map key is not an atom: " + key.render());
    }

    String render(RenderContext context) {
        if (key instanceof Atom atom) {
            return atom.name() + ": " + value.render(context);
        }
        return key.render(context) + " => " + value.render(context);
    }
}
