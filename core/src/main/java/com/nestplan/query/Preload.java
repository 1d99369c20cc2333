package com.nestplan.query;

import java.util.Objects;

/**
 * An association to preload alongside the results.
 *
 * @param association the association name on the from source
 * @param bindingIndex the join binding that loads it, or null for a separate preload query
 */
public record Preload(String association, Integer bindingIndex) {

    public Preload {
        Objects.requireNonNull(association, "association must not be null");
    }

    public static Preload of(String association) {
        return new Preload(association, null);
    }

    public static Preload viaJoin(String association, int bindingIndex) {
        return new Preload(association, bindingIndex);
    }
}
