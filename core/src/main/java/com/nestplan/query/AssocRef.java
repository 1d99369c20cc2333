package com.nestplan.query;

import java.util.Objects;

/**
 * Reference to an association of an existing binding ({@code assoc(p, :comments)}).
 *
 * @param parentIndex the binding the association is declared on
 * @param name the association name
 */
public record AssocRef(int parentIndex, String name) {

    public AssocRef {
        Objects.requireNonNull(name, "name must not be null");
        if (parentIndex < 0) {
            throw new IllegalArgumentException("parent index must be non-negative: " + parentIndex);
        }
    }
}
