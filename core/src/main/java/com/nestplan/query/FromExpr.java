package com.nestplan.query;

import java.util.Objects;

/**
 * The from clause: the primary source, always bound at position 0.
 *
 * @param source the source
 * @param binding the binding name used when rendering the query
 */
public record FromExpr(Source source, String binding) {

    public FromExpr {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(binding, "binding must not be null");
    }

    public FromExpr withSource(Source newSource) {
        return new FromExpr(newSource, binding);
    }
}
