package com.nestplan.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Expression overriding fields of a base value ({@code %{&0 | text: &0.title}}).
 *
 * <p>In a subquery select the base must be a source binding with a schema, and every
 * overridden key must be a field of that schema.
 */
public final class MapUpdate implements Expression {

    private final Expression base;
    private final List<MapEntry> updates;

    public MapUpdate(Expression base, List<MapEntry> updates) {
        this.base = Objects.requireNonNull(base, "base must not be null");
        Objects.requireNonNull(updates, "updates must not be null");
        this.updates = List.copyOf(updates);
    }

    public static MapUpdate of(Expression base, MapEntry... updates) {
        return new MapUpdate(base, List.of(updates));
    }

    public Expression base() {
        return base;
    }

    public List<MapEntry> updates() {
        return updates;
    }

    @Override
    public List<Expression> children() {
        List<Expression> children = new ArrayList<>();
        children.add(base);
        children.addAll(MapEntries.flatten(updates));
        return children;
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        return new MapUpdate(children.get(0), MapEntries.rebuild(children, 1));
    }

    @Override
    public String render(RenderContext context) {
        return "%{" + base.render(context) + " | " + MapEntries.render(updates, context) + "}";
    }

    @Override
    public String toString() {
        return render();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MapUpdate)) return false;
        MapUpdate that = (MapUpdate) obj;
        return base.equals(that.base) && updates.equals(that.updates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, updates);
    }
}
