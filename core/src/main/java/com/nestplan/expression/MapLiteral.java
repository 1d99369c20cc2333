package com.nestplan.expression;

import java.util.List;
import java.util.Objects;

/**
 * Expression representing a map literal ({@code %{title: &0.title}}).
 *
 * <p>Entries keep their declared order. A subquery may only select maps whose keys
 * are all atoms; the order of the keys is the order of the exposed fields.
 */
public final class MapLiteral implements Expression {

    private final List<MapEntry> entries;

    public MapLiteral(List<MapEntry> entries) {
        Objects.requireNonNull(entries, "entries must not be null");
        this.entries = List.copyOf(entries);
    }

    public static MapLiteral of(MapEntry... entries) {
        return new MapLiteral(List.of(entries));
    }

    public static MapLiteral empty() {
        return new MapLiteral(List.of());
    }

    public List<MapEntry> entries() {
        return entries;
    }

    @Override
    public List<Expression> children() {
        return MapEntries.flatten(entries);
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        return new MapLiteral(MapEntries.rebuild(children, 0));
    }

    @Override
    public String render(RenderContext context) {
        return "%{" + MapEntries.render(entries, context) + "}";
    }

    @Override
    public String toString() {
        return render();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MapLiteral)) return false;
        return entries.equals(((MapLiteral) obj).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }
}
