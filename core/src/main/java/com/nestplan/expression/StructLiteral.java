package com.nestplan.expression;

import java.util.List;
import java.util.Objects;

/**
 * Expression building an entity struct ({@code %Post{text: &0.text}}).
 */
public final class StructLiteral implements Expression {

    private final String entity;
    private final List<MapEntry> entries;

    /**
     * Creates a struct literal.
     *
     * @param entity the entity whose struct is built
     * @param entries the explicitly provided fields
     */
    public StructLiteral(String entity, List<MapEntry> entries) {
        this.entity = Objects.requireNonNull(entity, "entity must not be null");
        Objects.requireNonNull(entries, "entries must not be null");
        this.entries = List.copyOf(entries);
    }

    public static StructLiteral of(String entity, MapEntry... entries) {
        return new StructLiteral(entity, List.of(entries));
    }

    public String entity() {
        return entity;
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
        return new StructLiteral(entity, MapEntries.rebuild(children, 0));
    }

    @Override
    public String render(RenderContext context) {
        return "%" + entity + "{" + MapEntries.render(entries, context) + "}";
    }

    @Override
    public String toString() {
        return render();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof StructLiteral)) return false;
        StructLiteral that = (StructLiteral) obj;
        return entity.equals(that.entity) && entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entity, entries);
    }
}
