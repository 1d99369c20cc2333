package com.nestplan.query;

/**
 * Source reading a table directly.
 *
 * <p>A table source is either schemaless ({@code from p in "posts"}, entity is null) or
 * bound to an entity schema ({@code from p in Post}). An entity-only source has its
 * table filled in from the schema during preparation.
 *
 * @param table the table name, null until resolved for entity-only sources
 * @param entity the entity name, null for schemaless sources
 */
public record TableSource(String table, String entity) implements Source {

    public TableSource {
        if (table == null && entity == null) {
            throw new IllegalArgumentException("table source needs a table or an entity");
        }
    }

    public static TableSource schemaless(String table) {
        return new TableSource(table, null);
    }

    public static TableSource entity(String entity) {
        return new TableSource(null, entity);
    }

    public boolean hasSchema() {
        return entity != null;
    }

    @Override
    public String toString() {
        return hasSchema() ? entity : "\"" + table + "\"";
    }
}
