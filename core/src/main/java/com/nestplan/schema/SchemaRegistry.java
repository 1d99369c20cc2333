package com.nestplan.schema;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable in-memory {@link SchemaResolver}.
 *
 * <p>Registries are built once and then only read, so they can be shared between
 * concurrent compilations.
 */
public final class SchemaRegistry implements SchemaResolver {

    private final Map<String, EntitySchema> schemas;

    private SchemaRegistry(Map<String, EntitySchema> schemas) {
        this.schemas = Collections.unmodifiableMap(schemas);
    }

    /**
     * Creates a registry holding the given schemas, keyed by entity name.
     *
     * @param schemas the schemas
     * @return the registry
     * @throws IllegalArgumentException if two schemas share an entity name
     */
    public static SchemaRegistry of(EntitySchema... schemas) {
        Map<String, EntitySchema> byName = new LinkedHashMap<>();
        for (EntitySchema schema : schemas) {
            if (byName.putIfAbsent(schema.name(), schema) != null) {
                throw new IllegalArgumentException("duplicate schema for entity " + schema.name());
            }
        }
        return new SchemaRegistry(byName);
    }

    /**
     * Returns an empty registry; every table is then schemaless.
     *
     * @return the empty registry
     */
    public static SchemaRegistry empty() {
        return new SchemaRegistry(new LinkedHashMap<>());
    }

    @Override
    public Optional<EntitySchema> schema(String entity) {
        return Optional.ofNullable(schemas.get(entity));
    }

    public Collection<EntitySchema> schemas() {
        return schemas.values();
    }

    @Override
    public String toString() {
        return "SchemaRegistry(" + schemas.keySet() + ")";
    }
}
