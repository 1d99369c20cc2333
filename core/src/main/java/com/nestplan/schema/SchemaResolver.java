package com.nestplan.schema;

import java.util.List;
import java.util.Optional;

/**
 * Read-only source of entity metadata consumed by the planner.
 *
 * <p>Every lookup may fail: an unknown entity yields an empty result, never an
 * exception. Implementations must be safe for concurrent reads.
 */
public interface SchemaResolver {

    /**
     * Looks up the schema of an entity.
     *
     * @param entity the entity name
     * @return the schema, or empty if the entity is unknown
     */
    Optional<EntitySchema> schema(String entity);

    /**
     * Returns the queryable fields of an entity in declaration order.
     *
     * @param entity the entity name
     * @return the fields, or empty if the entity is unknown
     */
    default Optional<List<SchemaField>> fields(String entity) {
        return schema(entity).map(EntitySchema::fields);
    }

    /**
     * Returns the primary key field name of an entity.
     *
     * @param entity the entity name
     * @return the primary key, or empty if the entity is unknown or has none
     */
    default Optional<String> primaryKey(String entity) {
        return schema(entity).flatMap(EntitySchema::primaryKey);
    }

    /**
     * Looks up an association declared by an entity.
     *
     * @param entity the owner entity name
     * @param name the association name
     * @return the association, or empty if either is unknown
     */
    default Optional<Association> association(String entity, String name) {
        return schema(entity).flatMap(schema -> schema.association(name));
    }
}
