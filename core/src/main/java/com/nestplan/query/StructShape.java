package com.nestplan.query;

import com.nestplan.schema.EntitySchema;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Shape of a subquery selecting an entity struct whose fields may be overridden.
 *
 * @param entity the entity schema
 * @param fields the exposed fields, in the schema's declaration order
 * @param overridden the names of fields whose value does not come straight from the row
 */
public record StructShape(EntitySchema entity, List<ShapeField> fields, Set<String> overridden)
        implements SelectShape {

    public StructShape {
        Objects.requireNonNull(entity, "entity must not be null");
        fields = List.copyOf(fields);
        overridden = Set.copyOf(overridden);
    }

    @Override
    public Optional<EntitySchema> schema() {
        return Optional.of(entity);
    }
}
