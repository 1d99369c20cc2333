package com.nestplan.query;

import com.nestplan.schema.EntitySchema;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Shape of a subquery selecting a whole entity row.
 *
 * @param entity the entity schema
 * @param fields the schema's persisted fields, in declaration order
 */
public record RowShape(EntitySchema entity, List<ShapeField> fields) implements SelectShape {

    public RowShape {
        Objects.requireNonNull(entity, "entity must not be null");
        fields = List.copyOf(fields);
    }

    @Override
    public Optional<EntitySchema> schema() {
        return Optional.of(entity);
    }
}
