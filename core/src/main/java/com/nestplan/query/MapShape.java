package com.nestplan.query;

import com.nestplan.schema.EntitySchema;
import java.util.List;
import java.util.Optional;

/**
 * Shape of a subquery selecting a map with atom keys.
 *
 * @param fields the map entries, in key order
 */
public record MapShape(List<ShapeField> fields) implements SelectShape {

    public MapShape {
        fields = List.copyOf(fields);
    }

    @Override
    public Optional<EntitySchema> schema() {
        return Optional.empty();
    }
}
