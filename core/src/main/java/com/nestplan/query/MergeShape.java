package com.nestplan.query;

import com.nestplan.schema.EntitySchema;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Shape of {@code merge(base, overrides)}: the fields of {@code base} in order, each replaced by
 * the field of the same name in {@code overrides}, followed by the fields only
 * {@code overrides} has. The schema, if any, is the base's.
 *
 * @param base the left side of the merge
 * @param overrides the right side of the merge
 */
public record MergeShape(SelectShape base, SelectShape overrides) implements SelectShape {

    public MergeShape {
        Objects.requireNonNull(base, "base must not be null");
        Objects.requireNonNull(overrides, "overrides must not be null");
    }

    @Override
    public List<ShapeField> fields() {
        Map<String, ShapeField> merged = new LinkedHashMap<>();
        for (ShapeField field : base.fields()) {
            merged.put(field.name(), field);
        }
        for (ShapeField field : overrides.fields()) {
            merged.put(field.name(), field);
        }
        return List.copyOf(new ArrayList<>(merged.values()));
    }

    @Override
    public Optional<EntitySchema> schema() {
        return base.schema();
    }

    /**
     * Returns the names of fields whose value does not come straight from a row.
     *
     * @return the overridden field names
     */
    public Set<String> overridden() {
        Set<String> names = new LinkedHashSet<>();
        if (base instanceof StructShape struct) {
            names.addAll(struct.overridden());
        } else if (base instanceof MergeShape merge) {
            names.addAll(merge.overridden());
        }
        names.addAll(overrides.fieldNames());
        return names;
    }
}
