package com.nestplan.query;

import com.nestplan.expression.Expression;
import com.nestplan.expression.MapEntry;
import com.nestplan.expression.MapLiteral;
import com.nestplan.expression.StructLiteral;
import com.nestplan.schema.EntitySchema;
import com.nestplan.types.DataType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The structural kind of a subquery's output.
 *
 * <ul>
 *   <li>{@link RowShape}: a whole entity row ({@code select: p})</li>
 *   <li>{@link MapShape}: a map with atom keys ({@code select: %{title: p.title}},
 *       {@code select: p.title})</li>
 *   <li>{@link StructShape}: an entity struct with some fields provided or overridden
 *       ({@code %Post{...}}, {@code %{p | text: ...}})</li>
 *   <li>{@link MergeShape}: {@code merge(left, right)} of two other shapes</li>
 * </ul>
 *
 * <p>The shape decides what an outer query may do with the subquery binding: field
 * references resolve through {@link #fields()}, and association joins require a
 * {@link #schema()}.
 */
public sealed interface SelectShape permits RowShape, MapShape, StructShape, MergeShape {

    /**
     * Returns the exposed fields in order.
     *
     * @return the fields
     */
    List<ShapeField> fields();

    /**
     * Returns the entity schema backing this shape.
     *
     * @return the schema for row and struct shapes, empty for maps
     */
    Optional<EntitySchema> schema();

    default List<String> fieldNames() {
        List<String> names = new ArrayList<>(fields().size());
        for (ShapeField field : fields()) {
            names.add(field.name());
        }
        return Collections.unmodifiableList(names);
    }

    default Map<String, DataType> types() {
        Map<String, DataType> types = new LinkedHashMap<>();
        for (ShapeField field : fields()) {
            types.put(field.name(), field.type());
        }
        return Collections.unmodifiableMap(types);
    }

    default Optional<ShapeField> field(String name) {
        for (ShapeField field : fields()) {
            if (field.name().equals(name)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }

    /**
     * Builds the explicit select expression equivalent to this shape: a struct literal
     * for schema-backed shapes, a map literal otherwise.
     *
     * @return the select expression
     */
    default Expression toSelectExpression() {
        List<MapEntry> entries = new ArrayList<>(fields().size());
        for (ShapeField field : fields()) {
            entries.add(MapEntry.of(field.name(), field.expr()));
        }
        return schema()
            .<Expression>map(s -> new StructLiteral(s.name(), entries))
            .orElseGet(() -> new MapLiteral(entries));
    }
}
