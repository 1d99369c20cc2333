package com.nestplan.schema;

import com.nestplan.types.DataType;
import java.util.Objects;

/**
 * A field declared by an entity schema.
 *
 * @param name the field name used in queries
 * @param dataType the field type
 * @param source the column the field is stored in
 * @param virtual whether the field exists only in memory and cannot be queried
 */
public record SchemaField(String name, DataType dataType, String source, boolean virtual) {

    public SchemaField {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(dataType, "dataType must not be null");
        Objects.requireNonNull(source, "source must not be null");
    }

    /**
     * Creates a persisted field stored in a column with the same name.
     *
     * @param name the field name
     * @param dataType the field type
     */
    public SchemaField(String name, DataType dataType) {
        this(name, dataType, name, false);
    }

    @Override
    public String toString() {
        return name + ": " + dataType + (source.equals(name) ? "" : " (" + source + ")")
            + (virtual ? " VIRTUAL" : "");
    }
}
