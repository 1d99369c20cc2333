package com.nestplan.schema;

import com.nestplan.types.DataType;
import com.nestplan.types.IntegerType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Metadata describing an entity: its table, declared fields, primary key and
 * associations.
 *
 * <p>Field order is declaration order, with the primary key first. Virtual fields are
 * kept in {@link #allFields()} but excluded from {@link #fields()}, which is what a
 * whole-row select exposes.
 *
 * <p>Example:
 * <pre>
 *   EntitySchema post = EntitySchema.builder("Post", "posts")
 *       .primaryKey("id", IntegerType.get())
 *       .field("title", StringType.get(), "post_title")
 *       .field("text", StringType.get())
 *       .hasMany("comments", "Comment", "post_id")
 *       .build();
 * </pre>
 */
public final class EntitySchema {

    private final String name;
    private final String table;
    private final String primaryKey;
    private final List<SchemaField> fields;
    private final Map<String, Association> associations;

    private EntitySchema(Builder builder) {
        this.name = builder.name;
        this.table = builder.table;
        this.primaryKey = builder.primaryKey;
        this.fields = List.copyOf(builder.fields.values());
        this.associations = Collections.unmodifiableMap(new LinkedHashMap<>(builder.associations));
    }

    public static Builder builder(String name, String table) {
        return new Builder(name, table);
    }

    public String name() {
        return name;
    }

    public String table() {
        return table;
    }

    public Optional<String> primaryKey() {
        return Optional.ofNullable(primaryKey);
    }

    /**
     * Returns the queryable (non-virtual) fields in declaration order.
     *
     * @return the persisted fields
     */
    public List<SchemaField> fields() {
        List<SchemaField> persisted = new ArrayList<>(fields.size());
        for (SchemaField field : fields) {
            if (!field.virtual()) {
                persisted.add(field);
            }
        }
        return persisted;
    }

    /**
     * Returns the queryable field names in declaration order.
     *
     * @return the persisted field names
     */
    public List<String> fieldNames() {
        List<String> names = new ArrayList<>(fields.size());
        for (SchemaField field : fields()) {
            names.add(field.name());
        }
        return names;
    }

    /**
     * Returns every declared field, virtual ones included.
     *
     * @return all fields
     */
    public List<SchemaField> allFields() {
        return fields;
    }

    /**
     * Looks up a declared field by name, virtual fields included.
     *
     * @param fieldName the field name
     * @return the field, or empty if not declared
     */
    public Optional<SchemaField> field(String fieldName) {
        for (SchemaField field : fields) {
            if (field.name().equals(fieldName)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }

    public Optional<Association> association(String associationName) {
        return Optional.ofNullable(associations.get(associationName));
    }

    public Map<String, Association> associations() {
        return associations;
    }

    /**
     * Returns a structural fingerprint of the persisted layout of this schema.
     *
     * <p>Two schemas with the same table and the same fields (names, types, columns)
     * have the same fingerprint.
     *
     * @return the fingerprint
     */
    public int fingerprint() {
        return Objects.hash(name, table, fields());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntitySchema)) return false;
        EntitySchema that = (EntitySchema) o;
        return name.equals(that.name) && table.equals(that.table)
            && Objects.equals(primaryKey, that.primaryKey)
            && fields.equals(that.fields)
            && associations.equals(that.associations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, table, primaryKey, fields);
    }

    @Override
    public String toString() {
        return "EntitySchema(" + name + ", " + table + ", " + fields + ")";
    }

    /**
     * Builder for {@link EntitySchema}.
     */
    public static final class Builder {

        private final String name;
        private final String table;
        private String primaryKey;
        private final LinkedHashMap<String, SchemaField> fields = new LinkedHashMap<>();
        private final LinkedHashMap<String, Association> associations = new LinkedHashMap<>();

        private Builder(String name, String table) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            this.table = Objects.requireNonNull(table, "table must not be null");
        }

        /**
         * Declares the primary key. It is always placed first in field order.
         */
        public Builder primaryKey(String fieldName, DataType type) {
            LinkedHashMap<String, SchemaField> reordered = new LinkedHashMap<>();
            reordered.put(fieldName, new SchemaField(fieldName, type));
            fields.remove(fieldName);
            reordered.putAll(fields);
            fields.clear();
            fields.putAll(reordered);
            this.primaryKey = fieldName;
            return this;
        }

        public Builder field(String fieldName, DataType type) {
            return addField(new SchemaField(fieldName, type));
        }

        public Builder field(String fieldName, DataType type, String source) {
            return addField(new SchemaField(fieldName, type, source, false));
        }

        public Builder virtualField(String fieldName, DataType type) {
            return addField(new SchemaField(fieldName, type, fieldName, true));
        }

        /**
         * Declares a has_many association keyed by the owner's primary key.
         */
        public Builder hasMany(String associationName, String related, String foreignKey) {
            return addAssociation(new Association(associationName, Association.Cardinality.HAS_MANY,
                name, related, ownerPrimaryKey(), foreignKey));
        }

        /**
         * Declares a has_one association keyed by the owner's primary key.
         */
        public Builder hasOne(String associationName, String related, String foreignKey) {
            return addAssociation(new Association(associationName, Association.Cardinality.HAS_ONE,
                name, related, ownerPrimaryKey(), foreignKey));
        }

        /**
         * Declares a belongs_to association and its integer foreign key field
         * ({@code <name>_id}).
         */
        public Builder belongsTo(String associationName, String related) {
            String foreignKey = associationName + "_id";
            if (!fields.containsKey(foreignKey)) {
                field(foreignKey, IntegerType.get());
            }
            return addAssociation(new Association(associationName, Association.Cardinality.BELONGS_TO,
                name, related, foreignKey, "id"));
        }

        public EntitySchema build() {
            return new EntitySchema(this);
        }

        private String ownerPrimaryKey() {
            if (primaryKey == null) {
                throw new IllegalArgumentException(
                    "schema " + name + " must declare a primary key before has_many/has_one associations");
            }
            return primaryKey;
        }

        private Builder addField(SchemaField field) {
            if (fields.putIfAbsent(field.name(), field) != null) {
                throw new IllegalArgumentException(
                    "field `" + field.name() + "` is already declared in schema " + name);
            }
            return this;
        }

        private Builder addAssociation(Association association) {
            if (associations.putIfAbsent(association.name(), association) != null) {
                throw new IllegalArgumentException(
                    "association `" + association.name() + "` is already declared in schema " + name);
            }
            return this;
        }
    }
}
