package com.nestplan.planner;

import com.nestplan.exception.ErrorKind;
import com.nestplan.exception.QueryCompilationException;
import com.nestplan.query.Clause;
import com.nestplan.query.Query;
import com.nestplan.query.Source;
import com.nestplan.query.Subquery;
import com.nestplan.query.TableSource;
import com.nestplan.schema.EntitySchema;
import com.nestplan.schema.SchemaField;
import com.nestplan.schema.SchemaResolver;
import com.nestplan.types.AnyType;
import com.nestplan.types.DataType;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves field references against the sources of a prepared query.
 *
 * <p>Resolution rules by source kind:
 * <ul>
 *   <li>entity table: the field must be declared and not virtual; its schema type is used</li>
 *   <li>schemaless table: every field is accepted with type {@code any}</li>
 *   <li>compiled subquery: the field must be in the subquery's field list; its inferred type is used</li>
 * </ul>
 */
final class FieldResolver {

    private final SchemaResolver schemas;

    FieldResolver(SchemaResolver schemas) {
        this.schemas = Objects.requireNonNull(schemas, "schemas must not be null");
    }

    /**
     * Looks up the schema of an entity, failing when it is unknown.
     *
     * @param entity the entity name
     * @param context the query reported on failure
     * @return the schema
     * @throws QueryCompilationException if the resolver does not know the entity
     */
    EntitySchema requireSchema(String entity, Query context) {
        return schemas.schema(entity).orElseThrow(() -> new QueryCompilationException(
            ErrorKind.UNKNOWN_SCHEMA, "schema `" + entity + "` is not known", context));
    }

    /**
     * Returns the schema carried by a source: the entity schema of a table, or the
     * schema of a compiled subquery's select.
     *
     * @param source the source
     * @return the schema, or empty for schemaless tables and schemaless subquery selects
     */
    Optional<EntitySchema> schemaOf(Source source) {
        if (source instanceof TableSource table) {
            return table.hasSchema() ? schemas.schema(table.entity()) : Optional.empty();
        }
        if (source instanceof Subquery sub && sub.isCompiled()) {
            return sub.shape().schema();
        }
        return Optional.empty();
    }

    /**
     * Returns the source bound at a position, failing when the query binds nothing there.
     *
     * @param query the prepared query owning the binding
     * @param index the binding position
     * @param clause the clause the reference appears in
     * @param context the query reported on failure
     * @return the source
     * @throws QueryCompilationException if no source is bound at {@code index}
     */
    Source requireSource(Query query, int index, Clause clause, Query context) {
        if (index < 0 || index >= query.sourceCount()) {
            throw new QueryCompilationException(ErrorKind.UNKNOWN_FIELD,
                "binding `&" + index + "` referenced in `" + clause.keyword() + "` does not exist", context, clause);
        }
        return query.sourceAt(index);
    }

    /**
     * Resolves the type of {@code &ix.field}.
     *
     * @param query the prepared query owning the binding
     * @param index the binding position
     * @param field the field name
     * @param clause the clause the reference appears in
     * @param context the query reported on failure
     * @return the field type
     * @throws QueryCompilationException if the field cannot be referenced
     */
    DataType fieldType(Query query, int index, String field, Clause clause, Query context) {
        Source source = requireSource(query, index, clause, context);
        if (source instanceof Subquery sub) {
            return sub.fieldType(field).orElseThrow(() -> new QueryCompilationException(
                ErrorKind.UNKNOWN_FIELD_IN_SUBQUERY, "field `" + field + "` does not exist in subquery",
                context, clause));
        }
        TableSource table = (TableSource) source;
        if (!table.hasSchema()) {
            return AnyType.get();
        }
        EntitySchema schema = requireSchema(table.entity(), context);
        SchemaField declared = schema.field(field).orElseThrow(() -> new QueryCompilationException(
            ErrorKind.UNKNOWN_FIELD,
            "field `" + field + "` in `" + clause.keyword() + "` does not exist in schema " + schema.name(),
            context, clause));
        if (declared.virtual()) {
            throw new QueryCompilationException(ErrorKind.VIRTUAL_FIELD,
                "field `" + field + "` in `" + clause.keyword() + "` is a virtual field in schema " + schema.name(),
                context, clause);
        }
        return declared.dataType();
    }
}
