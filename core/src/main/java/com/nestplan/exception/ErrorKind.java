package com.nestplan.exception;

/**
 * Classifies query compilation failures.
 *
 * <p>Every {@link QueryCompilationException} carries exactly one kind, so callers can
 * react to a failure without parsing its message.
 */
public enum ErrorKind {

    /** A bound value or literal cannot be cast to the type its context requires. */
    CAST_ERROR,

    /** A field is referenced that the subquery does not select. */
    UNKNOWN_FIELD_IN_SUBQUERY,

    /** A map key in a subquery select is not an atom, or a map update names an undeclared field. */
    INVALID_MAP_KEY,

    /** A subquery selects something other than a source, a field, a map or a struct. */
    UNSUPPORTED_SUBQUERY_SELECT,

    /** The operands of a {@code merge} cannot be combined. */
    ILLEGAL_MERGE_TARGET,

    /** A subquery declares preloads. */
    ILLEGAL_PRELOAD_IN_SUBQUERY,

    /** A subquery declares update clauses. */
    ILLEGAL_UPDATE_IN_SUBQUERY,

    /** A bulk update or delete reads from a subquery. */
    SUBQUERY_NOT_ALLOWED_IN_BULK_FROM,

    /** An association join targets a subquery whose select carries no schema. */
    ASSOCIATION_REQUIRES_SOURCE_SCHEMA,

    /** A field subset is taken from a subquery selecting a map or struct. */
    CANNOT_SUBSET_SUBQUERY_STRUCT,

    /** A field is referenced that the schema does not declare. */
    UNKNOWN_FIELD,

    /** A virtual field is referenced in a query. */
    VIRTUAL_FIELD,

    /** An association join names an association the schema does not declare. */
    UNKNOWN_ASSOCIATION,

    /** A source names an entity the schema resolver does not know. */
    UNKNOWN_SCHEMA,

    /** Update clauses appear in a query that is not a bulk update. */
    ILLEGAL_UPDATE,

    /** A bulk update declares no update clause. */
    MISSING_UPDATE,

    /** A bulk update or delete uses a clause other than joins, filters and select. */
    ILLEGAL_BULK_CLAUSE,

    /** A whole schemaless source is selected where its fields must be known. */
    SCHEMALESS_SOURCE_SELECT,

    /** Subqueries are nested deeper than the configured limit. */
    SUBQUERY_TOO_DEEP
}
