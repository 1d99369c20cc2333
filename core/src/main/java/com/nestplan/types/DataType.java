package com.nestplan.types;

/**
 * Sealed interface for all data types known to the planner.
 *
 * <p>A data type describes the values a schema field, a subquery field or a bound
 * parameter may hold. Types are used to cast bound values before they are handed to
 * the adapter, and to check literals compared with typed fields.
 *
 * <p>Available types:
 * <ul>
 *   <li>Primitive types: IntegerType, FloatType, DecimalType, BooleanType, StringType</li>
 *   <li>Temporal types: DateType</li>
 *   <li>Container types: ArrayType, MapType</li>
 *   <li>{@link AnyType}: no static information, values pass through unchanged</li>
 *   <li>{@link CustomType}: user-defined types with their own cast and dump rules</li>
 * </ul>
 */
public sealed interface DataType
    permits AnyType, BooleanType, IntegerType, FloatType, DecimalType, StringType,
            DateType, ArrayType, MapType, CustomType {

    /**
     * Returns a human-readable name for this data type, as used in error messages.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns whether this type carries no static information.
     *
     * @return true for {@link AnyType}
     */
    default boolean isAny() {
        return false;
    }
}
