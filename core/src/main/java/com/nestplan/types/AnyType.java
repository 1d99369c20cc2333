package com.nestplan.types;

/**
 * Data type used when nothing is known statically about a value.
 *
 * <p>Schemaless sources, computed subquery fields and unconstrained parameters are
 * typed as {@code any}; values of this type are never cast.
 */
public final class AnyType implements DataType {

    private static final AnyType INSTANCE = new AnyType();

    private AnyType() {}

    public static AnyType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "any";
    }

    @Override
    public boolean isAny() {
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof AnyType;
    }

    @Override
    public int hashCode() {
        return typeName().hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
