package com.nestplan.types;

/**
 * Data type representing an arbitrary-precision decimal, held as a {@code BigDecimal}.
 */
public final class DecimalType implements DataType {

    private static final DecimalType INSTANCE = new DecimalType();

    private DecimalType() {}

    public static DecimalType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "decimal";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof DecimalType;
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
