package com.nestplan.types;

/**
 * Integral field type, held as a {@code Long}.
 *
 * <p>Also the type {@code limit} and {@code offset} values are cast to. Fractional numbers
 * do not cast; integer strings are parsed.
 */
public final class IntegerType implements DataType {

    private static final IntegerType INSTANCE = new IntegerType();

    private IntegerType() {}

    public static IntegerType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "integer";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof IntegerType;
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
