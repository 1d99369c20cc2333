package com.nestplan.types;

/**
 * Text field type, held as a {@code String}.
 *
 * <p>Only character sequences cast to it; numbers are not converted to their text form,
 * so comparing {@code title} with {@code 1} is a cast error.
 */
public final class StringType implements DataType {

    private static final StringType INSTANCE = new StringType();

    private StringType() {}

    public static StringType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "string";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof StringType;
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
