package com.nestplan.types;

/**
 * Data type representing an untyped map value.
 */
public final class MapType implements DataType {

    private static final MapType INSTANCE = new MapType();

    private MapType() {}

    public static MapType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "map";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof MapType;
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
