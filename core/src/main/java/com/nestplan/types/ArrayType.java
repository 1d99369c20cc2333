package com.nestplan.types;

import java.util.Objects;

/**
 * Data type representing a list of values that share an element type.
 *
 * <p>Array types are inferred for parameters on the right-hand side of an {@code in}
 * comparison: {@code p.id in ^ids} casts {@code ids} to {@code array<typeof(p.id)>}.
 */
public final class ArrayType implements DataType {

    private final DataType elementType;

    /**
     * Creates an array type.
     *
     * @param elementType the element type
     */
    public ArrayType(DataType elementType) {
        this.elementType = Objects.requireNonNull(elementType, "elementType must not be null");
    }

    /**
     * Returns the element type.
     *
     * @return the element type
     */
    public DataType elementType() {
        return elementType;
    }

    @Override
    public String typeName() {
        return "array<" + elementType.typeName() + ">";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ArrayType)) return false;
        ArrayType that = (ArrayType) obj;
        return Objects.equals(elementType, that.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash("array", elementType);
    }

    @Override
    public String toString() {
        return typeName();
    }
}
