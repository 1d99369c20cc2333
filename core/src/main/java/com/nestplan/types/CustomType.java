package com.nestplan.types;

import java.util.Objects;

/**
 * Base class for user-defined data types.
 *
 * <p>A custom type decides how external values are cast into its runtime form and how
 * that runtime form is dumped for the adapter. For example, a permalink type may accept
 * {@code "1-hello-world"} and cast it to the integer id {@code 1}.
 *
 * <p>Custom types are compared by name; two instances with the same name are the same
 * type.
 */
public abstract non-sealed class CustomType implements DataType {

    private final String name;

    /**
     * Creates a custom type.
     *
     * @param name the type name used in error messages and cache keys
     */
    protected CustomType(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    /**
     * Casts an external value into this type's runtime form.
     *
     * @param value the value to cast, never null
     * @return the cast result
     */
    public abstract CastResult cast(Object value);

    /**
     * Dumps a runtime value into the form the adapter stores.
     *
     * <p>The default implementation returns the value unchanged.
     *
     * @param value the cast value, never null
     * @return the dump result
     */
    public CastResult dump(Object value) {
        return CastResult.ok(value);
    }

    @Override
    public String typeName() {
        return name;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return name.equals(((CustomType) obj).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
