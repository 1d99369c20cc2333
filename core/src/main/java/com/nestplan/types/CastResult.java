package com.nestplan.types;

/**
 * Outcome of casting or dumping a value.
 *
 * <p>A successful result may carry {@code null}: nil casts to nil for every type.
 *
 * @param success whether the value could be converted
 * @param value the converted value, meaningful only on success
 */
public record CastResult(boolean success, Object value) {

    private static final CastResult ERROR = new CastResult(false, null);

    public static CastResult ok(Object value) {
        return new CastResult(true, value);
    }

    public static CastResult error() {
        return ERROR;
    }

    public boolean isError() {
        return !success;
    }
}
