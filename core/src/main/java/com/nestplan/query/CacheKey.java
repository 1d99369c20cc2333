package com.nestplan.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Structural fingerprint of a prepared query.
 *
 * <p>A key is an ordered list of parts; parts are strings, numbers, enums, nested
 * lists or nested keys (a subquery contributes its own key). Two queries with equal
 * keys compile to the same plan, regardless of their bound values.
 */
public final class CacheKey {

    private final List<Object> parts;

    private CacheKey(List<Object> parts) {
        this.parts = Collections.unmodifiableList(new ArrayList<>(parts));
    }

    public static CacheKey of(Object... parts) {
        return new CacheKey(Arrays.asList(parts));
    }

    public static CacheKey of(List<Object> parts) {
        return new CacheKey(parts);
    }

    public List<Object> parts() {
        return parts;
    }

    public Object part(int index) {
        return parts.get(index);
    }

    public int size() {
        return parts.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CacheKey)) return false;
        return parts.equals(((CacheKey) o).parts);
    }

    @Override
    public int hashCode() {
        return parts.hashCode();
    }

    @Override
    public String toString() {
        return parts.toString();
    }
}
