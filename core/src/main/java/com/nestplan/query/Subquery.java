package com.nestplan.query;

import com.nestplan.types.DataType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A query used as a source of another query ({@code from p in subquery(...)}).
 *
 * <p>A subquery starts out uncompiled, wrapping the inner query as written. The
 * planner compiles it exactly once per occurrence, producing a new instance that
 * carries:
 * <ul>
 *   <li>the prepared inner query, with an explicit select and placeholders numbered
 *       {@code 0..M-1}</li>
 *   <li>the {@link SelectShape} with the ordered field list and field types</li>
 *   <li>the cast inner parameters and the inner cache key</li>
 *   <li>the offset of its parameters in the flat parameter list of the outer query</li>
 * </ul>
 *
 * <p>Instances are immutable; attaching a compiled subquery at another position
 * creates a copy with a different offset.
 */
public final class Subquery implements Source {

    private final Query query;
    private final SelectShape shape;
    private final List<Object> params;
    private final CacheKey cacheKey;
    private final int paramOffset;

    private Subquery(Query query, SelectShape shape, List<Object> params, CacheKey cacheKey, int paramOffset) {
        this.query = Objects.requireNonNull(query, "query must not be null");
        this.shape = shape;
        this.params = params;
        this.cacheKey = cacheKey;
        this.paramOffset = paramOffset;
    }

    /**
     * Wraps a query so it can be used as a source.
     *
     * @param query the inner query
     * @return the uncompiled subquery
     */
    public static Subquery of(Query query) {
        return new Subquery(query, null, null, null, 0);
    }

    /**
     * Returns a compiled copy of this subquery.
     *
     * @param preparedQuery the prepared inner query
     * @param shape the compiled select shape
     * @param params the cast inner parameters, in inner traversal order
     * @param cacheKey the inner cache key
     * @param paramOffset the position of the first inner parameter in the outer list
     * @return the compiled subquery
     */
    public Subquery compiled(Query preparedQuery, SelectShape shape, List<Object> params,
                             CacheKey cacheKey, int paramOffset) {
        Objects.requireNonNull(shape, "shape must not be null");
        Objects.requireNonNull(params, "params must not be null");
        Objects.requireNonNull(cacheKey, "cacheKey must not be null");
        if (paramOffset < 0) {
            throw new IllegalArgumentException("paramOffset must be non-negative: " + paramOffset);
        }
        return new Subquery(preparedQuery, shape,
            Collections.unmodifiableList(new ArrayList<>(params)), cacheKey, paramOffset);
    }

    /**
     * Returns this compiled subquery with its inner query replaced, e.g. after the
     * inner placeholders were renumbered for the outer query.
     *
     * @param newQuery the rewritten inner query
     * @return the copy
     */
    public Subquery withQuery(Query newQuery) {
        return new Subquery(newQuery, shape, params, cacheKey, paramOffset);
    }

    /**
     * Returns this compiled subquery attached at another parameter offset.
     *
     * @param newOffset the position of the first inner parameter in the outer list
     * @return the copy, or this subquery when the offset is unchanged
     */
    public Subquery atOffset(int newOffset) {
        requireCompiled();
        if (newOffset == paramOffset) {
            return this;
        }
        return compiled(query, shape, params, cacheKey, newOffset);
    }

    public Query query() {
        return query;
    }

    public boolean isCompiled() {
        return shape != null;
    }

    /**
     * Returns the compiled shape.
     *
     * @return the shape
     * @throws IllegalStateException if the subquery has not been compiled
     */
    public SelectShape shape() {
        requireCompiled();
        return shape;
    }

    /**
     * Returns the exposed field names, in order.
     *
     * @return the field list
     * @throws IllegalStateException if the subquery has not been compiled
     */
    public List<String> fields() {
        return shape().fieldNames();
    }

    /**
     * Returns the exposed field types, keyed by field name in field order.
     *
     * @return the type map
     * @throws IllegalStateException if the subquery has not been compiled
     */
    public Map<String, DataType> types() {
        return shape().types();
    }

    /**
     * Looks up the type of an exposed field.
     *
     * @param field the field name
     * @return the type, or empty if the subquery does not expose the field
     */
    public Optional<DataType> fieldType(String field) {
        return shape().field(field).map(ShapeField::type);
    }

    public List<Object> params() {
        requireCompiled();
        return params;
    }

    public CacheKey cacheKey() {
        requireCompiled();
        return cacheKey;
    }

    public int paramOffset() {
        return paramOffset;
    }

    private void requireCompiled() {
        if (shape == null) {
            throw new IllegalStateException("subquery has not been compiled: " + query);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Subquery)) return false;
        Subquery that = (Subquery) o;
        return paramOffset == that.paramOffset && query.equals(that.query)
            && Objects.equals(shape, that.shape) && Objects.equals(params, that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(query, shape, paramOffset);
    }

    @Override
    public String toString() {
        return "subquery(" + QueryRenderer.render(query) + ")";
    }
}
