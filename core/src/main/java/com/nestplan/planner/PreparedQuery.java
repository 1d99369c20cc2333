package com.nestplan.planner;

import com.nestplan.query.CacheKey;
import com.nestplan.query.Query;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The result of {@link Planner#prepare}.
 *
 * @param query the prepared query: sources resolved, subqueries compiled, association joins expanded
 * @param params the cast and dumped parameters in clause traversal order, subquery parameters included
 * @param cacheKey the value-independent key identifying the query structure
 */
public record PreparedQuery(Query query, List<Object> params, CacheKey cacheKey) {

    public PreparedQuery {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(params, "params must not be null");
        Objects.requireNonNull(cacheKey, "cacheKey must not be null");
        params = Collections.unmodifiableList(new ArrayList<>(params));
    }

    public PreparedQuery withQuery(Query newQuery) {
        return new PreparedQuery(newQuery, params, cacheKey);
    }
}
