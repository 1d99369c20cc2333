package com.nestplan.planner;

import com.nestplan.query.Query;
import java.util.Objects;

/**
 * The result of {@link Planner#normalize}.
 *
 * @param query the normalized query, placeholders numbered globally
 * @param nextParamIndex one past the last placeholder index used by the query
 */
public record NormalizedQuery(Query query, int nextParamIndex) {

    public NormalizedQuery {
        Objects.requireNonNull(query, "query must not be null");
        if (nextParamIndex < 0) {
            throw new IllegalArgumentException("nextParamIndex must be non-negative: " + nextParamIndex);
        }
    }
}
