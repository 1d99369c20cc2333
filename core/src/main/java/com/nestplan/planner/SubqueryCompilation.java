package com.nestplan.planner;

import com.nestplan.exception.QueryCompilationException;
import com.nestplan.query.Subquery;
import java.util.Objects;

/**
 * Outcome of compiling one subquery.
 *
 * <p>Failures are returned rather than thrown so the caller decides where the
 * subquery boundary is reported; the planner turns a {@link Failed} result into a
 * {@link com.nestplan.exception.SubqueryException} naming the outer query.
 */
sealed interface SubqueryCompilation permits SubqueryCompilation.Compiled, SubqueryCompilation.Failed {

    /**
     * The subquery compiled.
     *
     * @param subquery the compiled subquery
     */
    record Compiled(Subquery subquery) implements SubqueryCompilation {
        public Compiled {
            Objects.requireNonNull(subquery, "subquery must not be null");
        }
    }

    /**
     * The subquery failed to compile.
     *
     * @param error the failure raised inside the subquery
     * @param subquery the subquery as written
     */
    record Failed(QueryCompilationException error, Subquery subquery) implements SubqueryCompilation {
        public Failed {
            Objects.requireNonNull(error, "error must not be null");
            Objects.requireNonNull(subquery, "subquery must not be null");
        }
    }
}
