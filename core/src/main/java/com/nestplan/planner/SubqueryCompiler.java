package com.nestplan.planner;

import com.nestplan.exception.ErrorKind;
import com.nestplan.exception.QueryCompilationException;
import com.nestplan.query.Operation;
import com.nestplan.query.Query;
import com.nestplan.query.SelectExpr;
import com.nestplan.query.SelectShape;
import com.nestplan.query.Subquery;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a subquery found in the {@code from} or a join of an outer query.
 *
 * <p>The inner query is prepared as a standalone {@code all} query, its select is
 * compiled into a {@link SelectShape}, and it is normalized so its placeholders run
 * from 0. The outer query later shifts those placeholders to the subquery's offset.
 */
final class SubqueryCompiler {

    private static final Logger logger = LoggerFactory.getLogger(SubqueryCompiler.class);

    private final Planner planner;
    private final SelectCompiler selectCompiler;
    private final PlannerConfig config;

    SubqueryCompiler(Planner planner, SelectCompiler selectCompiler, PlannerConfig config) {
        this.planner = Objects.requireNonNull(planner, "planner must not be null");
        this.selectCompiler = Objects.requireNonNull(selectCompiler, "selectCompiler must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Compiles a subquery.
     *
     * @param subquery the subquery as written
     * @param adapter the adapter values are dumped for
     * @param paramOffset the position of the subquery's first parameter in the outer list
     * @param depth the nesting depth of the subquery, 1 for a subquery of a top-level query
     * @return the compiled subquery, or the failure raised inside it
     */
    SubqueryCompilation compile(Subquery subquery, AdapterContext adapter, int paramOffset, int depth) {
        Query inner = subquery.query();
        try {
            if (depth > config.maxSubqueryDepth()) {
                throw new QueryCompilationException(ErrorKind.SUBQUERY_TOO_DEEP,
                    "subqueries are nested " + depth + " levels deep, at most " + config.maxSubqueryDepth()
                        + " are allowed", inner);
            }
            if (!inner.updates().isEmpty()) {
                throw new QueryCompilationException(ErrorKind.ILLEGAL_UPDATE_IN_SUBQUERY,
                    "`all` does not allow `update` expressions", inner);
            }
            if (!inner.preloads().isEmpty()) {
                throw new QueryCompilationException(ErrorKind.ILLEGAL_PRELOAD_IN_SUBQUERY,
                    "cannot preload associations in subquery", inner);
            }

            PreparedQuery prepared = planner.prepare(inner, Operation.ALL, adapter, 0, depth);
            SelectShape shape = selectCompiler.compile(prepared.query(), inner);
            List<Object> selectParams = prepared.query().select() != null
                ? prepared.query().select().params()
                : List.of();
            Query selected = prepared.query()
                .withSelect(SelectExpr.of(shape.toSelectExpression()).withParams(selectParams));
            NormalizedQuery normalized = planner.normalize(prepared.withQuery(selected), Operation.ALL, adapter, 0);

            logger.debug("Compiled subquery at depth {} with {} params and fields {}",
                depth, prepared.params().size(), shape.fieldNames());
            return new SubqueryCompilation.Compiled(subquery.compiled(normalized.query(), shape,
                prepared.params(), prepared.cacheKey(), paramOffset));
        } catch (QueryCompilationException e) {
            logger.debug("Subquery failed to compile: {}", e.getReason());
            return new SubqueryCompilation.Failed(e, subquery);
        }
    }
}
