package com.nestplan.planner;

import com.nestplan.exception.ErrorKind;
import com.nestplan.exception.QueryCompilationException;
import com.nestplan.exception.SubqueryException;
import com.nestplan.expression.Expression;
import com.nestplan.expression.SourceRef;
import com.nestplan.query.BooleanExpr;
import com.nestplan.query.Clause;
import com.nestplan.query.FromExpr;
import com.nestplan.query.JoinExpr;
import com.nestplan.query.Operation;
import com.nestplan.query.Query;
import com.nestplan.query.QueryExpr;
import com.nestplan.query.SelectExpr;
import com.nestplan.query.Source;
import com.nestplan.query.Subquery;
import com.nestplan.query.TableSource;
import com.nestplan.query.UpdateExpr;
import com.nestplan.query.UpdateOp;
import com.nestplan.schema.EntitySchema;
import com.nestplan.schema.SchemaResolver;
import com.nestplan.types.ArrayType;
import com.nestplan.types.DataType;
import com.nestplan.types.IntegerType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles query trees into parameter-indexed, field-resolved plans.
 *
 * <p>Planning runs in three steps:
 * <ol>
 *   <li>{@link #prepare}: resolves sources, compiles subqueries, expands association joins,
 *       validates field references and casts bound values into one flat list</li>
 *   <li>{@link #ensureSelect}: selects the first source when nothing is selected</li>
 *   <li>{@link #normalize}: checks the operation, numbers placeholders globally and
 *       expands the select into fields</li>
 * </ol>
 *
 * <p>Values are collected in clause traversal order:
 * <ul>
 *   <li>{@code all}: select, from, joins (source, then on), where, group_by, having, order_by, limit, offset</li>
 *   <li>{@code update_all}: update, from, joins, where, select</li>
 *   <li>{@code delete_all}: from, joins, where, select</li>
 * </ul>
 *
 * <p>Example:
 * <pre>
 *   Planner planner = new Planner(registry);
 *   PreparedQuery prepared = planner.prepare(query, Operation.ALL, adapter, 0);
 *   Query selected = planner.ensureSelect(prepared.query(), true);
 *   NormalizedQuery plan = planner.normalize(prepared.withQuery(selected), Operation.ALL, adapter, 0);
 * </pre>
 *
 * <p>Failures inside a subquery are raised as a single {@link SubqueryException};
 * every other failure is a {@link QueryCompilationException}. The planner holds no
 * mutable state and may be shared between threads.
 */
public final class Planner {

    private static final Logger logger = LoggerFactory.getLogger(Planner.class);

    private final PlannerConfig config;
    private final FieldResolver fields;
    private final AssociationExpander associations;
    private final SubqueryCompiler subqueries;
    private final Normalizer normalizer;
    private final CacheKeyBuilder cacheKeys;

    public Planner(SchemaResolver schemas) {
        this(schemas, PlannerConfig.defaults());
    }

    public Planner(SchemaResolver schemas, PlannerConfig config) {
        Objects.requireNonNull(schemas, "schemas must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.fields = new FieldResolver(schemas);
        this.associations = new AssociationExpander(fields);
        this.subqueries = new SubqueryCompiler(this, new SelectCompiler(fields), config);
        this.normalizer = new Normalizer(fields);
        this.cacheKeys = new CacheKeyBuilder(fields);
    }

    public PlannerConfig config() {
        return config;
    }

    // ==================== Prepare ====================

    /**
     * Prepares a query for the given operation.
     *
     * @param query the query as written
     * @param operation the operation the query is compiled for
     * @param adapter the adapter values are dumped for
     * @param paramBase the position the query's first value takes in the caller's flat list
     * @return the prepared query, its flat values and its cache key
     * @throws QueryCompilationException if the query cannot be compiled
     */
    public PreparedQuery prepare(Query query, Operation operation, AdapterContext adapter, int paramBase) {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(adapter, "adapter must not be null");
        if (paramBase < 0) {
            throw new IllegalArgumentException("paramBase must be non-negative: " + paramBase);
        }
        logger.debug("Preparing {} query for {}: {}", operation.keyword(), adapter.name(), query);
        PreparedQuery prepared = prepare(query, operation, adapter, paramBase, 0);
        logger.debug("Prepared {} query with {} params, key {}", operation.keyword(),
            prepared.params().size(), prepared.cacheKey());
        return prepared;
    }

    PreparedQuery prepare(Query query, Operation operation, AdapterContext adapter, int paramBase, int depth) {
        if (query.isNormalized()) {
            throw new IllegalArgumentException("query is already normalized: " + query);
        }
        if (operation.isBulk()) {
            checkBulk(query, operation);
        }

        Query resolved = resolveSources(query, adapter, paramBase, depth);
        ParameterCaster caster = new ParameterCaster(fields, adapter, config);
        List<Object> params = new ArrayList<>();
        Query prepared = resolved;

        for (Clause clause : operation.clauseOrder()) {
            switch (clause) {
                case SELECT:
                    if (prepared.select() != null) {
                        SelectExpr select = prepared.select();
                        ParameterCaster.CastValues values =
                            caster.cast(prepared, select.expr(), select.params(), clause, query);
                        params.addAll(values.dumped());
                        prepared = prepared.withSelect(select.withParams(values.cast()));
                    }
                    break;
                case FROM:
                    prepared = prepared.withFrom(prepared.from().withSource(
                        attach(prepared.from().source(), paramBase, params)));
                    break;
                case JOIN: {
                    List<JoinExpr> joins = new ArrayList<>();
                    for (JoinExpr join : prepared.joins()) {
                        JoinExpr attached = join.withSource(attach(join.source(), paramBase, params));
                        if (join.on() != null) {
                            attached = attached.withOn(castExpr(caster, prepared, join.on(), clause, query, params));
                        }
                        joins.add(attached);
                    }
                    prepared = prepared.withJoins(joins);
                    break;
                }
                case WHERE:
                    prepared = prepared.withWheres(castBooleans(caster, prepared, prepared.wheres(), clause, query, params));
                    break;
                case GROUP_BY:
                    prepared = prepared.withGroupBys(castExprs(caster, prepared, prepared.groupBys(), clause, query, params));
                    break;
                case HAVING:
                    prepared = prepared.withHavings(castBooleans(caster, prepared, prepared.havings(), clause, query, params));
                    break;
                case ORDER_BY:
                    prepared = prepared.withOrderBys(castExprs(caster, prepared, prepared.orderBys(), clause, query, params));
                    break;
                case LIMIT:
                    if (prepared.limit() != null) {
                        prepared = prepared.withLimit(castCount(caster, prepared, prepared.limit(), clause, query, params));
                    }
                    break;
                case OFFSET:
                    if (prepared.offset() != null) {
                        prepared = prepared.withOffset(castCount(caster, prepared, prepared.offset(), clause, query, params));
                    }
                    break;
                case UPDATE:
                    prepared = prepared.withUpdates(castUpdates(caster, prepared, query, params));
                    break;
                default:
                    break;
            }
        }

        return new PreparedQuery(prepared, params, cacheKeys.build(prepared, operation, params.size()));
    }

    private static void checkBulk(Query query, Operation operation) {
        if (query.from().source() instanceof Subquery) {
            throw new QueryCompilationException(ErrorKind.SUBQUERY_NOT_ALLOWED_IN_BULK_FROM,
                "`" + operation.keyword() + "` does not allow subqueries in `from`", query, Clause.FROM);
        }
        if (!query.groupBys().isEmpty() || !query.havings().isEmpty() || !query.orderBys().isEmpty()
                || query.limit() != null || query.offset() != null || !query.preloads().isEmpty()) {
            throw new QueryCompilationException(ErrorKind.ILLEGAL_BULK_CLAUSE,
                "`" + operation.keyword() + "` allows only `join`, `where` and `select` expressions", query);
        }
    }

    /**
     * Resolves entity sources to their tables, compiles subqueries and expands association
     * joins, in binding order.
     */
    private Query resolveSources(Query query, AdapterContext adapter, int paramBase, int depth) {
        Query resolved = query.withFrom(new FromExpr(
            resolveSource(query.from().source(), query, adapter, paramBase, depth), query.from().binding()));

        for (int i = 0; i < resolved.joins().size(); i++) {
            JoinExpr join = resolved.joins().get(i);
            JoinExpr expanded = join.isAssociationJoin()
                ? associations.expand(resolved, join, query)
                : join.withSource(resolveSource(join.source(), query, adapter, paramBase, depth));
            List<JoinExpr> joins = new ArrayList<>(resolved.joins());
            joins.set(i, expanded);
            resolved = resolved.withJoins(joins);
        }
        return resolved;
    }

    private Source resolveSource(Source source, Query query, AdapterContext adapter, int paramBase, int depth) {
        if (source instanceof TableSource table) {
            if (!table.hasSchema()) {
                return table;
            }
            EntitySchema schema = fields.requireSchema(table.entity(), query);
            return new TableSource(schema.table(), schema.name());
        }
        Subquery sub = (Subquery) source;
        if (sub.isCompiled()) {
            return sub;
        }
        SubqueryCompilation result = subqueries.compile(sub, adapter, paramBase, depth + 1);
        if (result instanceof SubqueryCompilation.Failed failed) {
            logger.debug("Subquery failed in {}: {}", query, failed.error().getReason());
            throw new SubqueryException(failed.error(), query);
        }
        return ((SubqueryCompilation.Compiled) result).subquery();
    }

    private static Source attach(Source source, int paramBase, List<Object> params) {
        if (source instanceof Subquery sub) {
            Subquery attached = sub.atOffset(paramBase + params.size());
            params.addAll(sub.params());
            return attached;
        }
        return source;
    }

    private static QueryExpr castExpr(ParameterCaster caster, Query prepared, QueryExpr expr, Clause clause,
                                      Query context, List<Object> params) {
        ParameterCaster.CastValues values = caster.cast(prepared, expr.expr(), expr.params(), clause, context);
        params.addAll(values.dumped());
        return expr.withParams(values.cast());
    }

    private static List<QueryExpr> castExprs(ParameterCaster caster, Query prepared, List<QueryExpr> exprs,
                                             Clause clause, Query context, List<Object> params) {
        List<QueryExpr> result = new ArrayList<>(exprs.size());
        for (QueryExpr expr : exprs) {
            result.add(castExpr(caster, prepared, expr, clause, context, params));
        }
        return result;
    }

    private static List<BooleanExpr> castBooleans(ParameterCaster caster, Query prepared, List<BooleanExpr> exprs,
                                                  Clause clause, Query context, List<Object> params) {
        List<BooleanExpr> result = new ArrayList<>(exprs.size());
        for (BooleanExpr expr : exprs) {
            ParameterCaster.CastValues values = caster.cast(prepared, expr.expr(), expr.params(), clause, context);
            params.addAll(values.dumped());
            result.add(expr.withParams(values.cast()));
        }
        return result;
    }

    private static QueryExpr castCount(ParameterCaster caster, Query prepared, QueryExpr expr, Clause clause,
                                       Query context, List<Object> params) {
        ParameterCaster.CastValues values = caster.cast(prepared, List.of(expr.expr()),
            List.of(IntegerType.get()), expr.params(), clause, context);
        params.addAll(values.dumped());
        return expr.withParams(values.cast());
    }

    private List<UpdateExpr> castUpdates(ParameterCaster caster, Query prepared, Query context, List<Object> params) {
        List<UpdateExpr> result = new ArrayList<>(prepared.updates().size());
        for (UpdateExpr update : prepared.updates()) {
            List<Expression> values = new ArrayList<>();
            List<DataType> types = new ArrayList<>();
            for (UpdateOp op : update.ops()) {
                DataType fieldType = fields.fieldType(prepared, 0, op.field(), Clause.UPDATE, context);
                values.add(op.value());
                types.add(valueType(op.kind(), fieldType));
            }
            ParameterCaster.CastValues cast = caster.cast(prepared, values, types, update.params(),
                Clause.UPDATE, context);
            params.addAll(cast.dumped());
            result.add(update.withParams(cast.cast()));
        }
        return result;
    }

    private static DataType valueType(UpdateOp.Kind kind, DataType fieldType) {
        switch (kind) {
            case PUSH:
            case PULL:
                return fieldType instanceof ArrayType array ? array.elementType() : null;
            default:
                return fieldType;
        }
    }

    // ==================== Select ====================

    /**
     * Selects the first source of a query that selects nothing.
     *
     * @param query the query
     * @param fieldsRequired whether the operation reads fields back
     * @return the query with a select when fields are required
     */
    public Query ensureSelect(Query query, boolean fieldsRequired) {
        Objects.requireNonNull(query, "query must not be null");
        if (query.select() != null || !fieldsRequired) {
            return query;
        }
        return query.withSelect(new SelectExpr(new SourceRef(0), Collections.emptyList(), List.of()));
    }

    // ==================== Normalize ====================

    /**
     * Normalizes a prepared query.
     *
     * @param prepared the prepared query
     * @param operation the operation the query is compiled for
     * @param adapter the adapter the plan is handed to
     * @param paramBase the index of the query's first placeholder
     * @return the normalized query and the next free placeholder index
     * @throws QueryCompilationException if the query is not valid for the operation
     */
    public NormalizedQuery normalize(PreparedQuery prepared, Operation operation, AdapterContext adapter,
                                     int paramBase) {
        Objects.requireNonNull(prepared, "prepared must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(adapter, "adapter must not be null");
        if (paramBase < 0) {
            throw new IllegalArgumentException("paramBase must be non-negative: " + paramBase);
        }
        NormalizedQuery normalized = normalizer.normalize(prepared.query(), operation, paramBase);
        logger.debug("Normalized {} query for {} at base {}, next param {}", operation.keyword(),
            adapter.name(), paramBase, normalized.nextParamIndex());
        return normalized;
    }
}
