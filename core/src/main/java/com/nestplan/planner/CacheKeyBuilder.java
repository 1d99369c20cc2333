package com.nestplan.planner;

import com.nestplan.expression.Expression;
import com.nestplan.query.BooleanExpr;
import com.nestplan.query.CacheKey;
import com.nestplan.query.Clause;
import com.nestplan.query.JoinExpr;
import com.nestplan.query.Operation;
import com.nestplan.query.Query;
import com.nestplan.query.QueryExpr;
import com.nestplan.query.Source;
import com.nestplan.query.Subquery;
import com.nestplan.query.TableSource;
import com.nestplan.query.UpdateExpr;
import com.nestplan.query.UpdateOp;
import com.nestplan.schema.EntitySchema;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Builds the value-independent key of a prepared query.
 *
 * <p>Layout: {@code [operation, paramCount, clause..., from]} where clauses follow the
 * traversal order of the operation and empty clauses are left out. A table is keyed by
 * {@code [table, entity, schemaFingerprint]}, a subquery by its own key:
 * <pre>
 *   [ALL, 0, [ALL, 0, [posts, Post, 127044068]]]
 * </pre>
 */
final class CacheKeyBuilder {

    private final FieldResolver fields;

    CacheKeyBuilder(FieldResolver fields) {
        this.fields = Objects.requireNonNull(fields, "fields must not be null");
    }

    CacheKey build(Query query, Operation operation, int paramCount) {
        List<Object> parts = new ArrayList<>();
        parts.add(operation);
        parts.add(paramCount);
        for (Clause clause : operation.clauseOrder()) {
            List<Object> descriptor = describe(query, clause);
            if (descriptor != null) {
                parts.add(descriptor);
            }
        }
        parts.add(source(query.from().source()));
        return CacheKey.of(parts);
    }

    private List<Object> describe(Query query, Clause clause) {
        switch (clause) {
            case SELECT:
                return query.select() == null ? null : List.of(clause.keyword(), query.select().expr().render());
            case JOIN: {
                List<Object> joins = new ArrayList<>();
                for (JoinExpr join : query.joins()) {
                    String on = join.on() == null ? null : join.on().expr().render();
                    joins.add(Arrays.asList(join.qualifier().keyword(), source(join.source()), on));
                }
                return entry(clause, joins);
            }
            case WHERE:
                return entry(clause, booleans(query.wheres()));
            case HAVING:
                return entry(clause, booleans(query.havings()));
            case GROUP_BY:
                return entry(clause, exprs(query.groupBys()));
            case ORDER_BY:
                return entry(clause, exprs(query.orderBys()));
            case LIMIT:
                return query.limit() == null ? null : List.of(clause.keyword(), query.limit().expr().render());
            case OFFSET:
                return query.offset() == null ? null : List.of(clause.keyword(), query.offset().expr().render());
            case UPDATE: {
                List<Object> ops = new ArrayList<>();
                for (UpdateExpr update : query.updates()) {
                    for (UpdateOp op : update.ops()) {
                        ops.add(List.of(op.kind().keyword(), op.field(), op.value().render()));
                    }
                }
                return entry(clause, ops);
            }
            default:
                // the from source closes the key
                return null;
        }
    }

    private Object source(Source source) {
        if (source instanceof Subquery sub) {
            return sub.cacheKey().parts();
        }
        TableSource table = (TableSource) source;
        Integer fingerprint = fields.schemaOf(table).map(EntitySchema::fingerprint).orElse(null);
        return Arrays.asList(table.table(), table.entity(), fingerprint);
    }

    private static List<Object> entry(Clause clause, List<Object> items) {
        return items.isEmpty() ? null : List.of(clause.keyword(), items);
    }

    private static List<Object> booleans(List<BooleanExpr> exprs) {
        List<Object> items = new ArrayList<>();
        for (BooleanExpr expr : exprs) {
            items.add(List.of(expr.op().name().toLowerCase(), expr.expr().render()));
        }
        return items;
    }

    private static List<Object> exprs(List<QueryExpr> exprs) {
        List<Object> items = new ArrayList<>();
        for (QueryExpr expr : exprs) {
            Expression e = expr.expr();
            items.add(e.render());
        }
        return items;
    }
}
