package com.nestplan.planner;

import com.nestplan.exception.ErrorKind;
import com.nestplan.exception.QueryCompilationException;
import com.nestplan.expression.Expression;
import com.nestplan.expression.ExpressionUtils;
import com.nestplan.expression.FieldAccess;
import com.nestplan.expression.FieldSubset;
import com.nestplan.expression.ListExpression;
import com.nestplan.expression.MapEntry;
import com.nestplan.expression.MapLiteral;
import com.nestplan.expression.MapUpdate;
import com.nestplan.expression.Merge;
import com.nestplan.expression.SourceRef;
import com.nestplan.expression.StructLiteral;
import com.nestplan.query.BooleanExpr;
import com.nestplan.query.Clause;
import com.nestplan.query.JoinExpr;
import com.nestplan.query.MapShape;
import com.nestplan.query.MergeShape;
import com.nestplan.query.Operation;
import com.nestplan.query.Query;
import com.nestplan.query.QueryExpr;
import com.nestplan.query.SelectExpr;
import com.nestplan.query.SelectShape;
import com.nestplan.query.Source;
import com.nestplan.query.StructShape;
import com.nestplan.query.Subquery;
import com.nestplan.query.TableSource;
import com.nestplan.query.UpdateExpr;
import com.nestplan.query.UpdateOp;
import com.nestplan.schema.EntitySchema;
import com.nestplan.schema.SchemaField;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Final pass over a prepared query.
 *
 * <ul>
 *   <li>checks the clauses allowed by the operation</li>
 *   <li>renumbers every placeholder to its position in the flat parameter list,
 *       shifting subquery placeholders to the subquery's offset</li>
 *   <li>expands the select into the list of fields the adapter reads</li>
 * </ul>
 *
 * <p>A normalized query records the base it was numbered from, so normalizing it again
 * only moves its placeholders by the difference between the bases.
 */
final class Normalizer {

    private final FieldResolver fields;

    Normalizer(FieldResolver fields) {
        this.fields = Objects.requireNonNull(fields, "fields must not be null");
    }

    NormalizedQuery normalize(Query query, Operation operation, int paramBase) {
        checkOperation(query, operation);

        Query renumbered;
        int next;
        if (query.isNormalized()) {
            renumbered = shift(query, paramBase - query.normalizedBase());
            next = paramBase + countParams(renumbered, operation);
        } else {
            Renumbering renumbering = new Renumbering(paramBase);
            renumbered = renumbering.apply(query, operation).withNormalizedBase(paramBase);
            next = renumbering.position;
        }

        if (renumbered.select() != null) {
            SelectExpr select = renumbered.select();
            List<Expression> selected = new ArrayList<>();
            collectFields(renumbered, select.expr(), selected, query);
            renumbered = renumbered.withSelect(select.withFields(selected));
        }
        return new NormalizedQuery(renumbered, next);
    }

    // ==================== Operation Checks ====================

    private static void checkOperation(Query query, Operation operation) {
        if (operation == Operation.UPDATE_ALL) {
            if (query.updates().isEmpty()) {
                throw new QueryCompilationException(ErrorKind.MISSING_UPDATE,
                    "`update_all` requires at least one field to be updated", query, Clause.UPDATE);
            }
        } else if (!query.updates().isEmpty()) {
            throw new QueryCompilationException(ErrorKind.ILLEGAL_UPDATE,
                "`" + operation.keyword() + "` does not allow `update` expressions", query, Clause.UPDATE);
        }
    }

    // ==================== Renumbering ====================

    /**
     * Numbers clause-local placeholders globally, walking clauses in traversal order.
     */
    private static final class Renumbering {

        private int position;

        Renumbering(int base) {
            this.position = base;
        }

        Query apply(Query query, Operation operation) {
            Query result = query;
            for (Clause clause : operation.clauseOrder()) {
                switch (clause) {
                    case SELECT:
                        if (result.select() != null) {
                            SelectExpr select = result.select();
                            result = result.withSelect(select.withExpr(local(select.expr(), select.params().size())));
                        }
                        break;
                    case FROM:
                        result = result.withFrom(result.from().withSource(attach(result.from().source())));
                        break;
                    case JOIN: {
                        List<JoinExpr> joins = new ArrayList<>();
                        for (JoinExpr join : result.joins()) {
                            JoinExpr attached = join.withSource(attach(join.source()));
                            if (join.on() != null) {
                                QueryExpr on = join.on();
                                attached = attached.withOn(on.withExpr(local(on.expr(), on.params().size())));
                            }
                            joins.add(attached);
                        }
                        result = result.withJoins(joins);
                        break;
                    }
                    case WHERE:
                        result = result.withWheres(booleans(result.wheres()));
                        break;
                    case GROUP_BY:
                        result = result.withGroupBys(exprs(result.groupBys()));
                        break;
                    case HAVING:
                        result = result.withHavings(booleans(result.havings()));
                        break;
                    case ORDER_BY:
                        result = result.withOrderBys(exprs(result.orderBys()));
                        break;
                    case LIMIT:
                        if (result.limit() != null) {
                            result = result.withLimit(expr(result.limit()));
                        }
                        break;
                    case OFFSET:
                        if (result.offset() != null) {
                            result = result.withOffset(expr(result.offset()));
                        }
                        break;
                    case UPDATE: {
                        List<UpdateExpr> updates = new ArrayList<>();
                        for (UpdateExpr update : result.updates()) {
                            int base = position;
                            List<UpdateOp> ops = new ArrayList<>();
                            for (UpdateOp op : update.ops()) {
                                ops.add(new UpdateOp(op.kind(), op.field(),
                                    ExpressionUtils.shiftParameters(op.value(), base)));
                            }
                            position += update.params().size();
                            updates.add(update.withOps(ops));
                        }
                        result = result.withUpdates(updates);
                        break;
                    }
                    default:
                        break;
                }
            }
            return result;
        }

        private Expression local(Expression expr, int paramCount) {
            Expression shifted = ExpressionUtils.shiftParameters(expr, position);
            position += paramCount;
            return shifted;
        }

        private Source attach(Source source) {
            if (!(source instanceof Subquery sub)) {
                return source;
            }
            Query inner = sub.query();
            int innerBase = inner.normalizedBase() != null ? inner.normalizedBase() : 0;
            Subquery attached = sub.withQuery(shift(inner, position - innerBase)).atOffset(position);
            position += sub.params().size();
            return attached;
        }

        private List<BooleanExpr> booleans(List<BooleanExpr> exprs) {
            List<BooleanExpr> result = new ArrayList<>(exprs.size());
            for (BooleanExpr expr : exprs) {
                result.add(expr.withExpr(local(expr.expr(), expr.params().size())));
            }
            return result;
        }

        private List<QueryExpr> exprs(List<QueryExpr> exprs) {
            List<QueryExpr> result = new ArrayList<>(exprs.size());
            for (QueryExpr expr : exprs) {
                result.add(expr(expr));
            }
            return result;
        }

        private QueryExpr expr(QueryExpr expr) {
            return expr.withExpr(local(expr.expr(), expr.params().size()));
        }
    }

    /**
     * Moves every placeholder of a normalized query, nested subqueries included.
     *
     * @param query the normalized query
     * @param delta the amount added to every placeholder index
     * @return the shifted query
     */
    static Query shift(Query query, int delta) {
        if (delta == 0) {
            return query;
        }
        UnaryOperator<Expression> fn = e -> ExpressionUtils.shiftParameters(e, delta);

        Query result = query.withFrom(query.from().withSource(shiftSource(query.from().source(), delta)));
        List<JoinExpr> joins = new ArrayList<>();
        for (JoinExpr join : result.joins()) {
            JoinExpr shifted = join.withSource(shiftSource(join.source(), delta));
            if (join.on() != null) {
                shifted = shifted.withOn(join.on().withExpr(fn.apply(join.on().expr())));
            }
            joins.add(shifted);
        }
        result = result.withJoins(joins);

        List<BooleanExpr> wheres = new ArrayList<>();
        for (BooleanExpr where : result.wheres()) {
            wheres.add(where.withExpr(fn.apply(where.expr())));
        }
        List<BooleanExpr> havings = new ArrayList<>();
        for (BooleanExpr having : result.havings()) {
            havings.add(having.withExpr(fn.apply(having.expr())));
        }
        List<QueryExpr> groupBys = new ArrayList<>();
        for (QueryExpr groupBy : result.groupBys()) {
            groupBys.add(groupBy.withExpr(fn.apply(groupBy.expr())));
        }
        List<QueryExpr> orderBys = new ArrayList<>();
        for (QueryExpr orderBy : result.orderBys()) {
            orderBys.add(orderBy.withExpr(fn.apply(orderBy.expr())));
        }
        List<UpdateExpr> updates = new ArrayList<>();
        for (UpdateExpr update : result.updates()) {
            List<UpdateOp> ops = new ArrayList<>();
            for (UpdateOp op : update.ops()) {
                ops.add(new UpdateOp(op.kind(), op.field(), fn.apply(op.value())));
            }
            updates.add(update.withOps(ops));
        }
        result = result.withWheres(wheres).withHavings(havings).withGroupBys(groupBys)
            .withOrderBys(orderBys).withUpdates(updates);

        if (result.limit() != null) {
            result = result.withLimit(result.limit().withExpr(fn.apply(result.limit().expr())));
        }
        if (result.offset() != null) {
            result = result.withOffset(result.offset().withExpr(fn.apply(result.offset().expr())));
        }
        if (result.select() != null) {
            SelectExpr select = result.select();
            List<Expression> selected = new ArrayList<>();
            for (Expression field : select.fields()) {
                selected.add(fn.apply(field));
            }
            result = result.withSelect(select.withExpr(fn.apply(select.expr())).withFields(selected));
        }
        Integer base = query.normalizedBase();
        return result.withNormalizedBase(base == null ? null : base + delta);
    }

    private static Source shiftSource(Source source, int delta) {
        if (source instanceof Subquery sub && sub.isCompiled()) {
            return sub.withQuery(shift(sub.query(), delta)).atOffset(sub.paramOffset() + delta);
        }
        return source;
    }

    private static int countParams(Query query, Operation operation) {
        int count = 0;
        for (Clause clause : operation.clauseOrder()) {
            switch (clause) {
                case SELECT:
                    count += query.select() == null ? 0 : query.select().params().size();
                    break;
                case FROM:
                    count += sourceParams(query.from().source());
                    break;
                case JOIN:
                    for (JoinExpr join : query.joins()) {
                        count += sourceParams(join.source());
                        count += join.on() == null ? 0 : join.on().params().size();
                    }
                    break;
                case WHERE:
                    count += query.wheres().stream().mapToInt(w -> w.params().size()).sum();
                    break;
                case GROUP_BY:
                    count += query.groupBys().stream().mapToInt(g -> g.params().size()).sum();
                    break;
                case HAVING:
                    count += query.havings().stream().mapToInt(h -> h.params().size()).sum();
                    break;
                case ORDER_BY:
                    count += query.orderBys().stream().mapToInt(o -> o.params().size()).sum();
                    break;
                case LIMIT:
                    count += query.limit() == null ? 0 : query.limit().params().size();
                    break;
                case OFFSET:
                    count += query.offset() == null ? 0 : query.offset().params().size();
                    break;
                case UPDATE:
                    count += query.updates().stream().mapToInt(u -> u.params().size()).sum();
                    break;
                default:
                    break;
            }
        }
        return count;
    }

    private static int sourceParams(Source source) {
        return source instanceof Subquery sub && sub.isCompiled() ? sub.params().size() : 0;
    }

    // ==================== Select Fields ====================

    private void collectFields(Query query, Expression expr, List<Expression> out, Query context) {
        if (expr instanceof SourceRef ref) {
            sourceFields(query, ref.index(), out, context);
        } else if (expr instanceof FieldSubset subset) {
            subsetFields(query, subset, out, context);
        } else if (expr instanceof ListExpression list) {
            for (Expression element : list.elements()) {
                collectFields(query, element, out, context);
            }
        } else if (expr instanceof MapLiteral map) {
            entryFields(query, map.entries(), out, context);
        } else if (expr instanceof StructLiteral struct) {
            entryFields(query, struct.entries(), out, context);
        } else if (expr instanceof MapUpdate update) {
            collectFields(query, update.base(), out, context);
            entryFields(query, update.updates(), out, context);
        } else if (expr instanceof Merge merge) {
            collectFields(query, merge.left(), out, context);
            collectFields(query, merge.right(), out, context);
        } else {
            out.add(expr);
        }
    }

    private void entryFields(Query query, List<MapEntry> entries, List<Expression> out, Query context) {
        for (MapEntry entry : entries) {
            collectFields(query, entry.value(), out, context);
        }
    }

    private void sourceFields(Query query, int index, List<Expression> out, Query context) {
        Source source = fields.requireSource(query, index, Clause.SELECT, context);
        if (source instanceof Subquery sub) {
            for (String name : sub.fields()) {
                out.add(new FieldAccess(index, name));
            }
            return;
        }
        TableSource table = (TableSource) source;
        if (!table.hasSchema()) {
            throw new QueryCompilationException(ErrorKind.SCHEMALESS_SOURCE_SELECT,
                "cannot select the whole schemaless source " + table + ", select its fields explicitly",
                context, Clause.SELECT);
        }
        EntitySchema schema = fields.requireSchema(table.entity(), context);
        for (SchemaField field : schema.fields()) {
            out.add(new FieldAccess(index, field.name()));
        }
    }

    private void subsetFields(Query query, FieldSubset subset, List<Expression> out, Query context) {
        Source source = fields.requireSource(query, subset.sourceIndex(), Clause.SELECT, context);
        if (source instanceof Subquery sub) {
            SelectShape shape = sub.shape();
            if ((shape instanceof MapShape || shape instanceof StructShape || shape instanceof MergeShape)
                    && shape.fields().size() > 1) {
                throw new QueryCompilationException(ErrorKind.CANNOT_SUBSET_SUBQUERY_STRUCT,
                    "it is not possible to return a map/struct subset of a subquery, "
                        + "you must explicitly select the whole subquery or individual fields only",
                    context, Clause.SELECT);
            }
        }
        for (String name : subset.fields()) {
            fields.fieldType(query, subset.sourceIndex(), name, Clause.SELECT, context);
            out.add(new FieldAccess(subset.sourceIndex(), name));
        }
    }
}
