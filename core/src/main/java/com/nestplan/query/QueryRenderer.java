package com.nestplan.query;

import com.nestplan.expression.Expression;
import com.nestplan.expression.RenderContext;
import com.nestplan.types.TypeCaster;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Renders queries in a single-line, keyword form used by error messages and logs.
 *
 * <p>Example output:
 * <pre>
 *   from p in Post, join: c in assoc(p, :comments), where: p.title == ^"hello", select: p
 * </pre>
 *
 * <p>Sources are printed by binding name. Placeholders are printed with their bound
 * value while the clause still carries its own values; once a query is normalized,
 * placeholders are printed positionally ({@code ^3}).
 */
public final class QueryRenderer {

    private QueryRenderer() {
        // Utility class - prevent instantiation
    }

    /**
     * Renders a query.
     *
     * @param query the query
     * @return the rendered query
     */
    public static String render(Query query) {
        List<String> names = bindingNames(query);
        boolean positional = query.isNormalized();
        List<String> parts = new ArrayList<>();

        parts.add("from " + names.get(0) + " in " + renderSource(query.from().source()));

        for (JoinExpr join : query.joins()) {
            StringBuilder sb = new StringBuilder(join.qualifier().keyword()).append(": ")
                .append(names.get(join.index())).append(" in ");
            if (join.isAssociationJoin()) {
                AssocRef assoc = join.assoc();
                sb.append("assoc(").append(names.get(assoc.parentIndex()))
                    .append(", :").append(assoc.name()).append(')');
            } else {
                sb.append(renderSource(join.source()));
            }
            parts.add(sb.toString());
            if (join.on() != null) {
                parts.add("on: " + renderExpr(join.on().expr(), join.on().params(), names, positional));
            }
        }

        for (BooleanExpr where : query.wheres()) {
            String keyword = where.op() == BooleanExpr.Op.OR ? "or_where: " : "where: ";
            parts.add(keyword + renderExpr(where.expr(), where.params(), names, positional));
        }
        for (QueryExpr groupBy : query.groupBys()) {
            parts.add("group_by: " + renderExpr(groupBy.expr(), groupBy.params(), names, positional));
        }
        for (BooleanExpr having : query.havings()) {
            String keyword = having.op() == BooleanExpr.Op.OR ? "or_having: " : "having: ";
            parts.add(keyword + renderExpr(having.expr(), having.params(), names, positional));
        }
        for (QueryExpr orderBy : query.orderBys()) {
            parts.add("order_by: " + renderExpr(orderBy.expr(), orderBy.params(), names, positional));
        }
        if (query.limit() != null) {
            parts.add("limit: " + renderExpr(query.limit().expr(), query.limit().params(), names, positional));
        }
        if (query.offset() != null) {
            parts.add("offset: " + renderExpr(query.offset().expr(), query.offset().params(), names, positional));
        }
        for (UpdateExpr update : query.updates()) {
            parts.add("update: " + renderUpdate(update, names, positional));
        }
        if (query.select() != null) {
            SelectExpr select = query.select();
            parts.add("select: " + renderExpr(select.expr(), select.params(), names, positional));
        }
        if (!query.preloads().isEmpty()) {
            List<String> preloads = new ArrayList<>();
            for (Preload preload : query.preloads()) {
                preloads.add(preload.bindingIndex() == null
                    ? ":" + preload.association()
                    : preload.association() + ": " + names.get(preload.bindingIndex()));
            }
            parts.add("preload: [" + String.join(", ", preloads) + "]");
        }

        return String.join(", ", parts);
    }

    /**
     * Renders a single expression of a query, resolving sources to the query's binding names.
     *
     * @param query the query the expression belongs to
     * @param expr the expression
     * @param params the values bound by the expression's clause
     * @return the rendered expression
     */
    public static String renderExpression(Query query, Expression expr, List<Object> params) {
        return renderExpr(expr, params, bindingNames(query), query.isNormalized());
    }

    private static String renderSource(Source source) {
        if (source instanceof Subquery sub) {
            return "subquery(" + render(sub.query()) + ")";
        }
        return source.toString();
    }

    private static String renderUpdate(UpdateExpr update, List<String> names, boolean positional) {
        // ops are grouped by kind, keeping first-seen kind order
        List<UpdateOp.Kind> kinds = new ArrayList<>();
        for (UpdateOp op : update.ops()) {
            if (!kinds.contains(op.kind())) {
                kinds.add(op.kind());
            }
        }
        List<String> groups = new ArrayList<>();
        for (UpdateOp.Kind kind : kinds) {
            List<String> assignments = new ArrayList<>();
            for (UpdateOp op : update.ops()) {
                if (op.kind() == kind) {
                    assignments.add(op.field() + ": " + renderExpr(op.value(), update.params(), names, positional));
                }
            }
            groups.add(kind.keyword() + ": [" + String.join(", ", assignments) + "]");
        }
        return "[" + String.join(", ", groups) + "]";
    }

    private static String renderExpr(Expression expr, List<Object> params, List<String> names,
                                     boolean positional) {
        return expr.render(new BindingContext(names, positional ? null : params));
    }

    static List<String> bindingNames(Query query) {
        List<String> names = new ArrayList<>(query.sourceCount());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < query.sourceCount(); i++) {
            String name = query.bindingAt(i);
            if (!seen.add(name)) {
                name = name + i;
                seen.add(name);
            }
            names.add(name);
        }
        return names;
    }

    /**
     * Resolves sources to binding names and placeholders to their clause values.
     */
    private static final class BindingContext implements RenderContext {

        private final List<String> names;
        private final List<Object> params;

        BindingContext(List<String> names, List<Object> params) {
            this.names = names;
            this.params = params;
        }

        @Override
        public String source(int index) {
            return index >= 0 && index < names.size() ? names.get(index) : "&" + index;
        }

        @Override
        public String parameter(int index) {
            if (params != null && index >= 0 && index < params.size()) {
                return "^" + TypeCaster.inspect(params.get(index));
            }
            return "^" + index;
        }
    }
}
