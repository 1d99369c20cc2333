package com.nestplan.query;

import com.nestplan.expression.Expression;
import com.nestplan.expression.Literal;
import com.nestplan.expression.Parameter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * An immutable query tree.
 *
 * <p>Sources form an arena indexed by position: the from source is bound at 0 and the
 * n-th join at n. Expressions reference sources by that position.
 *
 * <p>Queries are built fluently; every method returns a new query:
 * <pre>
 *   Query posts = Query.from("Post").as("p")
 *       .where(eq(field(0, "title"), param(0)), "hello");
 *
 *   Query query = Query.from("Comment").as("c")
 *       .join(JoinQualifier.INNER, Subquery.of(posts), "p",
 *             QueryExpr.of(eq(field(0, "post_id"), field(1, "id"))));
 * </pre>
 *
 * @see com.nestplan.planner.Planner
 */
public final class Query {

    private final FromExpr from;
    private final List<JoinExpr> joins;
    private final List<BooleanExpr> wheres;
    private final List<QueryExpr> groupBys;
    private final List<BooleanExpr> havings;
    private final List<QueryExpr> orderBys;
    private final QueryExpr limit;
    private final QueryExpr offset;
    private final SelectExpr select;
    private final List<UpdateExpr> updates;
    private final List<Preload> preloads;
    private final Integer normalizedBase;

    private Query(Builder b) {
        this.from = Objects.requireNonNull(b.from, "from must not be null");
        this.joins = List.copyOf(b.joins);
        this.wheres = List.copyOf(b.wheres);
        this.groupBys = List.copyOf(b.groupBys);
        this.havings = List.copyOf(b.havings);
        this.orderBys = List.copyOf(b.orderBys);
        this.limit = b.limit;
        this.offset = b.offset;
        this.select = b.select;
        this.updates = List.copyOf(b.updates);
        this.preloads = List.copyOf(b.preloads);
        this.normalizedBase = b.normalizedBase;
    }

    // ==================== Entry Points ====================

    /**
     * Starts a query over an entity ({@code from p in Post}).
     *
     * @param entity the entity name
     * @return the query
     */
    public static Query from(String entity) {
        return from(TableSource.entity(entity));
    }

    /**
     * Starts a query over a source, binding it under a name derived from the source.
     *
     * @param source the from source
     * @return the query
     */
    public static Query from(Source source) {
        return from(source, defaultBinding(source));
    }

    /**
     * Starts a query over a source bound under the given name.
     *
     * @param source the from source
     * @param binding the binding name
     * @return the query
     */
    public static Query from(Source source, String binding) {
        Builder b = new Builder();
        b.from = new FromExpr(source, binding);
        return b.build();
    }

    private static String defaultBinding(Source source) {
        if (source instanceof TableSource table) {
            String name = table.hasSchema() ? table.entity() : table.table();
            return name.substring(0, 1).toLowerCase();
        }
        if (source instanceof Subquery sub) {
            return sub.query().from().binding();
        }
        return "x";
    }

    // ==================== Accessors ====================

    public FromExpr from() {
        return from;
    }

    public List<JoinExpr> joins() {
        return joins;
    }

    public List<BooleanExpr> wheres() {
        return wheres;
    }

    public List<QueryExpr> groupBys() {
        return groupBys;
    }

    public List<BooleanExpr> havings() {
        return havings;
    }

    public List<QueryExpr> orderBys() {
        return orderBys;
    }

    /**
     * Returns the limit clause.
     *
     * @return the limit, or null when absent
     */
    public QueryExpr limit() {
        return limit;
    }

    /**
     * Returns the offset clause.
     *
     * @return the offset, or null when absent
     */
    public QueryExpr offset() {
        return offset;
    }

    /**
     * Returns the select clause.
     *
     * @return the select, or null when the query selects nothing explicitly
     */
    public SelectExpr select() {
        return select;
    }

    public List<UpdateExpr> updates() {
        return updates;
    }

    public List<Preload> preloads() {
        return preloads;
    }

    /**
     * Returns the number of source bindings (from plus joins).
     *
     * @return the binding count
     */
    public int sourceCount() {
        return joins.size() + 1;
    }

    /**
     * Returns the source bound at a position.
     *
     * @param index the binding position
     * @return the source, null for an unexpanded association join
     * @throws IndexOutOfBoundsException if no source is bound at that position
     */
    public Source sourceAt(int index) {
        if (index == 0) {
            return from.source();
        }
        return joins.get(index - 1).source();
    }

    /**
     * Returns the binding name of a position.
     *
     * @param index the binding position
     * @return the binding name
     * @throws IndexOutOfBoundsException if no source is bound at that position
     */
    public String bindingAt(int index) {
        if (index == 0) {
            return from.binding();
        }
        return joins.get(index - 1).binding();
    }

    public boolean isNormalized() {
        return normalizedBase != null;
    }

    /**
     * Returns the parameter base this query was normalized at.
     *
     * @return the base, or null when the query is not normalized
     */
    public Integer normalizedBase() {
        return normalizedBase;
    }

    // ==================== Composition ====================

    /**
     * Renames the from binding.
     */
    public Query as(String binding) {
        Builder b = toBuilder();
        b.from = new FromExpr(from.source(), binding);
        return b.build();
    }

    public Query join(JoinQualifier qualifier, Source source, String binding, QueryExpr on) {
        Builder b = toBuilder();
        b.joins.add(new JoinExpr(qualifier, source, on, joins.size() + 1, binding, null));
        return b.build();
    }

    public Query join(Source source, String binding, QueryExpr on) {
        return join(JoinQualifier.INNER, source, binding, on);
    }

    /**
     * Joins an association of an existing binding ({@code join c in assoc(p, :comments)}).
     *
     * @param qualifier the join qualifier
     * @param parentIndex the binding declaring the association
     * @param association the association name
     * @param binding the binding name of the joined source
     * @return the query
     */
    public Query joinAssoc(JoinQualifier qualifier, int parentIndex, String association, String binding) {
        return joinAssoc(qualifier, parentIndex, association, binding, null);
    }

    /**
     * Joins an association with an additional condition, AND-ed to the association keys.
     */
    public Query joinAssoc(JoinQualifier qualifier, int parentIndex, String association, String binding,
                           QueryExpr on) {
        Builder b = toBuilder();
        b.joins.add(new JoinExpr(qualifier, null, on, joins.size() + 1, binding,
            new AssocRef(parentIndex, association)));
        return b.build();
    }

    public Query where(Expression expr, Object... params) {
        Builder b = toBuilder();
        b.wheres.add(BooleanExpr.and(expr, params));
        return b.build();
    }

    public Query orWhere(Expression expr, Object... params) {
        Builder b = toBuilder();
        b.wheres.add(BooleanExpr.or(expr, params));
        return b.build();
    }

    public Query groupBy(Expression expr, Object... params) {
        Builder b = toBuilder();
        b.groupBys.add(QueryExpr.of(expr, params));
        return b.build();
    }

    public Query having(Expression expr, Object... params) {
        Builder b = toBuilder();
        b.havings.add(BooleanExpr.and(expr, params));
        return b.build();
    }

    public Query orderBy(Expression expr, Object... params) {
        Builder b = toBuilder();
        b.orderBys.add(QueryExpr.of(expr, params));
        return b.build();
    }

    public Query limit(int value) {
        Builder b = toBuilder();
        b.limit = QueryExpr.of(Literal.of(value));
        return b.build();
    }

    /**
     * Limits the results to a bound value ({@code limit: ^n}).
     */
    public Query limitParam(Object value) {
        Builder b = toBuilder();
        b.limit = QueryExpr.of(new Parameter(0), value);
        return b.build();
    }

    public Query offset(int value) {
        Builder b = toBuilder();
        b.offset = QueryExpr.of(Literal.of(value));
        return b.build();
    }

    public Query select(Expression expr, Object... params) {
        return withSelect(SelectExpr.of(expr, params));
    }

    public Query update(UpdateOp... ops) {
        return update(Arrays.asList(ops), List.of());
    }

    public Query update(List<UpdateOp> ops, List<Object> params) {
        Builder b = toBuilder();
        b.updates.add(new UpdateExpr(ops, params));
        return b.build();
    }

    public Query preload(String association) {
        Builder b = toBuilder();
        b.preloads.add(Preload.of(association));
        return b.build();
    }

    /**
     * Preloads an association from the rows loaded by a join ({@code preload: [comments: c]}).
     */
    public Query preload(String association, int bindingIndex) {
        Builder b = toBuilder();
        b.preloads.add(Preload.viaJoin(association, bindingIndex));
        return b.build();
    }

    // ==================== Planner Rewrites ====================

    public Query withFrom(FromExpr newFrom) {
        Builder b = toBuilder();
        b.from = newFrom;
        return b.build();
    }

    public Query withJoins(List<JoinExpr> newJoins) {
        Builder b = toBuilder();
        b.joins = new ArrayList<>(newJoins);
        return b.build();
    }

    public Query withWheres(List<BooleanExpr> newWheres) {
        Builder b = toBuilder();
        b.wheres = new ArrayList<>(newWheres);
        return b.build();
    }

    public Query withGroupBys(List<QueryExpr> newGroupBys) {
        Builder b = toBuilder();
        b.groupBys = new ArrayList<>(newGroupBys);
        return b.build();
    }

    public Query withHavings(List<BooleanExpr> newHavings) {
        Builder b = toBuilder();
        b.havings = new ArrayList<>(newHavings);
        return b.build();
    }

    public Query withOrderBys(List<QueryExpr> newOrderBys) {
        Builder b = toBuilder();
        b.orderBys = new ArrayList<>(newOrderBys);
        return b.build();
    }

    public Query withLimit(QueryExpr newLimit) {
        Builder b = toBuilder();
        b.limit = newLimit;
        return b.build();
    }

    public Query withOffset(QueryExpr newOffset) {
        Builder b = toBuilder();
        b.offset = newOffset;
        return b.build();
    }

    /**
     * Replaces the select clause.
     *
     * @param newSelect the select, or null to remove it
     * @return the query
     */
    public Query withSelect(SelectExpr newSelect) {
        Builder b = toBuilder();
        b.select = newSelect;
        return b.build();
    }

    public Query withUpdates(List<UpdateExpr> newUpdates) {
        Builder b = toBuilder();
        b.updates = new ArrayList<>(newUpdates);
        return b.build();
    }

    /**
     * Marks the query as normalized at the given parameter base.
     *
     * @param base the base, or null to clear the mark
     * @return the query
     */
    public Query withNormalizedBase(Integer base) {
        Builder b = toBuilder();
        b.normalizedBase = base;
        return b.build();
    }

    private Builder toBuilder() {
        Builder b = new Builder();
        b.from = from;
        b.joins = new ArrayList<>(joins);
        b.wheres = new ArrayList<>(wheres);
        b.groupBys = new ArrayList<>(groupBys);
        b.havings = new ArrayList<>(havings);
        b.orderBys = new ArrayList<>(orderBys);
        b.limit = limit;
        b.offset = offset;
        b.select = select;
        b.updates = new ArrayList<>(updates);
        b.preloads = new ArrayList<>(preloads);
        b.normalizedBase = normalizedBase;
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Query)) return false;
        Query that = (Query) o;
        return from.equals(that.from) && joins.equals(that.joins) && wheres.equals(that.wheres)
            && groupBys.equals(that.groupBys) && havings.equals(that.havings)
            && orderBys.equals(that.orderBys) && Objects.equals(limit, that.limit)
            && Objects.equals(offset, that.offset) && Objects.equals(select, that.select)
            && updates.equals(that.updates) && preloads.equals(that.preloads)
            && Objects.equals(normalizedBase, that.normalizedBase);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, joins, wheres, groupBys, havings, orderBys, limit, offset, select,
            updates, preloads, normalizedBase);
    }

    @Override
    public String toString() {
        return QueryRenderer.render(this);
    }

    private static final class Builder {
        private FromExpr from;
        private List<JoinExpr> joins = new ArrayList<>();
        private List<BooleanExpr> wheres = new ArrayList<>();
        private List<QueryExpr> groupBys = new ArrayList<>();
        private List<BooleanExpr> havings = new ArrayList<>();
        private List<QueryExpr> orderBys = new ArrayList<>();
        private QueryExpr limit;
        private QueryExpr offset;
        private SelectExpr select;
        private List<UpdateExpr> updates = new ArrayList<>();
        private List<Preload> preloads = new ArrayList<>();
        private Integer normalizedBase;

        private Query build() {
            return new Query(this);
        }
    }
}
