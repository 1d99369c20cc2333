package com.nestplan.query;

import java.util.Objects;

/**
 * A join binding a source to the query at position {@link #index()}.
 *
 * <p>A join is either direct (a table or subquery source with an {@code on}
 * condition) or an association join ({@code join c in assoc(p, :comments)}), where
 * {@link #assoc()} is set and {@link #source()} is null until preparation expands the
 * association into the related table and its join condition.
 */
public final class JoinExpr {

    private final JoinQualifier qualifier;
    private final Source source;
    private final QueryExpr on;
    private final int index;
    private final String binding;
    private final AssocRef assoc;

    /**
     * Creates a join.
     *
     * @param qualifier the join qualifier
     * @param source the joined source (null for unexpanded association joins)
     * @param on the join condition with its bound values (null when absent)
     * @param index the binding position of the joined source
     * @param binding the binding name used when rendering
     * @param assoc the association reference, or null for direct joins
     */
    public JoinExpr(JoinQualifier qualifier, Source source, QueryExpr on, int index,
                    String binding, AssocRef assoc) {
        this.qualifier = Objects.requireNonNull(qualifier, "qualifier must not be null");
        this.binding = Objects.requireNonNull(binding, "binding must not be null");
        if (source == null && assoc == null) {
            throw new IllegalArgumentException("join needs a source or an association");
        }
        if (index < 1) {
            throw new IllegalArgumentException("join index must be at least 1: " + index);
        }
        this.source = source;
        this.on = on;
        this.index = index;
        this.assoc = assoc;
    }

    public JoinQualifier qualifier() {
        return qualifier;
    }

    /**
     * Returns the joined source.
     *
     * @return the source, or null for an association join that has not been expanded
     */
    public Source source() {
        return source;
    }

    /**
     * Returns the join condition.
     *
     * @return the condition, or null when the join has none
     */
    public QueryExpr on() {
        return on;
    }

    public int index() {
        return index;
    }

    public String binding() {
        return binding;
    }

    /**
     * Returns the association this join loads.
     *
     * @return the association reference, or null for direct joins
     */
    public AssocRef assoc() {
        return assoc;
    }

    public boolean isAssociationJoin() {
        return assoc != null;
    }

    public JoinExpr withSource(Source newSource) {
        return new JoinExpr(qualifier, newSource, on, index, binding, assoc);
    }

    public JoinExpr withOn(QueryExpr newOn) {
        return new JoinExpr(qualifier, source, newOn, index, binding, assoc);
    }

    /**
     * Returns a direct join replacing this association join.
     *
     * @param newSource the related table
     * @param newOn the expanded join condition
     * @return the expanded join
     */
    public JoinExpr expanded(Source newSource, QueryExpr newOn) {
        return new JoinExpr(qualifier, newSource, newOn, index, binding, null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JoinExpr)) return false;
        JoinExpr that = (JoinExpr) o;
        return index == that.index && qualifier == that.qualifier
            && Objects.equals(source, that.source) && Objects.equals(on, that.on)
            && binding.equals(that.binding) && Objects.equals(assoc, that.assoc);
    }

    @Override
    public int hashCode() {
        return Objects.hash(qualifier, source, on, index, binding, assoc);
    }

    @Override
    public String toString() {
        return String.format("JoinExpr(%s, %s, %d)", qualifier, assoc != null ? assoc : source, index);
    }
}
