package com.nestplan.query;

import java.util.List;

/**
 * The kind of operation a query is planned for.
 *
 * <p>Each operation traverses clauses in a fixed order. That order is the order in
 * which bound values appear in the flat parameter list.
 */
public enum Operation {
    ALL("all", List.of(Clause.SELECT, Clause.FROM, Clause.JOIN, Clause.WHERE, Clause.GROUP_BY,
        Clause.HAVING, Clause.ORDER_BY, Clause.LIMIT, Clause.OFFSET)),
    UPDATE_ALL("update_all", List.of(Clause.UPDATE, Clause.FROM, Clause.JOIN, Clause.WHERE, Clause.SELECT)),
    DELETE_ALL("delete_all", List.of(Clause.FROM, Clause.JOIN, Clause.WHERE, Clause.SELECT));

    private final String keyword;
    private final List<Clause> clauseOrder;

    Operation(String keyword, List<Clause> clauseOrder) {
        this.keyword = keyword;
        this.clauseOrder = clauseOrder;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Returns the clauses this operation reads, in traversal order.
     *
     * @return the clause order
     */
    public List<Clause> clauseOrder() {
        return clauseOrder;
    }

    /**
     * Returns whether this operation mutates rows in bulk.
     *
     * @return true for update_all and delete_all
     */
    public boolean isBulk() {
        return this != ALL;
    }
}
