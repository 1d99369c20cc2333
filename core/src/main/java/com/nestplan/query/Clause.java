package com.nestplan.query;

/**
 * The clause kinds of a query, named as they appear in error messages.
 */
public enum Clause {
    SELECT("select"),
    FROM("from"),
    JOIN("join"),
    WHERE("where"),
    GROUP_BY("group_by"),
    HAVING("having"),
    ORDER_BY("order_by"),
    LIMIT("limit"),
    OFFSET("offset"),
    UPDATE("update");

    private final String keyword;

    Clause(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
