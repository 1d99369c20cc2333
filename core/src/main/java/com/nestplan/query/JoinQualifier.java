package com.nestplan.query;

/**
 * Join qualifiers.
 */
public enum JoinQualifier {
    INNER("join"),
    LEFT("left_join"),
    RIGHT("right_join"),
    FULL("full_join"),
    CROSS("cross_join"),
    INNER_LATERAL("inner_lateral_join"),
    LEFT_LATERAL("left_lateral_join");

    private final String keyword;

    JoinQualifier(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
