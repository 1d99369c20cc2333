package com.nestplan.planner;

import java.util.Objects;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Planner settings.
 *
 * <p>Settings are read from properties prefixed with {@code nestplan.planner.}:
 * <ul>
 *   <li>{@code nestplan.planner.maxSubqueryDepth} - deepest allowed subquery nesting
 *       (default {@value #DEFAULT_MAX_SUBQUERY_DEPTH})</li>
 *   <li>{@code nestplan.planner.checkLiteralCasts} - whether literals compared with
 *       typed fields are cast-checked (default true)</li>
 * </ul>
 */
public final class PlannerConfig {

    private static final Logger logger = LoggerFactory.getLogger(PlannerConfig.class);

    public static final String PREFIX = "nestplan.planner.";
    public static final String MAX_SUBQUERY_DEPTH = PREFIX + "maxSubqueryDepth";
    public static final String CHECK_LITERAL_CASTS = PREFIX + "checkLiteralCasts";

    /** Default nesting limit for subqueries */
    public static final int DEFAULT_MAX_SUBQUERY_DEPTH = 16;

    /** Highest accepted nesting limit, keeps recursion well inside the default stack */
    public static final int MAX_SUBQUERY_DEPTH_LIMIT = 256;

    private static final PlannerConfig DEFAULTS = new PlannerConfig(DEFAULT_MAX_SUBQUERY_DEPTH, true);

    private final int maxSubqueryDepth;
    private final boolean checkLiteralCasts;

    private PlannerConfig(int maxSubqueryDepth, boolean checkLiteralCasts) {
        this.maxSubqueryDepth = normalizeDepth(maxSubqueryDepth);
        this.checkLiteralCasts = checkLiteralCasts;
    }

    public static PlannerConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Reads the settings from properties; missing or malformed values fall back to defaults.
     *
     * @param properties the properties
     * @return the config
     */
    public static PlannerConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        int depth = DEFAULT_MAX_SUBQUERY_DEPTH;
        String rawDepth = properties.getProperty(MAX_SUBQUERY_DEPTH);
        if (rawDepth != null) {
            try {
                depth = Integer.parseInt(rawDepth.trim());
            } catch (NumberFormatException e) {
                logger.warn("Ignoring malformed {}={}, using {}", MAX_SUBQUERY_DEPTH, rawDepth,
                    DEFAULT_MAX_SUBQUERY_DEPTH);
            }
        }
        String rawCheck = properties.getProperty(CHECK_LITERAL_CASTS);
        boolean check = rawCheck == null || Boolean.parseBoolean(rawCheck.trim());
        return new PlannerConfig(depth, check);
    }

    /**
     * Reads the settings from the system properties.
     *
     * @return the config
     */
    public static PlannerConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Validate and normalize a nesting limit to be within allowed bounds.
     *
     * @param requested the requested limit
     * @return normalized limit within [1, MAX_SUBQUERY_DEPTH_LIMIT]
     */
    public static int normalizeDepth(int requested) {
        if (requested <= 0) return DEFAULT_MAX_SUBQUERY_DEPTH;
        if (requested > MAX_SUBQUERY_DEPTH_LIMIT) return MAX_SUBQUERY_DEPTH_LIMIT;
        return requested;
    }

    public PlannerConfig withMaxSubqueryDepth(int depth) {
        return new PlannerConfig(depth, checkLiteralCasts);
    }

    public PlannerConfig withCheckLiteralCasts(boolean check) {
        return new PlannerConfig(maxSubqueryDepth, check);
    }

    public int maxSubqueryDepth() {
        return maxSubqueryDepth;
    }

    public boolean checkLiteralCasts() {
        return checkLiteralCasts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PlannerConfig)) return false;
        PlannerConfig that = (PlannerConfig) o;
        return maxSubqueryDepth == that.maxSubqueryDepth && checkLiteralCasts == that.checkLiteralCasts;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxSubqueryDepth, checkLiteralCasts);
    }

    @Override
    public String toString() {
        return "PlannerConfig(maxSubqueryDepth=" + maxSubqueryDepth + ", checkLiteralCasts=" + checkLiteralCasts + ")";
    }
}
