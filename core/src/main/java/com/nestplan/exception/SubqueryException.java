package com.nestplan.exception;

import com.nestplan.query.Query;
import java.util.Objects;

/**
 * Exception thrown when a subquery fails to compile.
 *
 * <p>The failure inside the subquery is kept as the cause; the message repeats it and
 * adds the query in which the subquery appears:
 * <pre>
 *   the following exception happened while compiling a subquery.
 *
 *       value `1` in `where` cannot be cast to type string in query:
 *
 *       from p in Post, where: p.title == ^1
 *
 *   The subquery originated from the following query:
 *
 *   from p in subquery(from p in Post, where: p.title == ^1)
 * </pre>
 *
 * <p>Errors raised by the outer query itself are never wrapped.
 */
public class SubqueryException extends QueryCompilationException {

    public static final String PREAMBLE = "the following exception happened while compiling a subquery.";

    private final QueryCompilationException wrapped;
    private final Query outerQuery;

    /**
     * Wraps a subquery failure.
     *
     * @param wrapped the failure raised while compiling the subquery
     * @param outerQuery the query in which the subquery appears
     */
    public SubqueryException(QueryCompilationException wrapped, Query outerQuery) {
        super(Objects.requireNonNull(wrapped, "wrapped must not be null").getKind(),
            describe(wrapped, outerQuery), null, wrapped.getClause(), wrapped);
        this.wrapped = wrapped;
        this.outerQuery = outerQuery;
    }

    private static String describe(QueryCompilationException wrapped, Query outerQuery) {
        StringBuilder sb = new StringBuilder(PREAMBLE).append("\n\n");
        for (String line : wrapped.getMessage().split("\n", -1)) {
            sb.append(line.isEmpty() ? "" : "    " + line).append('\n');
        }
        if (outerQuery != null) {
            sb.append("\nThe subquery originated from the following query:\n\n").append(outerQuery);
        }
        return sb.toString();
    }

    /**
     * Returns the failure raised while compiling the subquery.
     *
     * @return the wrapped exception
     */
    public QueryCompilationException wrapped() {
        return wrapped;
    }

    /**
     * Returns the kind of the wrapped failure.
     *
     * @return the inner error kind
     */
    public ErrorKind innerKind() {
        return wrapped.getKind();
    }

    @Override
    public Query getQuery() {
        return outerQuery;
    }
}
