package com.nestplan.exception;

import com.nestplan.query.Clause;
import com.nestplan.query.Query;
import java.util.Objects;

/**
 * Exception thrown when a query cannot be compiled.
 *
 * <p>The message names the problem and ends with the rendering of the offending query:
 * <pre>
 *   field `unknown` does not exist in subquery in query:
 *
 *   from p in subquery(from p in Post, select: %{id: p.id, title: p.title}), where: p.unknown == ^1
 * </pre>
 *
 * <p>Compilation is all-or-nothing: once this exception is raised no partial plan
 * is returned.
 *
 * @see ErrorKind
 * @see com.nestplan.planner.Planner
 */
public class QueryCompilationException extends RuntimeException {

    private final ErrorKind kind;
    private final String reason;
    private final Query query;
    private final Clause clause;

    /**
     * Creates a compilation exception.
     *
     * @param kind the error kind
     * @param reason the description of the problem, without query context
     * @param query the query being compiled (may be null)
     */
    public QueryCompilationException(ErrorKind kind, String reason, Query query) {
        this(kind, reason, query, null, null);
    }

    /**
     * Creates a compilation exception for a specific clause.
     *
     * @param kind the error kind
     * @param reason the description of the problem, without query context
     * @param query the query being compiled (may be null)
     * @param clause the clause in which the problem was found (may be null)
     */
    public QueryCompilationException(ErrorKind kind, String reason, Query query, Clause clause) {
        this(kind, reason, query, clause, null);
    }

    protected QueryCompilationException(ErrorKind kind, String reason, Query query, Clause clause,
                                        Throwable cause) {
        super(formatMessage(reason, query), cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
        this.query = query;
        this.clause = clause;
    }

    static String formatMessage(String reason, Query query) {
        if (query == null) {
            return reason;
        }
        return reason + " in query:\n\n" + query;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Returns the description of the problem without the query rendering.
     *
     * @return the reason
     */
    public String getReason() {
        return reason;
    }

    /**
     * Returns the query in which the problem was found.
     *
     * @return the query, or null if not available
     */
    public Query getQuery() {
        return query;
    }

    /**
     * Returns the clause in which the problem was found.
     *
     * @return the clause, or null if not specific to a clause
     */
    public Clause getClause() {
        return clause;
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Query Compilation Failed\n");
        sb.append("Kind: ").append(kind).append("\n");
        sb.append("Error: ").append(reason).append("\n");
        if (clause != null) {
            sb.append("Clause: ").append(clause.keyword()).append("\n");
        }
        if (query != null) {
            sb.append("Query: ").append(query).append("\n");
        }
        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }
        return sb.toString();
    }
}
