package com.nestplan.exception;

import com.nestplan.query.Clause;
import com.nestplan.query.Query;
import com.nestplan.types.DataType;
import com.nestplan.types.TypeCaster;
import java.util.Objects;

/**
 * Exception thrown when a value cannot be cast to the type required by its context,
 * e.g. {@code value `1` in `where` cannot be cast to type string}.
 */
public class CastException extends QueryCompilationException {

    private final Object value;
    private final DataType type;

    /**
     * Creates a cast exception.
     *
     * @param value the value that failed to cast (may be null)
     * @param type the target type
     * @param clause the clause the value is bound in
     * @param query the query being compiled (may be null)
     */
    public CastException(Object value, DataType type, Clause clause, Query query) {
        super(ErrorKind.CAST_ERROR, reason(value, type, clause), query, clause);
        this.value = value;
        this.type = type;
    }

    private static String reason(Object value, DataType type, Clause clause) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(clause, "clause must not be null");
        return "value `" + TypeCaster.inspect(value) + "` in `" + clause.keyword()
            + "` cannot be cast to type " + type.typeName();
    }

    /**
     * Returns the value that failed to cast.
     *
     * @return the value, may be null
     */
    public Object getValue() {
        return value;
    }

    public DataType getType() {
        return type;
    }
}
