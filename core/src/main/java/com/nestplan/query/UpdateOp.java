package com.nestplan.query;

import com.nestplan.expression.Expression;
import java.util.Objects;

/**
 * One field assignment of an update clause ({@code set: [title: ^"new"]}).
 *
 * @param kind the update kind
 * @param field the updated field
 * @param value the new value, or the increment/pushed element
 */
public record UpdateOp(Kind kind, String field, Expression value) {

    public enum Kind {
        SET, INC, PUSH, PULL;

        public String keyword() {
            return name().toLowerCase();
        }
    }

    public UpdateOp {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    public static UpdateOp set(String field, Expression value) {
        return new UpdateOp(Kind.SET, field, value);
    }

    public static UpdateOp inc(String field, Expression value) {
        return new UpdateOp(Kind.INC, field, value);
    }
}
