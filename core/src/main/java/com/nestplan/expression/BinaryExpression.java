package com.nestplan.expression;

import java.util.List;
import java.util.Objects;

/**
 * Expression representing a binary operation.
 *
 * <p>Binary expressions include:
 * <ul>
 *   <li>Comparison: a == b, a != b, a &lt; b, a &lt;= b, a &gt; b, a &gt;= b</li>
 *   <li>Membership: a in b</li>
 *   <li>Logical: a and b, a or b</li>
 *   <li>Arithmetic: a + b, a - b, a * b, a / b</li>
 * </ul>
 *
 * <p>Comparisons between a field and a placeholder drive parameter casting: the
 * placeholder takes the field's type ({@code array<type>} for {@code in}).
 */
public final class BinaryExpression implements Expression {

    /**
     * Binary operators.
     */
    public enum Operator {
        EQUAL("=="),
        NOT_EQUAL("!="),
        LESS_THAN("<"),
        LESS_THAN_OR_EQUAL("<="),
        GREATER_THAN(">"),
        GREATER_THAN_OR_EQUAL(">="),
        IN("in"),
        AND("and"),
        OR("or"),
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isComparison() {
            return this == EQUAL || this == NOT_EQUAL || this == LESS_THAN ||
                   this == LESS_THAN_OR_EQUAL || this == GREATER_THAN ||
                   this == GREATER_THAN_OR_EQUAL;
        }

        public boolean isLogical() {
            return this == AND || this == OR;
        }
    }

    private final Expression left;
    private final Operator operator;
    private final Expression right;

    /**
     * Creates a binary expression.
     *
     * @param left the left operand
     * @param operator the operator
     * @param right the right operand
     */
    public BinaryExpression(Expression left, Operator operator, Expression right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    public Expression left() {
        return left;
    }

    public Operator operator() {
        return operator;
    }

    public Expression right() {
        return right;
    }

    @Override
    public List<Expression> children() {
        return List.of(left, right);
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        if (children.size() != 2) {
            throw new IllegalArgumentException("binary expression takes 2 children, got " + children.size());
        }
        return new BinaryExpression(children.get(0), operator, children.get(1));
    }

    @Override
    public String render(RenderContext context) {
        return renderOperand(left, context) + " " + operator.symbol() + " " + renderOperand(right, context);
    }

    private String renderOperand(Expression operand, RenderContext context) {
        String rendered = operand.render(context);
        // a logical operand of a non-logical operator needs grouping
        if (operand instanceof BinaryExpression bin && bin.operator.isLogical() && bin.operator != operator) {
            return "(" + rendered + ")";
        }
        return rendered;
    }

    @Override
    public String toString() {
        return render();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BinaryExpression)) return false;
        BinaryExpression that = (BinaryExpression) obj;
        return operator == that.operator && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }
}
