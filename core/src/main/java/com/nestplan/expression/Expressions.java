package com.nestplan.expression;

import java.util.Arrays;
import java.util.List;

/**
 * Static factory methods for building expression trees in code.
 *
 * <p>Example, {@code p.title == ^"hello" and p.text != nil}:
 * <pre>
 *   Expression cond = and(eq(field(0, "title"), param(0)), ne(field(0, "text"), literal(null)));
 * </pre>
 */
public final class Expressions {

    private Expressions() {}

    public static SourceRef source(int index) {
        return new SourceRef(index);
    }

    public static FieldAccess field(int sourceIndex, String name) {
        return new FieldAccess(sourceIndex, name);
    }

    public static Parameter param(int index) {
        return new Parameter(index);
    }

    public static Literal literal(Object value) {
        return Literal.of(value);
    }

    public static Atom atom(String name) {
        return Atom.of(name);
    }

    public static BinaryExpression eq(Expression left, Expression right) {
        return new BinaryExpression(left, BinaryExpression.Operator.EQUAL, right);
    }

    public static BinaryExpression ne(Expression left, Expression right) {
        return new BinaryExpression(left, BinaryExpression.Operator.NOT_EQUAL, right);
    }

    public static BinaryExpression lt(Expression left, Expression right) {
        return new BinaryExpression(left, BinaryExpression.Operator.LESS_THAN, right);
    }

    public static BinaryExpression gt(Expression left, Expression right) {
        return new BinaryExpression(left, BinaryExpression.Operator.GREATER_THAN, right);
    }

    public static BinaryExpression in(Expression left, Expression right) {
        return new BinaryExpression(left, BinaryExpression.Operator.IN, right);
    }

    public static BinaryExpression and(Expression left, Expression right) {
        return new BinaryExpression(left, BinaryExpression.Operator.AND, right);
    }

    public static BinaryExpression or(Expression left, Expression right) {
        return new BinaryExpression(left, BinaryExpression.Operator.OR, right);
    }

    public static ListExpression list(Expression... elements) {
        return new ListExpression(Arrays.asList(elements));
    }

    public static MapEntry entry(String key, Expression value) {
        return MapEntry.of(key, value);
    }

    public static MapLiteral map(MapEntry... entries) {
        return new MapLiteral(List.of(entries));
    }

    public static StructLiteral struct(String entity, MapEntry... entries) {
        return new StructLiteral(entity, List.of(entries));
    }

    public static MapUpdate update(Expression base, MapEntry... updates) {
        return new MapUpdate(base, List.of(updates));
    }

    public static Merge merge(Expression left, Expression right) {
        return new Merge(left, right);
    }

    public static Fragment fragment(String template, Expression... arguments) {
        return new Fragment(template, List.of(arguments));
    }

    public static FieldSubset take(int sourceIndex, String... fields) {
        return new FieldSubset(sourceIndex, List.of(fields));
    }

    public static ListExpression orderBy(SortOrder... terms) {
        return new ListExpression(List.of(terms));
    }
}
