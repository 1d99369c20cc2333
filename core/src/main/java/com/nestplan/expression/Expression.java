package com.nestplan.expression;

import java.util.List;

/**
 * Base interface for all nodes of the query expression tree.
 *
 * <p>Expressions appear in every clause of a query:
 * <ul>
 *   <li>select: {@code &0}, {@code %{title: &0.title}}, {@code merge(&0, %{text: &0.title})}</li>
 *   <li>where / having / join on: {@code &0.title == ^0}</li>
 *   <li>order_by: {@code [asc: &0.text]}</li>
 *   <li>update: values assigned to fields</li>
 * </ul>
 *
 * <p>Sources are referenced by position ({@code &ix}), never by object identity, and
 * bound values by placeholder ({@code ^ix}). Expressions are immutable; rewriting
 * passes build new trees through {@link #withChildren(List)}.
 *
 * <p>The interface is sealed so every compiler stage handles the complete set of
 * node kinds.
 */
public sealed interface Expression
    permits SourceRef, FieldAccess, Literal, Atom, Parameter, BinaryExpression,
            ListExpression, MapLiteral, StructLiteral, MapUpdate, Merge, Fragment,
            FieldSubset, SortOrder {

    /**
     * Returns the direct sub-expressions of this node, in rendering order.
     *
     * @return the children (empty for leaves)
     */
    List<Expression> children();

    /**
     * Returns a copy of this node with its children replaced.
     *
     * @param children the new children, same size and order as {@link #children()}
     * @return the rebuilt node (this node when it has no children)
     */
    Expression withChildren(List<Expression> children);

    /**
     * Renders this expression, resolving sources and placeholders through the context.
     *
     * @param context the rendering context
     * @return the rendered expression
     */
    String render(RenderContext context);

    /**
     * Renders this expression in positional form ({@code &0.title == ^0}).
     *
     * @return the rendered expression
     */
    default String render() {
        return render(RenderContext.POSITIONAL);
    }
}
