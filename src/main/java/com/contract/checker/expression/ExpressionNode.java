package com.contract.checker.expression;

import com.contract.checker.visitor.ExpressionVisitor;

/**
 * Node of an immutable expression tree.
 *
 * The set of subclasses is closed: literals, variable references, unary,
 * binary arithmetic, boolean connectives and comparison chains. A tree can
 * only be built from these kinds, so anything the parser does not
 * recognize never reaches evaluation.
 */
public abstract class ExpressionNode {

    ExpressionNode() {
    }

    /**
     * Dispatches to the matching {@code visit} method of the visitor.
     *
     * @param visitor The visitor
     * @param <R> The visitor's result type
     * @return The visitor's result for this node
     */
    public abstract <R> R accept(ExpressionVisitor<R> visitor);
}
