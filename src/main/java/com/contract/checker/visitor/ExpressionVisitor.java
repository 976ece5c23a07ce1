package com.contract.checker.visitor;

import com.contract.checker.expression.BinaryNode;
import com.contract.checker.expression.BooleanNode;
import com.contract.checker.expression.ComparisonNode;
import com.contract.checker.expression.LiteralNode;
import com.contract.checker.expression.UnaryNode;
import com.contract.checker.expression.VariableNode;

/**
 * Visitor over the closed set of expression node kinds. Adding a node kind
 * means adding a method here, which breaks every visitor at compile time
 * instead of silently falling through.
 *
 * @param <R> The result type produced for each node
 */
public interface ExpressionVisitor<R> {

    R visit(LiteralNode node);

    R visit(VariableNode node);

    R visit(UnaryNode node);

    R visit(BinaryNode node);

    R visit(BooleanNode node);

    R visit(ComparisonNode node);
}
