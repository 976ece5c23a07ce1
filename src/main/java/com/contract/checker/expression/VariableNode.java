package com.contract.checker.expression;

import com.contract.checker.visitor.ExpressionVisitor;

/**
 * Reference to a named integer variable.
 */
public final class VariableNode extends ExpressionNode {

    private final String name;

    public VariableNode(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
