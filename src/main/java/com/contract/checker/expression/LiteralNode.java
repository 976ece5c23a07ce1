package com.contract.checker.expression;

import com.contract.checker.visitor.ExpressionVisitor;

/**
 * Integer or boolean constant.
 */
public final class LiteralNode extends ExpressionNode {

    private final Value value;

    public LiteralNode(Value value) {
        this.value = value;
    }

    public Value getValue() {
        return value;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
