package com.contract.checker.expression;

import com.contract.checker.visitor.ExpressionVisitor;

/**
 * Arithmetic on two operands. There is deliberately no division operator;
 * remainder is the only operation that can fail on a zero operand.
 */
public final class BinaryNode extends ExpressionNode {

    public enum Operator {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        REMAINDER("%");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    private final ExpressionNode left;
    private final Operator operator;
    private final ExpressionNode right;

    public BinaryNode(ExpressionNode left, Operator operator, ExpressionNode right) {
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public ExpressionNode getLeft() {
        return left;
    }

    public Operator getOperator() {
        return operator;
    }

    public ExpressionNode getRight() {
        return right;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.getSymbol() + " " + right + ")";
    }
}
