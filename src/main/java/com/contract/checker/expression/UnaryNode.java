package com.contract.checker.expression;

import com.contract.checker.visitor.ExpressionVisitor;

/**
 * Unary minus, unary plus or logical negation.
 */
public final class UnaryNode extends ExpressionNode {

    public enum Operator {
        MINUS("-"),
        PLUS("+"),
        NOT("not ");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    private final Operator operator;
    private final ExpressionNode operand;

    public UnaryNode(Operator operator, ExpressionNode operand) {
        this.operator = operator;
        this.operand = operand;
    }

    public Operator getOperator() {
        return operator;
    }

    public ExpressionNode getOperand() {
        return operand;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "(" + operator.getSymbol() + operand + ")";
    }
}
