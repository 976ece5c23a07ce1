package com.contract.checker.expression;

import com.contract.checker.visitor.ExpressionVisitor;

import java.util.List;

/**
 * A comparison chain such as {@code a < b <= c}. Each adjacent pair is
 * compared left to right and the chain is their conjunction.
 */
public final class ComparisonNode extends ExpressionNode {

    public enum Operator {
        EQUALS("=="),
        NOT_EQUALS("!="),
        LESS("<"),
        LESS_EQUALS("<="),
        GREATER(">"),
        GREATER_EQUALS(">=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }

        /**
         * Applies this comparison to two numeric operands.
         */
        public boolean test(long left, long right) {
            return switch (this) {
                case EQUALS -> left == right;
                case NOT_EQUALS -> left != right;
                case LESS -> left < right;
                case LESS_EQUALS -> left <= right;
                case GREATER -> left > right;
                case GREATER_EQUALS -> left >= right;
            };
        }
    }

    private final ExpressionNode left;
    private final List<Operator> operators;
    private final List<ExpressionNode> comparators;

    public ComparisonNode(ExpressionNode left, List<Operator> operators, List<ExpressionNode> comparators) {
        if (operators.isEmpty() || operators.size() != comparators.size()) {
            throw new IllegalArgumentException("Comparison chain needs one comparator per operator");
        }
        this.left = left;
        this.operators = List.copyOf(operators);
        this.comparators = List.copyOf(comparators);
    }

    public ExpressionNode getLeft() {
        return left;
    }

    public List<Operator> getOperators() {
        return operators;
    }

    public List<ExpressionNode> getComparators() {
        return comparators;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(").append(left);
        for (int i = 0; i < operators.size(); i++) {
            sb.append(' ').append(operators.get(i).getSymbol()).append(' ').append(comparators.get(i));
        }
        return sb.append(')').toString();
    }
}
