package com.contract.checker.expression;

import com.contract.checker.visitor.ExpressionVisitor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code and} / {@code or} over two or more operands. Consecutive uses of
 * the same connective are flattened into one node.
 */
public final class BooleanNode extends ExpressionNode {

    public enum Operator {
        AND("and"),
        OR("or");

        private final String keyword;

        Operator(String keyword) {
            this.keyword = keyword;
        }

        public String getKeyword() {
            return keyword;
        }
    }

    private final Operator operator;
    private final List<ExpressionNode> operands;

    public BooleanNode(Operator operator, List<ExpressionNode> operands) {
        if (operands.size() < 2) {
            throw new IllegalArgumentException("Boolean operator needs at least two operands");
        }
        this.operator = operator;
        this.operands = List.copyOf(operands);
    }

    public Operator getOperator() {
        return operator;
    }

    public List<ExpressionNode> getOperands() {
        return operands;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return operands.stream()
                .map(ExpressionNode::toString)
                .collect(Collectors.joining(" " + operator.getKeyword() + " ", "(", ")"));
    }
}
