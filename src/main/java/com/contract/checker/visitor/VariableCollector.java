package com.contract.checker.visitor;

import com.contract.checker.expression.BinaryNode;
import com.contract.checker.expression.BooleanNode;
import com.contract.checker.expression.ComparisonNode;
import com.contract.checker.expression.ExpressionNode;
import com.contract.checker.expression.LiteralNode;
import com.contract.checker.expression.UnaryNode;
import com.contract.checker.expression.VariableNode;

import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Collects the names of all variables referenced in an expression tree.
 */
public class VariableCollector implements ExpressionVisitor<Void> {

    private final SortedSet<String> names = new TreeSet<>();

    /**
     * Collects the variable names referenced under {@code root}.
     *
     * @param root The expression tree
     * @return Sorted, modifiable set of names
     */
    public static SortedSet<String> collect(ExpressionNode root) {
        VariableCollector collector = new VariableCollector();
        root.accept(collector);
        return collector.names;
    }

    @Override
    public Void visit(LiteralNode node) {
        return null;
    }

    @Override
    public Void visit(VariableNode node) {
        names.add(node.getName());
        return null;
    }

    @Override
    public Void visit(UnaryNode node) {
        node.getOperand().accept(this);
        return null;
    }

    @Override
    public Void visit(BinaryNode node) {
        node.getLeft().accept(this);
        node.getRight().accept(this);
        return null;
    }

    @Override
    public Void visit(BooleanNode node) {
        node.getOperands().forEach(operand -> operand.accept(this));
        return null;
    }

    @Override
    public Void visit(ComparisonNode node) {
        node.getLeft().accept(this);
        node.getComparators().forEach(comparator -> comparator.accept(this));
        return null;
    }
}
