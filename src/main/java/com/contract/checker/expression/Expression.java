package com.contract.checker.expression;

import com.contract.checker.visitor.VariableCollector;

import java.util.Objects;
import java.util.SortedSet;

/**
 * A parsed, validated expression together with the text it came from.
 * Instances are immutable and can be evaluated any number of times.
 */
public final class Expression {

    private final String source;
    private final ExpressionNode root;

    Expression(String source, ExpressionNode root) {
        this.source = source;
        this.root = root;
    }

    public String getSource() {
        return source;
    }

    public ExpressionNode getRoot() {
        return root;
    }

    /**
     * Names of all variables referenced by this expression, sorted.
     */
    public SortedSet<String> getVariables() {
        return VariableCollector.collect(root);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Expression)) return false;
        return source.equals(((Expression) o).source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source);
    }

    @Override
    public String toString() {
        return source;
    }
}
