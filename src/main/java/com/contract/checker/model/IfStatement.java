package com.contract.checker.model;

import com.contract.checker.expression.Expression;

import java.util.List;

/**
 * Two-armed conditional; either arm may be empty.
 */
public final class IfStatement extends Statement {

    private final Expression condition;
    private final List<Statement> thenBlock;
    private final List<Statement> elseBlock;

    public IfStatement(Expression condition, List<Statement> thenBlock, List<Statement> elseBlock) {
        this.condition = condition;
        this.thenBlock = List.copyOf(thenBlock);
        this.elseBlock = List.copyOf(elseBlock);
    }

    public Expression getCondition() {
        return condition;
    }

    public List<Statement> getThenBlock() {
        return thenBlock;
    }

    public List<Statement> getElseBlock() {
        return elseBlock;
    }

    @Override
    public Kind getKind() {
        return Kind.IF;
    }

    @Override
    public String toString() {
        return "if " + condition + " then " + thenBlock + " else " + elseBlock;
    }
}
