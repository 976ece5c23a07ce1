package com.contract.checker.model;

import com.contract.checker.expression.Expression;

import java.util.List;

/**
 * Guarded loop.
 */
public final class WhileStatement extends Statement {

    private final Expression condition;
    private final List<Statement> body;

    public WhileStatement(Expression condition, List<Statement> body) {
        this.condition = condition;
        this.body = List.copyOf(body);
    }

    public Expression getCondition() {
        return condition;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public Kind getKind() {
        return Kind.WHILE;
    }

    @Override
    public String toString() {
        return "while " + condition + " do " + body;
    }
}
