package com.contract.checker.model;

/**
 * One statement of the tiny imperative language. Exactly three kinds exist;
 * see {@link AssignStatement}, {@link IfStatement} and {@link WhileStatement}.
 */
public abstract class Statement {

    public enum Kind {
        ASSIGN,
        IF,
        WHILE
    }

    Statement() {
    }

    public abstract Kind getKind();
}
