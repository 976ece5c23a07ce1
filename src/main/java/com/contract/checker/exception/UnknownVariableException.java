package com.contract.checker.exception;

/**
 * A referenced variable is not bound in the current environment.
 */
public class UnknownVariableException extends EvaluationException {

    private final String variableName;

    public UnknownVariableException(String variableName) {
        super("Unknown variable: " + variableName);
        this.variableName = variableName;
    }

    public String getVariableName() {
        return variableName;
    }
}
