package com.contract.checker.exception;

/**
 * Modulo by zero or 64-bit overflow during expression evaluation.
 */
public class ArithmeticEvaluationException extends EvaluationException {

    public ArithmeticEvaluationException(String message) {
        super(message);
    }

    public ArithmeticEvaluationException(String message, ArithmeticException cause) {
        super(message, cause);
    }
}
