package com.contract.checker.exception;

/**
 * Errors raised while evaluating an expression against a concrete input.
 * The contract runner counts these per input instead of aborting the sweep.
 */
public class EvaluationException extends ContractCheckException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
