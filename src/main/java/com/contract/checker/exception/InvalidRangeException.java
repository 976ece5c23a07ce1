package com.contract.checker.exception;

/**
 * An input variable was declared with {@code min > max}.
 */
public class InvalidRangeException extends ContractCheckException {

    public InvalidRangeException(String variableName, long min, long max) {
        super(String.format("Bad range for %s: min > max (%d > %d)", variableName, min, max));
    }
}
