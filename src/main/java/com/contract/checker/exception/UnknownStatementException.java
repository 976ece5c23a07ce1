package com.contract.checker.exception;

/**
 * A statement record uses none of the recognized shapes
 * ({@code assign}, {@code if}, {@code while}).
 */
public class UnknownStatementException extends ContractCheckException {

    public UnknownStatementException(String statement) {
        super("Unknown statement: " + statement);
    }
}
