package com.contract.checker.exception;

/**
 * Base class for every error raised while loading, executing or analyzing
 * a bounded contract.
 */
public class ContractCheckException extends RuntimeException {

    public ContractCheckException(String message) {
        super(message);
    }

    public ContractCheckException(String message, Throwable cause) {
        super(message, cause);
    }
}
