package com.contract.checker.exception;

/**
 * A top-level field of a spec file is missing or has the wrong type.
 */
public class MalformedSpecificationException extends ContractCheckException {

    public MalformedSpecificationException(String message) {
        super(message);
    }

    public MalformedSpecificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
