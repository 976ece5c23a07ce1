package com.contract.checker.exception;

/**
 * A statement record is structurally invalid: a required key is missing,
 * or a block position holds something other than a list.
 */
public class MalformedProgramException extends ContractCheckException {

    public MalformedProgramException(String message) {
        super(message);
    }
}
