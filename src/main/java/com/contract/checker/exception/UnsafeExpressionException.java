package com.contract.checker.exception;

/**
 * Raised at parse time when expression text contains syntax outside the
 * allow-listed grammar. Expression text comes from untrusted spec files,
 * so this is never downgraded to a default value.
 */
public class UnsafeExpressionException extends ContractCheckException {

    private final String source;

    public UnsafeExpressionException(String message, String source) {
        super(message + " in expression: " + source);
        this.source = source;
    }

    /**
     * @return The rejected expression text
     */
    public String getSource() {
        return source;
    }
}
