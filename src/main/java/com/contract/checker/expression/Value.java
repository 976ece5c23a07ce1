package com.contract.checker.expression;

/**
 * Result of evaluating an expression: a 64-bit integer or a boolean.
 *
 * Booleans take part in arithmetic and comparisons as 1 and 0, and any
 * non-zero integer is truthy.
 */
public final class Value {

    public static final Value TRUE = new Value(1, true);
    public static final Value FALSE = new Value(0, true);

    private final long number;
    private final boolean isBoolean;

    private Value(long number, boolean isBoolean) {
        this.number = number;
        this.isBoolean = isBoolean;
    }

    public static Value of(long number) {
        return new Value(number, false);
    }

    public static Value of(boolean bool) {
        return bool ? TRUE : FALSE;
    }

    public boolean isBoolean() {
        return isBoolean;
    }

    /**
     * Numeric view of this value; booleans map to 1 and 0.
     */
    public long asLong() {
        return number;
    }

    public boolean isTruthy() {
        return number != 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        return number == other.number && isBoolean == other.isBoolean;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(number) * 31 + (isBoolean ? 1 : 0);
    }

    @Override
    public String toString() {
        if (isBoolean) {
            return number != 0 ? "True" : "False";
        }
        return Long.toString(number);
    }
}
