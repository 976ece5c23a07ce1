package com.contract.checker.model;

import com.contract.checker.exception.InvalidRangeException;

import java.util.Objects;

/**
 * Inclusive integer range {@code [min, max]} of one input variable.
 */
public final class VariableRange {

    private final String name;
    private final long min;
    private final long max;

    /**
     * @throws InvalidRangeException If {@code min > max}
     */
    public VariableRange(String name, long min, long max) {
        if (min > max) {
            throw new InvalidRangeException(name, min, max);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.min = min;
        this.max = max;
    }

    public String getName() {
        return name;
    }

    public long getMin() {
        return min;
    }

    public long getMax() {
        return max;
    }

    /**
     * Number of values in the range.
     */
    public long size() {
        return Math.addExact(Math.subtractExact(max, min), 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariableRange)) return false;
        VariableRange that = (VariableRange) o;
        return min == that.min && max == that.max && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, min, max);
    }

    @Override
    public String toString() {
        return name + " in [" + min + ", " + max + "]";
    }
}
