package com.contract.checker.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The bounded input domain: one inclusive range per input variable,
 * kept in lexicographic order of variable names.
 */
public final class InputDomain {

    private final Map<String, VariableRange> ranges;

    public InputDomain(Collection<VariableRange> ranges) {
        Map<String, VariableRange> sorted = new TreeMap<>();
        for (VariableRange range : ranges) {
            if (sorted.put(range.getName(), range) != null) {
                throw new IllegalArgumentException("Duplicate input variable: " + range.getName());
            }
        }
        this.ranges = Collections.unmodifiableMap(sorted);
    }

    public static InputDomain of(VariableRange... ranges) {
        return new InputDomain(List.of(ranges));
    }

    /**
     * Ranges in the order variables are enumerated (sorted by name).
     */
    public List<VariableRange> getRanges() {
        return new ArrayList<>(ranges.values());
    }

    public List<String> getVariableNames() {
        return new ArrayList<>(ranges.keySet());
    }

    public VariableRange getRange(String name) {
        return ranges.get(name);
    }

    /**
     * Number of inputs in the Cartesian product; 1 for a domain without variables.
     *
     * @throws ArithmeticException If the product does not fit in a long
     */
    public long size() {
        long size = 1;
        for (VariableRange range : ranges.values()) {
            size = Math.multiplyExact(size, range.size());
        }
        return size;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InputDomain)) return false;
        return ranges.equals(((InputDomain) o).ranges);
    }

    @Override
    public int hashCode() {
        return ranges.hashCode();
    }

    @Override
    public String toString() {
        return ranges.values().toString();
    }
}
