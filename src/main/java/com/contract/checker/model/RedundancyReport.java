package com.contract.checker.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single vs. group redundancy results for one contract.
 */
public final class RedundancyReport {

    private final List<Integer> singleRedundantIndices;
    private final List<Integer> greedyGroupIndices;
    private final boolean allSingleGroupRedundant;
    private final Map<String, Long> counterexample;

    /**
     * @param singleRedundantIndices Indices removable one at a time, ascending
     * @param greedyGroupIndices Indices of the greedy removable group, ascending
     * @param allSingleGroupRedundant Whether removing all single-redundant indices at once still holds
     * @param counterexample Witness input when the joint removal fails, or null
     */
    public RedundancyReport(List<Integer> singleRedundantIndices,
                            List<Integer> greedyGroupIndices,
                            boolean allSingleGroupRedundant,
                            Map<String, Long> counterexample) {
        this.singleRedundantIndices = List.copyOf(singleRedundantIndices);
        this.greedyGroupIndices = List.copyOf(greedyGroupIndices);
        this.allSingleGroupRedundant = allSingleGroupRedundant;
        this.counterexample = counterexample == null
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(counterexample));
    }

    public List<Integer> getSingleRedundantIndices() {
        return singleRedundantIndices;
    }

    public List<Integer> getGreedyGroupIndices() {
        return greedyGroupIndices;
    }

    public boolean isAllSingleGroupRedundant() {
        return allSingleGroupRedundant;
    }

    public Optional<Map<String, Long>> getCounterexample() {
        return Optional.ofNullable(counterexample);
    }

    @Override
    public String toString() {
        return "RedundancyReport{single=" + singleRedundantIndices
                + ", greedyGroup=" + greedyGroupIndices
                + ", allSingleGroupRedundant=" + allSingleGroupRedundant
                + ", counterexample=" + counterexample + "}";
    }
}
