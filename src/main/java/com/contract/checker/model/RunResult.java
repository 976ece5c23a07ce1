package com.contract.checker.model;

import java.util.Objects;

/**
 * Aggregate counts of one bounded run over every input in the domain.
 */
public final class RunResult {

    private final long consideredInputs;
    private final long satisfyingPre;
    private final long violations;
    private final long nontermination;

    public RunResult(long consideredInputs, long satisfyingPre, long violations, long nontermination) {
        this.consideredInputs = consideredInputs;
        this.satisfyingPre = satisfyingPre;
        this.violations = violations;
        this.nontermination = nontermination;
    }

    public long getConsideredInputs() {
        return consideredInputs;
    }

    public long getSatisfyingPre() {
        return satisfyingPre;
    }

    /**
     * Inputs that passed the precondition but failed a postcondition or
     * raised an evaluation error (errors in the precondition itself count too).
     */
    public long getViolations() {
        return violations;
    }

    public long getNontermination() {
        return nontermination;
    }

    /**
     * No violations and no nontermination.
     */
    public boolean holds() {
        return violations == 0 && nontermination == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RunResult)) return false;
        RunResult that = (RunResult) o;
        return consideredInputs == that.consideredInputs
                && satisfyingPre == that.satisfyingPre
                && violations == that.violations
                && nontermination == that.nontermination;
    }

    @Override
    public int hashCode() {
        return Objects.hash(consideredInputs, satisfyingPre, violations, nontermination);
    }

    @Override
    public String toString() {
        return String.format("RunResult{considered=%d, satisfyingPre=%d, violations=%d, nontermination=%d}",
                consideredInputs, satisfyingPre, violations, nontermination);
    }
}
