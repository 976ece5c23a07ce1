package com.contract.checker.execution;

/**
 * Steps used by one execution and whether the budget was exceeded.
 * An exceeded budget is how nontermination is reported.
 */
public final class ExecutionOutcome {

    private final long stepsUsed;
    private final boolean exceeded;

    public ExecutionOutcome(long stepsUsed, boolean exceeded) {
        this.stepsUsed = stepsUsed;
        this.exceeded = exceeded;
    }

    public long getStepsUsed() {
        return stepsUsed;
    }

    public boolean isExceeded() {
        return exceeded;
    }

    @Override
    public String toString() {
        return "ExecutionOutcome{stepsUsed=" + stepsUsed + ", exceeded=" + exceeded + "}";
    }
}
