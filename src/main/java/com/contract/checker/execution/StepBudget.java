package com.contract.checker.execution;

/**
 * Running step count for one program execution, shared by every nested block.
 */
public final class StepBudget {

    private final int limit;
    private long used = 0;

    public StepBudget(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("step budget must be positive, got " + limit);
        }
        this.limit = limit;
    }

    /**
     * Charges one step.
     *
     * @return false once the running total strictly exceeds the limit
     */
    public boolean charge() {
        used++;
        return !isExceeded();
    }

    public boolean isExceeded() {
        return used > limit;
    }

    public long getUsed() {
        return used;
    }

    public int getLimit() {
        return limit;
    }
}
