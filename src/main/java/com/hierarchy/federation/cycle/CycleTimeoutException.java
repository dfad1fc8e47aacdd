package com.hierarchy.federation.cycle;

/**
 * The cycle exceeded its wall-clock budget.
 */
public class CycleTimeoutException extends CycleAbortedException {

    public CycleTimeoutException(String cycleId) {
        super(cycleId, "Cycle " + cycleId + " exceeded its time budget");
    }

    @Override
    public CycleOutcome outcome() {
        return CycleOutcome.TIMED_OUT;
    }
}
