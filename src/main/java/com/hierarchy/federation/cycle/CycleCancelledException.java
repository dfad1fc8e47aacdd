package com.hierarchy.federation.cycle;

/**
 * The cycle was cancelled, usually because a newer cycle superseded it.
 */
public class CycleCancelledException extends CycleAbortedException {

    public CycleCancelledException(String cycleId) {
        super(cycleId, "Cycle " + cycleId + " was cancelled");
    }

    @Override
    public CycleOutcome outcome() {
        return CycleOutcome.CANCELLED;
    }
}
