package com.hierarchy.federation.cycle;

/**
 * Base type for an ingestion cycle that stopped before publishing.
 * The previously published snapshot stays authoritative and the cycle may be retried.
 */
public abstract class CycleAbortedException extends RuntimeException {

    private final String cycleId;

    protected CycleAbortedException(String cycleId, String message) {
        super(message);
        this.cycleId = cycleId;
    }

    public String getCycleId() {
        return cycleId;
    }

    /**
     * Outcome recorded for a cycle aborted with this exception.
     */
    public abstract CycleOutcome outcome();
}
