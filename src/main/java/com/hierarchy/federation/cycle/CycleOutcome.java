package com.hierarchy.federation.cycle;

/**
 * Final state of an ingestion cycle.
 */
public enum CycleOutcome {
    /**
     * A new snapshot was published. Individual sources may still have been rejected.
     */
    PUBLISHED,

    /**
     * Cancelled before publishing; the previous snapshot stays.
     */
    CANCELLED,

    /**
     * Ran out of time before publishing; the previous snapshot stays.
     */
    TIMED_OUT,

    /**
     * Failed unexpectedly before publishing; the previous snapshot stays.
     */
    FAILED
}
