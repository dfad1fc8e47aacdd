package com.hierarchy.federation.core.model;

/**
 * Well-known source system tags. Any other non-blank tag is accepted as well.
 */
public final class SourceSystems {

    /**
     * The fixed 8-level agent/distributor ladder.
     */
    public static final String LADDER = "ladder";

    /**
     * The corporate organizational chart.
     */
    public static final String ORGCHART = "orgchart";

    /**
     * Per-department rosters.
     */
    public static final String DEPARTMENT = "department";

    private SourceSystems() {
        // Constants holder
    }

    public static boolean isLadder(String sourceSystem) {
        return LADDER.equals(sourceSystem);
    }
}
