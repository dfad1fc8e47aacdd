package com.hierarchy.federation.resolve;

import com.hierarchy.federation.core.model.RecordKey;

import java.util.List;

/**
 * Non-fatal facts about one resolver run.
 *
 * @param recordCount      records in the index
 * @param blockCount       comparison blocks
 * @param comparedPairs    cross-system pairs that were scored
 * @param edgeCount        pairs at or above the pair threshold
 * @param clusterCount     cross references produced
 * @param unblockable      records excluded from resolution because their name key is empty;
 *                         they remain queryable
 */
public record ResolverDiagnostics(
        int recordCount,
        int blockCount,
        long comparedPairs,
        int edgeCount,
        int clusterCount,
        List<RecordKey> unblockable
) {
    public ResolverDiagnostics {
        unblockable = unblockable != null ? List.copyOf(unblockable) : List.of();
    }

    public static ResolverDiagnostics empty() {
        return new ResolverDiagnostics(0, 0, 0, 0, 0, List.of());
    }

    public int unblockableCount() {
        return unblockable.size();
    }

    public boolean hasExclusions() {
        return !unblockable.isEmpty();
    }
}
