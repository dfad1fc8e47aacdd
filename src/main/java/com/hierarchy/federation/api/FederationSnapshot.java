package com.hierarchy.federation.api;

import com.hierarchy.federation.index.Index;
import com.hierarchy.federation.resolve.ResolutionResult;

import java.time.Instant;
import java.util.Objects;

/**
 * An index together with the cross references computed from it.
 * Published as one unit, so readers never see cross references of another index version.
 *
 * @param index       the published index
 * @param resolution  cross references of that index
 * @param cycleId     cycle that produced it, or null for the initial empty snapshot
 * @param publishedAt when it was published
 */
public record FederationSnapshot(Index index, ResolutionResult resolution, String cycleId, Instant publishedAt) {

    private static final FederationSnapshot INITIAL =
            new FederationSnapshot(Index.empty(), ResolutionResult.empty(0L), null, Instant.EPOCH);

    public FederationSnapshot {
        Objects.requireNonNull(index, "index");
        Objects.requireNonNull(resolution, "resolution");
        Objects.requireNonNull(publishedAt, "publishedAt");
        if (resolution.indexVersion() != index.version()) {
            throw new IllegalArgumentException("Resolution of version " + resolution.indexVersion()
                    + " does not belong to index version " + index.version());
        }
    }

    /**
     * Snapshot visible before the first successful cycle.
     */
    public static FederationSnapshot initial() {
        return INITIAL;
    }

    public long version() {
        return index.version();
    }

    public boolean isInitial() {
        return cycleId == null;
    }
}
