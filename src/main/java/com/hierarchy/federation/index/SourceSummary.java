package com.hierarchy.federation.index;

import java.time.Instant;
import java.util.Objects;

/**
 * Contribution of one source system to an index.
 */
public record SourceSummary(String sourceSystem, int recordCount, Instant ingestedAt) {

    public SourceSummary {
        Objects.requireNonNull(sourceSystem, "sourceSystem is required");
        Objects.requireNonNull(ingestedAt, "ingestedAt is required");
        if (recordCount < 0) {
            throw new IllegalArgumentException("recordCount must be >= 0");
        }
    }
}
