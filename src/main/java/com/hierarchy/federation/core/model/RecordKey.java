package com.hierarchy.federation.core.model;

import java.util.Objects;

/**
 * Identity of a person record inside its origin system.
 * Used both as the global identity of a {@link PersonRecord} and as the
 * lookup key behind {@code reportsTo} references, which are resolved at read
 * time instead of being stored as object pointers.
 */
public record RecordKey(String sourceSystem, String sourceId) implements Comparable<RecordKey> {

    public RecordKey {
        Objects.requireNonNull(sourceSystem, "sourceSystem is required");
        Objects.requireNonNull(sourceId, "sourceId is required");
        if (sourceSystem.isBlank()) {
            throw new IllegalArgumentException("sourceSystem must not be blank");
        }
        if (sourceId.isBlank()) {
            throw new IllegalArgumentException("sourceId must not be blank");
        }
    }

    public static RecordKey of(String sourceSystem, String sourceId) {
        return new RecordKey(sourceSystem, sourceId);
    }

    @Override
    public int compareTo(RecordKey other) {
        int bySystem = sourceSystem.compareTo(other.sourceSystem);
        return bySystem != 0 ? bySystem : sourceId.compareTo(other.sourceId);
    }

    @Override
    public String toString() {
        return sourceSystem + ":" + sourceId;
    }
}
