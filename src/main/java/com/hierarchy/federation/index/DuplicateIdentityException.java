package com.hierarchy.federation.index;

import com.hierarchy.federation.core.model.RecordKey;

import java.util.List;

/**
 * Thrown when a source batch contains the same {@code (sourceSystem, sourceId)}
 * more than once, or repeats an identity already accepted for that source.
 * Only the offending batch is discarded.
 */
public class DuplicateIdentityException extends RuntimeException {

    private final String sourceSystem;
    private final List<RecordKey> duplicates;

    public DuplicateIdentityException(String sourceSystem, List<RecordKey> duplicates) {
        super("Source '" + sourceSystem + "' has duplicate identities: " + duplicates);
        this.sourceSystem = sourceSystem;
        this.duplicates = List.copyOf(duplicates);
    }

    public String getSourceSystem() {
        return sourceSystem;
    }

    public List<RecordKey> getDuplicates() {
        return duplicates;
    }
}
