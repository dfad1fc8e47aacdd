package com.hierarchy.federation.ingest;

/**
 * Thrown when a raw record cannot be normalized into a person record,
 * typically because its identifier or name is missing.
 * The record is skipped and counted; the ingestion cycle continues.
 */
public class ValidationException extends RuntimeException {

    private final String sourceSystem;
    private final int position;

    public ValidationException(String sourceSystem, int position, String message) {
        super(message);
        this.sourceSystem = sourceSystem;
        this.position = position;
    }

    public String getSourceSystem() {
        return sourceSystem;
    }

    /**
     * Zero-based position of the record in its snapshot, or -1 when unknown.
     */
    public int getPosition() {
        return position;
    }
}
