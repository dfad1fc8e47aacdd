package com.hierarchy.federation.ingest;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.List;

/**
 * Pulls a full snapshot of one source system in its native record shape.
 * Implementations own the transport (database, spreadsheet, HTTP); the engine
 * only sees the returned records.
 */
@FunctionalInterface
public interface SourceAdapter {

    /**
     * Returns every record of the source as of now.
     *
     * @param sourceSystem the tag the records will be ingested under
     * @throws IOException when the snapshot cannot be read; the source is skipped for the cycle
     */
    List<JsonNode> pullSnapshot(String sourceSystem) throws IOException;
}
