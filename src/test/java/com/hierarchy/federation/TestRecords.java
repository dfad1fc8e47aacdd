package com.hierarchy.federation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hierarchy.federation.api.FederationOptions;
import com.hierarchy.federation.core.model.PersonRecord;
import com.hierarchy.federation.index.Index;
import com.hierarchy.federation.index.IndexBuilder;
import com.hierarchy.federation.ingest.RecordNormalizer;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds normalized records and indexes from JSON literals for tests.
 */
public final class TestRecords {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final RecordNormalizer NORMALIZER = RecordNormalizer.from(FederationOptions.defaults());

    private TestRecords() {
    }

    /**
     * Parses JSON written with single quotes for readability.
     */
    public static JsonNode json(String singleQuoted) {
        try {
            return MAPPER.readTree(singleQuoted.replace('\'', '"'));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static PersonRecord record(String sourceSystem, String singleQuotedJson) {
        return NORMALIZER.normalize(json(singleQuotedJson), sourceSystem);
    }

    public static RecordNormalizer normalizer() {
        return NORMALIZER;
    }

    /**
     * Indexes the records, one batch per source system in order of first appearance.
     */
    public static Index index(long version, PersonRecord... records) {
        Map<String, List<PersonRecord>> batches = new LinkedHashMap<>();
        for (PersonRecord record : records) {
            batches.computeIfAbsent(record.getSourceSystem(), k -> new ArrayList<>()).add(record);
        }
        IndexBuilder builder = new IndexBuilder(version);
        batches.forEach(builder::addBatch);
        return builder.build();
    }

    public static Index index(PersonRecord... records) {
        return index(1L, records);
    }

    public static PersonRecord sarahLadder() {
        return record("ladder", "{'id':'L1','name':'Sarah Johnson','title':'Master Agent','level':1}");
    }

    public static PersonRecord sarahDepartment() {
        return record("department",
                "{'id':'D9','name':'Sarah Johnson','title':'Marketing Director','department':'Marketing'}");
    }
}
