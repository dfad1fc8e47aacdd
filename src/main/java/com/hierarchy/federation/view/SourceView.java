package com.hierarchy.federation.view;

import com.hierarchy.federation.core.model.PersonRecord;
import com.hierarchy.federation.core.model.SourceSystems;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records of one source system as ingested.
 *
 * <p>For the ladder, {@link #levels()} holds all eight levels in ascending
 * order, each with its records in ingestion order; an unpopulated level maps
 * to an empty list. For other systems it is empty.</p>
 */
public final class SourceView implements View {

    private final ViewName name;
    private final long indexVersion;
    private final String sourceSystem;
    private final List<PersonRecord> records;
    private final Map<Integer, List<PersonRecord>> levels;

    SourceView(long indexVersion, String sourceSystem, List<PersonRecord> records,
               Map<Integer, List<PersonRecord>> levels) {
        this.name = ViewName.source(sourceSystem);
        this.indexVersion = indexVersion;
        this.sourceSystem = sourceSystem;
        this.records = List.copyOf(records);
        Map<Integer, List<PersonRecord>> copy = new LinkedHashMap<>();
        levels.forEach((level, members) -> copy.put(level, List.copyOf(members)));
        this.levels = Collections.unmodifiableMap(copy);
    }

    @Override
    public ViewName name() {
        return name;
    }

    @Override
    public long indexVersion() {
        return indexVersion;
    }

    public String sourceSystem() {
        return sourceSystem;
    }

    public List<PersonRecord> records() {
        return records;
    }

    public Map<Integer, List<PersonRecord>> levels() {
        return levels;
    }

    /**
     * Records at one ladder level, empty when the level is unpopulated or this is not the ladder.
     */
    public List<PersonRecord> atLevel(int level) {
        return levels.getOrDefault(level, List.of());
    }

    public boolean isLadder() {
        return SourceSystems.isLadder(sourceSystem);
    }

    public int size() {
        return records.size();
    }
}
