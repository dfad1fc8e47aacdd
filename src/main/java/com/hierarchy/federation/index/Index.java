package com.hierarchy.federation.index;

import com.hierarchy.federation.core.model.Departments;
import com.hierarchy.federation.core.model.PersonRecord;
import com.hierarchy.federation.core.model.RecordKey;
import com.hierarchy.federation.similarity.BlockingKey;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of all normalized records plus derived lookup structures.
 *
 * <p>An index is only ever observed fully built: {@link IndexBuilder#build()}
 * assembles every structure before returning it, and nothing here can be
 * modified afterwards. Every list keeps the stable insertion order of the
 * records.</p>
 */
public final class Index {

    private static final Index EMPTY = new Index(0L, Instant.EPOCH, List.of(), List.of(), Map.of(), List.of());

    private final long version;
    private final Instant builtAt;
    private final List<PersonRecord> records;
    private final List<SourceSummary> sources;
    private final Map<RecordKey, Integer> positions;
    private final Map<String, List<PersonRecord>> byDepartment;
    private final Map<String, String> departmentLabels;
    private final Map<String, List<PersonRecord>> bySourceSystem;
    private final List<PersonRecord> leadership;
    private final List<PersonRecord> managers;
    private final Map<BlockingKey, List<PersonRecord>> blocks;
    private final List<PersonRecord> unblockable;
    private final Map<RecordKey, List<RecordKey>> directReports;

    Index(long version, Instant builtAt, List<PersonRecord> records, List<SourceSummary> sources,
          Map<RecordKey, BlockingKey> blockingKeys, List<PersonRecord> unblockable) {
        this.version = version;
        this.builtAt = builtAt;
        this.records = List.copyOf(records);
        this.sources = List.copyOf(sources);
        this.unblockable = List.copyOf(unblockable);

        Map<RecordKey, Integer> positionMap = new LinkedHashMap<>();
        Map<String, ArrayList<PersonRecord>> departments = new LinkedHashMap<>();
        Map<String, String> labels = new LinkedHashMap<>();
        Map<String, ArrayList<PersonRecord>> systems = new LinkedHashMap<>();
        Map<BlockingKey, ArrayList<PersonRecord>> blockMap = new LinkedHashMap<>();
        ArrayList<PersonRecord> leaders = new ArrayList<>();
        ArrayList<PersonRecord> managerList = new ArrayList<>();

        for (int i = 0; i < this.records.size(); i++) {
            PersonRecord record = this.records.get(i);
            positionMap.put(record.getKey(), i);

            String departmentKey = Departments.key(record.getDepartment());
            if (!departmentKey.isEmpty()) {
                departments.computeIfAbsent(departmentKey, k -> new ArrayList<>()).add(record);
                labels.putIfAbsent(departmentKey, record.getDepartment().orElseThrow());
            }
            systems.computeIfAbsent(record.getSourceSystem(), k -> new ArrayList<>()).add(record);
            if (record.isLeadership()) {
                leaders.add(record);
            }
            if (record.isManager()) {
                managerList.add(record);
            }
            BlockingKey blockingKey = blockingKeys.get(record.getKey());
            if (blockingKey != null) {
                blockMap.computeIfAbsent(blockingKey, k -> new ArrayList<>()).add(record);
            }
        }

        Map<RecordKey, ArrayList<RecordKey>> reports = new LinkedHashMap<>();
        for (PersonRecord record : this.records) {
            record.getReportsTo()
                    .filter(positionMap::containsKey)
                    .filter(manager -> !manager.equals(record.getKey()))
                    .ifPresent(manager -> reports.computeIfAbsent(manager, k -> new ArrayList<>())
                            .add(record.getKey()));
        }

        this.positions = Collections.unmodifiableMap(positionMap);
        this.byDepartment = freeze(departments);
        this.departmentLabels = Collections.unmodifiableMap(labels);
        this.bySourceSystem = freeze(systems);
        this.leadership = List.copyOf(leaders);
        this.managers = List.copyOf(managerList);
        this.blocks = freeze(blockMap);
        this.directReports = freeze(reports);
    }

    /**
     * The index that is published before the first successful cycle.
     */
    public static Index empty() {
        return EMPTY;
    }

    public long version() {
        return version;
    }

    public Instant builtAt() {
        return builtAt;
    }

    /**
     * All records in insertion order.
     */
    public List<PersonRecord> records() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public List<SourceSummary> sources() {
        return sources;
    }

    public Optional<PersonRecord> get(RecordKey key) {
        Integer position = positions.get(key);
        return position != null ? Optional.of(records.get(position)) : Optional.empty();
    }

    public boolean contains(RecordKey key) {
        return positions.containsKey(key);
    }

    /**
     * Insertion position of the record, or -1 when it is not indexed.
     */
    public int positionOf(RecordKey key) {
        Integer position = positions.get(key);
        return position != null ? position : -1;
    }

    /**
     * Records of a department, matched case-insensitively.
     */
    public List<PersonRecord> byDepartment(String department) {
        return byDepartment.getOrDefault(Departments.key(department), List.of());
    }

    /**
     * Department keys mapped to the label under which each was first seen.
     */
    public Map<String, String> departments() {
        return departmentLabels;
    }

    public List<PersonRecord> bySourceSystem(String sourceSystem) {
        return bySourceSystem.getOrDefault(sourceSystem, List.of());
    }

    public Set<String> sourceSystems() {
        return bySourceSystem.keySet();
    }

    public List<PersonRecord> leadership() {
        return leadership;
    }

    public List<PersonRecord> managers() {
        return managers;
    }

    /**
     * Comparison blocks in order of first appearance.
     */
    public Map<BlockingKey, List<PersonRecord>> blocks() {
        return blocks;
    }

    /**
     * Records that could not be assigned to a block because their name key is empty.
     */
    public List<PersonRecord> unblockable() {
        return unblockable;
    }

    /**
     * Records whose {@code reportsTo} resolves to the given key, in insertion order.
     */
    public List<RecordKey> directReportsOf(RecordKey key) {
        return directReports.getOrDefault(key, List.of());
    }

    public boolean hasDirectReports(RecordKey key) {
        return directReports.containsKey(key);
    }

    private static <K, V> Map<K, List<V>> freeze(Map<K, ? extends List<V>> source) {
        Map<K, List<V>> frozen = new LinkedHashMap<>();
        source.forEach((key, value) -> frozen.put(key, List.copyOf(value)));
        return Collections.unmodifiableMap(frozen);
    }

    @Override
    public String toString() {
        return "Index{version=" + version +
                ", records=" + records.size() +
                ", sources=" + bySourceSystem.keySet() +
                ", blocks=" + blocks.size() +
                ", unblockable=" + unblockable.size() +
                '}';
    }
}
