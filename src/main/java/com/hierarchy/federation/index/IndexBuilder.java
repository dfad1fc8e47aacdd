package com.hierarchy.federation.index;

import com.hierarchy.federation.core.model.PersonRecord;
import com.hierarchy.federation.core.model.RecordKey;
import com.hierarchy.federation.similarity.BlockingKey;
import com.hierarchy.federation.similarity.BlockingKeyStrategy;
import com.hierarchy.federation.similarity.DefaultBlockingKeyStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Assembles an {@link Index} from normalized records, one source batch at a time.
 *
 * <p>Each batch is validated as a whole before any of its records are staged,
 * so a batch with a duplicated identity leaves no trace while batches of other
 * sources still build. The builder is single-use.</p>
 *
 * <pre>
 * IndexBuilder builder = new IndexBuilder(version);
 * builder.addBatch("ladder", ladderRecords);
 * builder.addBatch("orgchart", orgRecords);
 * Index index = builder.build();
 * </pre>
 */
public class IndexBuilder {
    private static final Logger log = LoggerFactory.getLogger(IndexBuilder.class);

    private final long version;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final Clock clock;

    private final List<PersonRecord> staged = new ArrayList<>();
    private final Set<RecordKey> stagedKeys = new HashSet<>();
    private final Map<String, Integer> stagedCounts = new LinkedHashMap<>();
    private final Map<String, Instant> stagedAt = new LinkedHashMap<>();
    private boolean built;

    public IndexBuilder(long version) {
        this(version, new DefaultBlockingKeyStrategy(), Clock.systemUTC());
    }

    public IndexBuilder(long version, BlockingKeyStrategy blockingKeyStrategy, Clock clock) {
        this.version = version;
        this.blockingKeyStrategy = Objects.requireNonNull(blockingKeyStrategy, "blockingKeyStrategy");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Stages all records of one source batch.
     *
     * @throws DuplicateIdentityException when the batch repeats an identity; nothing is staged
     * @throws IllegalArgumentException   when a record belongs to another source
     */
    public IndexBuilder addBatch(String sourceSystem, List<PersonRecord> batch) {
        checkNotBuilt();
        Objects.requireNonNull(sourceSystem, "sourceSystem");
        Objects.requireNonNull(batch, "batch");

        Set<RecordKey> seen = new HashSet<>();
        Set<RecordKey> duplicates = new LinkedHashSet<>();
        for (PersonRecord record : batch) {
            if (!sourceSystem.equals(record.getSourceSystem())) {
                throw new IllegalArgumentException("Record " + record.getKey()
                        + " does not belong to source '" + sourceSystem + "'");
            }
            if (!seen.add(record.getKey()) || stagedKeys.contains(record.getKey())) {
                duplicates.add(record.getKey());
            }
        }
        if (!duplicates.isEmpty()) {
            log.warn("index.batch.rejected source={} duplicates={}", sourceSystem, duplicates.size());
            throw new DuplicateIdentityException(sourceSystem, new ArrayList<>(duplicates));
        }

        staged.addAll(batch);
        stagedKeys.addAll(seen);
        stagedCounts.merge(sourceSystem, batch.size(), Integer::sum);
        stagedAt.put(sourceSystem, clock.instant());
        log.debug("index.batch.staged source={} records={}", sourceSystem, batch.size());
        return this;
    }

    /**
     * Stages an interleaved sequence of records from any number of sources.
     * Sources whose records repeat an identity are left out entirely; the
     * relative order of all other records is preserved.
     *
     * @return one exception per rejected source, empty when everything was staged
     */
    public List<DuplicateIdentityException> addAll(List<PersonRecord> records) {
        checkNotBuilt();
        Objects.requireNonNull(records, "records");

        Map<String, Set<RecordKey>> seenBySource = new LinkedHashMap<>();
        Map<String, Set<RecordKey>> duplicatesBySource = new LinkedHashMap<>();
        for (PersonRecord record : records) {
            Set<RecordKey> seen = seenBySource.computeIfAbsent(record.getSourceSystem(), k -> new HashSet<>());
            if (!seen.add(record.getKey()) || stagedKeys.contains(record.getKey())) {
                duplicatesBySource.computeIfAbsent(record.getSourceSystem(), k -> new LinkedHashSet<>())
                        .add(record.getKey());
            }
        }

        List<DuplicateIdentityException> rejected = new ArrayList<>();
        duplicatesBySource.forEach((source, duplicates) -> {
            log.warn("index.batch.rejected source={} duplicates={}", source, duplicates.size());
            rejected.add(new DuplicateIdentityException(source, new ArrayList<>(duplicates)));
        });

        Instant now = clock.instant();
        for (PersonRecord record : records) {
            String source = record.getSourceSystem();
            if (duplicatesBySource.containsKey(source)) {
                continue;
            }
            staged.add(record);
            stagedKeys.add(record.getKey());
            stagedCounts.merge(source, 1, Integer::sum);
            stagedAt.put(source, now);
        }
        return rejected;
    }

    /**
     * Number of records staged so far.
     */
    public int stagedCount() {
        return staged.size();
    }

    /**
     * Builds the index. Can be called once.
     */
    public Index build() {
        checkNotBuilt();
        built = true;

        Map<RecordKey, BlockingKey> blockingKeys = new LinkedHashMap<>();
        List<PersonRecord> unblockable = new ArrayList<>();
        for (PersonRecord record : staged) {
            blockingKeyStrategy.blockingKey(record).ifPresentOrElse(
                    key -> blockingKeys.put(record.getKey(), key),
                    () -> unblockable.add(record));
        }

        List<SourceSummary> sources = new ArrayList<>();
        stagedCounts.forEach((source, count) ->
                sources.add(new SourceSummary(source, count, stagedAt.get(source))));

        Index index = new Index(version, clock.instant(), staged, sources, blockingKeys, unblockable);
        log.info("index.built version={} records={} sources={} blocks={} unblockable={}",
                version, index.size(), sources.size(), index.blocks().size(), unblockable.size());
        return index;
    }

    private void checkNotBuilt() {
        if (built) {
            throw new IllegalStateException("IndexBuilder has already built its index");
        }
    }
}
