package com.hierarchy.federation.cycle;

import com.fasterxml.jackson.databind.JsonNode;
import com.hierarchy.federation.core.model.PersonRecord;
import com.hierarchy.federation.index.DuplicateIdentityException;
import com.hierarchy.federation.index.Index;
import com.hierarchy.federation.index.IndexBuilder;
import com.hierarchy.federation.ingest.RecordNormalizer;
import com.hierarchy.federation.ingest.SourceAdapter;
import com.hierarchy.federation.ingest.ValidationException;
import com.hierarchy.federation.logging.LogContext;
import com.hierarchy.federation.metrics.MetricsService;
import com.hierarchy.federation.resolve.CrossReferenceResolver;
import com.hierarchy.federation.resolve.ResolutionResult;
import com.hierarchy.federation.similarity.BlockingKeyStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One pass of pull, normalize, index and resolve over all registered sources.
 *
 * <p>Per-record problems skip the record; adapter failures and duplicated
 * identities leave out that source only. Cancellation and timeout are
 * observed between sources, every few records and between resolver blocks.
 * The cycle never publishes; its caller does, after winning the token's
 * commit.</p>
 */
public class IngestionCycle {
    private static final Logger log = LoggerFactory.getLogger(IngestionCycle.class);
    private static final int CHECKPOINT_INTERVAL = 256;

    private final long version;
    private final Map<String, SourceAdapter> sources;
    private final RecordNormalizer normalizer;
    private final CrossReferenceResolver resolver;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final Clock clock;
    private final MetricsService metricsService;
    private final List<SourceReport> reports = Collections.synchronizedList(new ArrayList<>());

    public IngestionCycle(long version, Map<String, SourceAdapter> sources, RecordNormalizer normalizer,
                          CrossReferenceResolver resolver, BlockingKeyStrategy blockingKeyStrategy,
                          Clock clock, MetricsService metricsService) {
        this.version = version;
        this.sources = new LinkedHashMap<>(Objects.requireNonNull(sources, "sources"));
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.blockingKeyStrategy = Objects.requireNonNull(blockingKeyStrategy, "blockingKeyStrategy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService");
    }

    /**
     * Runs the cycle up to, but not including, publication.
     *
     * @throws CycleAbortedException when the token is cancelled or expires
     */
    public Output run(CycleToken token) {
        IndexBuilder builder = new IndexBuilder(version, blockingKeyStrategy, clock);
        for (Map.Entry<String, SourceAdapter> entry : sources.entrySet()) {
            token.checkpoint();
            try (LogContext ctx = LogContext.forSource(entry.getKey())) {
                reports.add(ingest(entry.getKey(), entry.getValue(), builder, token));
            }
        }

        token.checkpoint();
        Index index = builder.build();
        ResolutionResult resolution = resolver.resolve(index, token);
        return new Output(index, resolution, sourceReports());
    }

    /**
     * Reports of the sources processed so far.
     */
    public List<SourceReport> sourceReports() {
        synchronized (reports) {
            return List.copyOf(reports);
        }
    }

    private SourceReport ingest(String sourceSystem, SourceAdapter adapter, IndexBuilder builder, CycleToken token) {
        List<JsonNode> raw;
        try {
            raw = adapter.pullSnapshot(sourceSystem);
        } catch (IOException | RuntimeException e) {
            log.warn("source.pull.failed source={} error={}", sourceSystem, e.getMessage(), e);
            metricsService.incrementBatchRejected(sourceSystem);
            return SourceReport.rejected(sourceSystem, 0, 0, List.of(), "Snapshot pull failed: " + e.getMessage());
        }
        if (raw == null) {
            raw = List.of();
        }

        List<PersonRecord> records = new ArrayList<>(raw.size());
        List<String> errors = new ArrayList<>();
        int invalid = 0;
        for (int position = 0; position < raw.size(); position++) {
            if (position % CHECKPOINT_INTERVAL == 0) {
                token.checkpoint();
            }
            try {
                records.add(normalizer.normalize(raw.get(position), sourceSystem, position));
            } catch (ValidationException e) {
                invalid++;
                if (errors.size() < SourceReport.MAX_ERRORS) {
                    errors.add(e.getMessage());
                }
                log.debug("source.record.invalid source={} position={} reason={}",
                        sourceSystem, position, e.getMessage());
            }
        }
        if (invalid > 0) {
            log.warn("source.records.rejected source={} rejected={} of={}", sourceSystem, invalid, raw.size());
            metricsService.recordRecordsRejected(sourceSystem, invalid);
        }

        try {
            builder.addBatch(sourceSystem, records);
        } catch (DuplicateIdentityException e) {
            metricsService.incrementBatchRejected(sourceSystem);
            return SourceReport.rejected(sourceSystem, raw.size(), invalid, errors, e.getMessage());
        }

        metricsService.recordRecordsIngested(sourceSystem, records.size());
        log.info("source.ingested source={} pulled={} accepted={} rejected={}",
                sourceSystem, raw.size(), records.size(), invalid);
        SourceReport.Status status = invalid > 0 ? SourceReport.Status.PARTIAL : SourceReport.Status.ACCEPTED;
        return new SourceReport(sourceSystem, status, raw.size(), records.size(), invalid, errors, null);
    }

    /**
     * Index and cross references ready to be published together.
     */
    public record Output(Index index, ResolutionResult resolution, List<SourceReport> sources) {

        /**
         * True when at least one source made it into the index, or no source is registered.
         */
        public boolean hasUsableSource() {
            return sources.isEmpty() || sources.stream().anyMatch(s -> !s.isRejected());
        }
    }
}
