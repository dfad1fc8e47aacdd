package com.hierarchy.federation.metrics;

import com.hierarchy.federation.cycle.CycleOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code federation.cycle.duration} - Timer (tag: outcome)</li>
 *   <li>{@code federation.records.ingested} - Counter (tag: sourceSystem)</li>
 *   <li>{@code federation.records.rejected} - Counter (tag: sourceSystem)</li>
 *   <li>{@code federation.batches.rejected} - Counter (tag: sourceSystem)</li>
 *   <li>{@code federation.crossrefs} - DistributionSummary of clusters per published cycle</li>
 *   <li>{@code federation.view.cache.hit} - Counter</li>
 *   <li>{@code federation.view.cache.miss} - Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary crossReferenceSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.crossReferenceSummary = DistributionSummary.builder("federation.crossrefs")
                .description("Cross references found per published cycle")
                .register(registry);
        this.cacheHitCounter = Counter.builder("federation.view.cache.hit")
                .description("Number of view cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("federation.view.cache.miss")
                .description("Number of view cache misses")
                .register(registry);
    }

    @Override
    public void recordCycleDuration(CycleOutcome outcome, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(outcome.name(), k ->
                Timer.builder("federation.cycle.duration")
                        .description("Duration of ingestion and resolution cycles")
                        .tag("outcome", outcome.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordRecordsIngested(String sourceSystem, int count) {
        sourceCounter("federation.records.ingested", "Records normalized and indexed", sourceSystem)
                .increment(count);
    }

    @Override
    public void recordRecordsRejected(String sourceSystem, int count) {
        sourceCounter("federation.records.rejected", "Records skipped by validation", sourceSystem)
                .increment(count);
    }

    @Override
    public void incrementBatchRejected(String sourceSystem) {
        sourceCounter("federation.batches.rejected", "Source batches left out of a cycle", sourceSystem)
                .increment();
    }

    @Override
    public void recordCrossReferences(int count) {
        crossReferenceSummary.record(count);
    }

    @Override
    public void recordViewCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordViewCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter sourceCounter(String name, String description, String sourceSystem) {
        return counterCache.computeIfAbsent(name + ":" + sourceSystem, k ->
                Counter.builder(name)
                        .description(description)
                        .tag("sourceSystem", sourceSystem)
                        .register(registry));
    }
}
