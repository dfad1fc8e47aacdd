package com.hierarchy.federation.api;

import com.hierarchy.federation.cache.CacheConfig;
import com.hierarchy.federation.cache.CacheStats;
import com.hierarchy.federation.cache.CaffeineViewCache;
import com.hierarchy.federation.cache.NoOpViewCache;
import com.hierarchy.federation.cache.ViewCache;
import com.hierarchy.federation.core.model.CrossReference;
import com.hierarchy.federation.core.model.PersonRecord;
import com.hierarchy.federation.cycle.CycleAbortedException;
import com.hierarchy.federation.cycle.CycleHandle;
import com.hierarchy.federation.cycle.CycleOutcome;
import com.hierarchy.federation.cycle.CycleReport;
import com.hierarchy.federation.cycle.CycleToken;
import com.hierarchy.federation.cycle.IngestionCycle;
import com.hierarchy.federation.diagnostics.DiagnosticsListener;
import com.hierarchy.federation.diagnostics.InMemoryDiagnosticsLog;
import com.hierarchy.federation.health.CycleHealthCheck;
import com.hierarchy.federation.health.HealthCheck;
import com.hierarchy.federation.health.HealthCheckRegistry;
import com.hierarchy.federation.health.HealthStatus;
import com.hierarchy.federation.ingest.RecordNormalizer;
import com.hierarchy.federation.ingest.SourceAdapter;
import com.hierarchy.federation.logging.LogContext;
import com.hierarchy.federation.metrics.MetricsService;
import com.hierarchy.federation.metrics.NoOpMetricsService;
import com.hierarchy.federation.query.PersonQuery;
import com.hierarchy.federation.query.QueryEngine;
import com.hierarchy.federation.resolve.CrossReferenceResolver;
import com.hierarchy.federation.resolve.ResolverDiagnostics;
import com.hierarchy.federation.similarity.BlockingKeyStrategy;
import com.hierarchy.federation.similarity.DefaultBlockingKeyStrategy;
import com.hierarchy.federation.view.View;
import com.hierarchy.federation.view.ViewMaterializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Main entry point of the hierarchy federation library.
 *
 * <p>Sources are registered once; each cycle pulls every source, builds a
 * fresh index, resolves cross references and publishes both together with a
 * single reference swap. Queries, views and cross reference listings read
 * whichever snapshot is current when they start and never wait for a
 * running cycle.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (HierarchyFederation federation = HierarchyFederation.builder()
 *         .source("ladder", ladderAdapter)
 *         .source("orgchart", orgChartAdapter)
 *         .source("department", departmentAdapter)
 *         .build()) {
 *
 *     CycleReport report = federation.runCycle();
 *
 *     List&lt;PersonRecord&gt; leaders = federation.query(PersonQuery.builder()
 *         .department("Marketing")
 *         .leadership(true)
 *         .build());
 *     View tree = federation.materializeView("organizational");
 *     List&lt;CrossReference&gt; links = federation.listCrossReferences(0.9);
 * }
 * </pre>
 *
 * <p>A new cycle supersedes a running one, which is cancelled. A cycle that
 * times out, is cancelled or fails leaves the previous snapshot in place.</p>
 */
public class HierarchyFederation implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HierarchyFederation.class);

    private final FederationOptions options;
    private final Map<String, SourceAdapter> sources;
    private final RecordNormalizer normalizer;
    private final CrossReferenceResolver resolver;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final QueryEngine queryEngine;
    private final ViewMaterializer viewMaterializer;
    private final ViewCache viewCache;
    private final MetricsService metricsService;
    private final InMemoryDiagnosticsLog diagnosticsLog;
    private final List<DiagnosticsListener> listeners;
    private final HealthCheckRegistry healthCheckRegistry;
    private final Clock clock;

    private final ExecutorService cycleExecutor;
    private final ExecutorService resolverWorkers;
    private final ScheduledExecutorService timer;

    private final AtomicReference<FederationSnapshot> current = new AtomicReference<>(FederationSnapshot.initial());
    private final AtomicReference<CycleHandle> running = new AtomicReference<>();
    private final AtomicLong versions = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean();

    private HierarchyFederation(Builder builder) {
        this.options = builder.options;
        this.sources = Collections.unmodifiableMap(new LinkedHashMap<>(builder.sources));
        this.clock = builder.clock;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.blockingKeyStrategy = builder.blockingKeyStrategy != null
                ? builder.blockingKeyStrategy : new DefaultBlockingKeyStrategy();

        if (builder.viewCache != null) {
            this.viewCache = builder.viewCache;
        } else if (builder.cacheConfig.enabled()) {
            this.viewCache = new CaffeineViewCache(builder.cacheConfig, metricsService);
        } else {
            this.viewCache = new NoOpViewCache();
        }

        this.cycleExecutor = Executors.newCachedThreadPool(namedThreads("federation-cycle"));
        this.resolverWorkers = Executors.newFixedThreadPool(options.getResolverParallelism(),
                namedThreads("federation-resolver"));
        this.timer = Executors.newSingleThreadScheduledExecutor(namedThreads("federation-cycle-timer"));

        this.normalizer = RecordNormalizer.from(options);
        this.resolver = CrossReferenceResolver.from(options, resolverWorkers);
        this.queryEngine = new QueryEngine();
        this.viewMaterializer = new ViewMaterializer(queryEngine, viewCache);

        this.diagnosticsLog = new InMemoryDiagnosticsLog(builder.diagnosticsCapacity);
        List<DiagnosticsListener> allListeners = new ArrayList<>();
        allListeners.add(diagnosticsLog);
        allListeners.addAll(builder.listeners);
        this.listeners = List.copyOf(allListeners);

        this.healthCheckRegistry = new HealthCheckRegistry();
        healthCheckRegistry.register(new CycleHealthCheck(() -> current.get().version(), diagnosticsLog));
        builder.healthChecks.forEach(healthCheckRegistry::register);

        log.info("HierarchyFederation initialized: sources={} options={}", sources.keySet(), options);
    }

    // ========== Query API ==========

    /**
     * Records of the current snapshot matching every supplied predicate, in index order.
     */
    public List<PersonRecord> query(PersonQuery query) {
        return queryEngine.query(current.get().index(), query);
    }

    /**
     * Materializes a view of the current snapshot.
     *
     * @param name {@code source:<system>}, {@code organizational}, {@code department},
     *             {@code leadership}, {@code managers} or {@code contributors}
     * @throws IllegalArgumentException for an unknown view name
     */
    public View materializeView(String name) {
        return viewMaterializer.materialize(current.get().index(), name);
    }

    public List<CrossReference> listCrossReferences() {
        return current.get().resolution().crossReferences();
    }

    /**
     * Cross references of the current snapshot with confidence at least {@code minConfidence}.
     *
     * @throws IllegalArgumentException when minConfidence is outside [0, 1]
     */
    public List<CrossReference> listCrossReferences(double minConfidence) {
        return current.get().resolution().withMinConfidence(minConfidence);
    }

    public FederationSnapshot currentSnapshot() {
        return current.get();
    }

    public ResolverDiagnostics resolverDiagnostics() {
        return current.get().resolution().diagnostics();
    }

    // ========== Cycle API ==========

    /**
     * Runs a cycle with the configured timeout and waits for its outcome.
     */
    public CycleReport runCycle() {
        return runCycle(options.getCycleTimeout());
    }

    public CycleReport runCycle(Duration timeout) {
        return startCycle(timeout).await();
    }

    /**
     * Starts a cycle in the background, cancelling the one still running.
     *
     * @param timeout wall-clock budget; on expiry the cycle aborts without publishing
     */
    public CycleHandle startCycle(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (closed.get()) {
            throw new IllegalStateException("HierarchyFederation is closed");
        }

        long version = versions.incrementAndGet();
        CycleToken token = new CycleToken(LogContext.generateCycleId());
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();
        PendingReport report = new PendingReport();
        IngestionCycle cycle = new IngestionCycle(version, sources, normalizer, resolver,
                blockingKeyStrategy, clock, metricsService);

        Runnable onAbort = () -> {
            CycleAbortedException cause = token.abortCause();
            if (cause != null) {
                finish(report, CycleReport.notPublished(token.cycleId(), cause.outcome(), version, startedAt,
                        elapsed(startNanos), cycle.sourceReports(), cause.getMessage()));
            }
        };
        CycleHandle handle = new CycleHandle(token, report.future, onAbort);

        CycleHandle previous = running.getAndSet(handle);
        if (previous != null && previous.cancel()) {
            log.info("cycle.superseded cycleId={} by={}", previous.cycleId(), token.cycleId());
        }

        ScheduledFuture<?> deadline = timer.schedule(() -> {
            if (token.expire()) {
                log.warn("cycle.timeout cycleId={} timeoutMs={}", token.cycleId(), timeout.toMillis());
                onAbort.run();
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);

        cycleExecutor.execute(() -> {
            try {
                execute(cycle, token, version, startedAt, startNanos, report);
            } finally {
                deadline.cancel(false);
                running.compareAndSet(handle, null);
            }
        });
        return handle;
    }

    /**
     * The most recent cycle reports, oldest first.
     */
    public List<CycleReport> recentCycles() {
        return diagnosticsLog.findAll();
    }

    private void execute(IngestionCycle cycle, CycleToken token, long version, Instant startedAt,
                         long startNanos, PendingReport report) {
        try (LogContext ctx = LogContext.forCycle(token.cycleId())) {
            log.info("cycle.started version={} sources={}", version, sources.keySet());
            try {
                IngestionCycle.Output output = cycle.run(token);
                if (!output.hasUsableSource()) {
                    log.error("cycle.failed version={} reason=no source accepted", version);
                    finish(report, CycleReport.notPublished(token.cycleId(), CycleOutcome.FAILED, version,
                            startedAt, elapsed(startNanos), output.sources(), "Every source was rejected"));
                    return;
                }
                if (!token.beginCommit()) {
                    throw token.abortCause();
                }
                publish(new FederationSnapshot(output.index(), output.resolution(), token.cycleId(), clock.instant()));
                finish(report, new CycleReport(token.cycleId(), CycleOutcome.PUBLISHED, version, startedAt,
                        elapsed(startNanos), output.sources(), output.resolution().diagnostics(),
                        output.resolution().crossReferences().size(), null));
            } catch (CycleAbortedException e) {
                log.info("cycle.aborted version={} outcome={}", version, e.outcome());
                finish(report, CycleReport.notPublished(token.cycleId(), e.outcome(), version, startedAt,
                        elapsed(startNanos), cycle.sourceReports(), e.getMessage()));
            } catch (RuntimeException e) {
                log.error("cycle.failed version={} error={}", version, e.getMessage(), e);
                finish(report, CycleReport.notPublished(token.cycleId(), CycleOutcome.FAILED, version, startedAt,
                        elapsed(startNanos), cycle.sourceReports(), e.getClass().getSimpleName() + ": " + e.getMessage()));
            }
        }
    }

    private void publish(FederationSnapshot snapshot) {
        FederationSnapshot published = current.accumulateAndGet(snapshot,
                (previous, next) -> next.version() > previous.version() ? next : previous);
        if (published != snapshot) {
            log.warn("cycle.publish.skipped version={} newer={}", snapshot.version(), published.version());
            return;
        }
        viewCache.retainVersion(snapshot.version());
        metricsService.recordCrossReferences(snapshot.resolution().crossReferences().size());
        log.info("cycle.published version={} records={} crossReferences={} likely={}",
                snapshot.version(), snapshot.index().size(),
                snapshot.resolution().crossReferences().size(), snapshot.resolution().likelyCount());
    }

    /**
     * Completes the report once; the first of the cycle, a cancel or the timer wins.
     * Metrics and listeners see the report before anyone waiting on the handle does.
     */
    private void finish(PendingReport pending, CycleReport report) {
        if (!pending.claimed.compareAndSet(false, true)) {
            return;
        }
        try {
            metricsService.recordCycleDuration(report.outcome(), report.duration());
            for (DiagnosticsListener listener : listeners) {
                try {
                    listener.onCycleCompleted(report);
                } catch (RuntimeException e) {
                    log.warn("Diagnostics listener {} failed for cycle {}", listener, report.cycleId(), e);
                }
            }
        } finally {
            pending.future.complete(report);
        }
    }

    private static final class PendingReport {
        private final CompletableFuture<CycleReport> future = new CompletableFuture<>();
        private final AtomicBoolean claimed = new AtomicBoolean();
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    // ========== Health & Diagnostics ==========

    /**
     * Aggregate health of all registered checks, including the cycle check.
     */
    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    public InMemoryDiagnosticsLog getDiagnosticsLog() {
        return diagnosticsLog;
    }

    public CacheStats viewCacheStats() {
        return viewCache.getStats();
    }

    public FederationOptions getOptions() {
        return options;
    }

    public Set<String> sourceSystems() {
        return sources.keySet();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        CycleHandle handle = running.getAndSet(null);
        if (handle != null && handle.cancel()) {
            log.info("cycle.cancelled cycleId={} reason=close", handle.cycleId());
        }
        shutdown(cycleExecutor);
        shutdown(resolverWorkers);
        shutdown(timer);
        viewCache.invalidateAll();
        log.info("HierarchyFederation closed");
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private FederationOptions options = FederationOptions.defaults();
        private final Map<String, SourceAdapter> sources = new LinkedHashMap<>();
        private MetricsService metricsService;
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private ViewCache viewCache;
        private BlockingKeyStrategy blockingKeyStrategy;
        private final List<DiagnosticsListener> listeners = new ArrayList<>();
        private final List<HealthCheck> healthChecks = new ArrayList<>();
        private int diagnosticsCapacity = InMemoryDiagnosticsLog.DEFAULT_CAPACITY;
        private Clock clock = Clock.systemUTC();

        public Builder options(FederationOptions options) {
            this.options = Objects.requireNonNull(options, "options");
            return this;
        }

        /**
         * Registers the adapter of one source system. Sources are pulled in registration order.
         */
        public Builder source(String sourceSystem, SourceAdapter adapter) {
            if (sourceSystem == null || sourceSystem.isBlank()) {
                throw new IllegalArgumentException("sourceSystem is required");
            }
            if (sources.putIfAbsent(sourceSystem, Objects.requireNonNull(adapter, "adapter")) != null) {
                throw new IllegalArgumentException("Source '" + sourceSystem + "' is already registered");
            }
            return this;
        }

        /**
         * Sets a metrics service. Defaults to {@link NoOpMetricsService}.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = Objects.requireNonNull(cacheConfig, "cacheConfig");
            return this;
        }

        /**
         * Sets a custom view cache; takes precedence over {@link #cacheConfig(CacheConfig)}.
         */
        public Builder viewCache(ViewCache viewCache) {
            this.viewCache = viewCache;
            return this;
        }

        /**
         * Sets a custom blocking key strategy. Defaults to {@link DefaultBlockingKeyStrategy}.
         */
        public Builder blockingKeyStrategy(BlockingKeyStrategy blockingKeyStrategy) {
            this.blockingKeyStrategy = blockingKeyStrategy;
            return this;
        }

        public Builder diagnosticsListener(DiagnosticsListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        public Builder diagnosticsCapacity(int diagnosticsCapacity) {
            this.diagnosticsCapacity = diagnosticsCapacity;
            return this;
        }

        public Builder healthCheck(HealthCheck healthCheck) {
            this.healthChecks.add(Objects.requireNonNull(healthCheck, "healthCheck"));
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public HierarchyFederation build() {
            return new HierarchyFederation(this);
        }
    }
}
