package com.hierarchy.federation.metrics;

import com.hierarchy.federation.cycle.CycleOutcome;

import java.time.Duration;

/**
 * Interface for recording federation metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordCycleDuration(CycleOutcome outcome, Duration duration);

    void recordRecordsIngested(String sourceSystem, int count);

    void recordRecordsRejected(String sourceSystem, int count);

    void incrementBatchRejected(String sourceSystem);

    void recordCrossReferences(int count);

    void recordViewCacheHit();

    void recordViewCacheMiss();
}
