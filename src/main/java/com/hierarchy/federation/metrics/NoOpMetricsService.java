package com.hierarchy.federation.metrics;

import com.hierarchy.federation.cycle.CycleOutcome;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordCycleDuration(CycleOutcome outcome, Duration duration) {
    }

    @Override
    public void recordRecordsIngested(String sourceSystem, int count) {
    }

    @Override
    public void recordRecordsRejected(String sourceSystem, int count) {
    }

    @Override
    public void incrementBatchRejected(String sourceSystem) {
    }

    @Override
    public void recordCrossReferences(int count) {
    }

    @Override
    public void recordViewCacheHit() {
    }

    @Override
    public void recordViewCacheMiss() {
    }
}
