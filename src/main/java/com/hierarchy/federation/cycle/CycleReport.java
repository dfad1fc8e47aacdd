package com.hierarchy.federation.cycle;

import com.hierarchy.federation.resolve.ResolverDiagnostics;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one ingestion and resolution cycle, delivered to diagnostics listeners.
 *
 * @param cycleId         cycle identifier, also present in the log MDC
 * @param outcome         final state
 * @param indexVersion    version of the index the cycle built
 * @param startedAt       when the cycle started
 * @param duration        wall-clock time until the outcome was known
 * @param sources         one report per source that was reached
 * @param resolver        resolver diagnostics, when resolution completed
 * @param crossReferences cross references published, 0 unless published
 * @param failure         reason for a non-published outcome, or null
 */
public record CycleReport(
        String cycleId,
        CycleOutcome outcome,
        long indexVersion,
        Instant startedAt,
        Duration duration,
        List<SourceReport> sources,
        ResolverDiagnostics resolver,
        int crossReferences,
        String failure
) {
    public CycleReport {
        Objects.requireNonNull(cycleId, "cycleId");
        Objects.requireNonNull(outcome, "outcome");
        sources = sources != null ? List.copyOf(sources) : List.of();
    }

    /**
     * Report of a cycle that ended without publishing.
     */
    public static CycleReport notPublished(String cycleId, CycleOutcome outcome, long indexVersion, Instant startedAt,
                                            Duration duration, List<SourceReport> sources, String failure) {
        return new CycleReport(cycleId, outcome, indexVersion, startedAt, duration, sources, null, 0, failure);
    }

    public boolean isPublished() {
        return outcome == CycleOutcome.PUBLISHED;
    }

    /**
     * Published while at least one source was rejected or had invalid records.
     */
    public boolean isPartial() {
        return isPublished() && sources.stream().anyMatch(s -> s.status() != SourceReport.Status.ACCEPTED);
    }

    public Optional<ResolverDiagnostics> resolverDiagnostics() {
        return Optional.ofNullable(resolver);
    }

    public int rejectedRecords() {
        return sources.stream().mapToInt(SourceReport::rejected).sum();
    }
}
