package com.hierarchy.federation.health;

import com.hierarchy.federation.cycle.CycleReport;
import com.hierarchy.federation.diagnostics.InMemoryDiagnosticsLog;

import java.util.Objects;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Health of the ingestion cycles, judged from the latest conclusive cycle.
 *
 * <ul>
 *   <li>DOWN: the latest cycle did not publish and nothing was ever published</li>
 *   <li>DEGRADED: the latest cycle did not publish, or published with rejected sources or records</li>
 *   <li>UP otherwise, including before the first cycle</li>
 * </ul>
 * Cancelled cycles were superseded and do not count.
 */
public class CycleHealthCheck implements HealthCheck {

    private final LongSupplier publishedVersion;
    private final InMemoryDiagnosticsLog diagnosticsLog;

    /**
     * @param publishedVersion version of the currently published index, 0 before the first publish
     */
    public CycleHealthCheck(LongSupplier publishedVersion, InMemoryDiagnosticsLog diagnosticsLog) {
        this.publishedVersion = Objects.requireNonNull(publishedVersion, "publishedVersion");
        this.diagnosticsLog = Objects.requireNonNull(diagnosticsLog, "diagnosticsLog");
    }

    @Override
    public String getName() {
        return "cycles";
    }

    @Override
    public HealthStatus check() {
        long version = publishedVersion.getAsLong();
        Optional<CycleReport> latest = diagnosticsLog.latestConclusive();
        if (latest.isEmpty()) {
            return HealthStatus.up("No cycle has completed yet").withDetail("publishedVersion", version);
        }
        return HealthStatus.ofCycle(latest.get(), version);
    }
}
