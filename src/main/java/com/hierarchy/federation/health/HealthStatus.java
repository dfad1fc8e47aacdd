package com.hierarchy.federation.health;

import com.hierarchy.federation.cycle.CycleReport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Health of one check, or of the whole federation, with detail values for operators.
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    /**
     * Ordered by severity; a later constant is worse.
     */
    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        Objects.requireNonNull(status, "status");
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static HealthStatus up() {
        return up("OK");
    }

    public static HealthStatus up(String message) {
        return new HealthStatus(Status.UP, message, Map.of());
    }

    public static HealthStatus down(String reason) {
        return new HealthStatus(Status.DOWN, reason, Map.of());
    }

    public static HealthStatus degraded(String reason) {
        return new HealthStatus(Status.DEGRADED, reason, Map.of());
    }

    /**
     * Judges a concluded cycle against the version currently served.
     *
     * <p>A cycle that did not publish is DOWN while nothing has ever been
     * published, DEGRADED otherwise. A published cycle is DEGRADED when it
     * left out sources or records.</p>
     *
     * @param publishedVersion version of the served index, 0 before the first publish
     */
    public static HealthStatus ofCycle(CycleReport report, long publishedVersion) {
        Objects.requireNonNull(report, "report");
        HealthStatus status;
        if (!report.isPublished() && publishedVersion == 0) {
            status = down("No snapshot published; last cycle " + report.outcome());
        } else if (!report.isPublished()) {
            status = degraded("Last cycle " + report.outcome() + ", serving version " + publishedVersion);
        } else if (report.isPartial()) {
            status = degraded("Last cycle published with rejected sources or records");
        } else {
            status = up();
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("publishedVersion", publishedVersion);
        details.put("lastCycleId", report.cycleId());
        details.put("lastOutcome", report.outcome().name());
        if (report.duration() != null) {
            details.put("lastDurationMs", report.duration().toMillis());
        }
        details.put("rejectedRecords", report.rejectedRecords());
        if (report.failure() != null) {
            details.put("failure", report.failure());
        }
        return status.withDetails(details);
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> newDetails = new LinkedHashMap<>(this.details);
        newDetails.put(key, value);
        return new HealthStatus(this.status, this.message, newDetails);
    }

    public HealthStatus withDetails(Map<String, ?> extra) {
        Map<String, Object> newDetails = new LinkedHashMap<>(this.details);
        newDetails.putAll(extra);
        return new HealthStatus(this.status, this.message, newDetails);
    }

    public boolean isWorseThan(HealthStatus other) {
        return status.compareTo(other.status) > 0;
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }
}
