package com.hierarchy.federation.health;

import com.hierarchy.federation.cycle.CycleOutcome;
import com.hierarchy.federation.cycle.CycleReport;
import com.hierarchy.federation.cycle.SourceReport;
import com.hierarchy.federation.diagnostics.InMemoryDiagnosticsLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Health Check Tests")
class HealthCheckTest {

    @Nested
    @DisplayName("HealthStatus")
    class HealthStatusTests {

        @Test
        @DisplayName("Factory methods set the status")
        void factories() {
            assertTrue(HealthStatus.up().isUp());
            assertTrue(HealthStatus.down("gone").isDown());
            assertTrue(HealthStatus.degraded("slow").isDegraded());
        }

        @Test
        @DisplayName("withDetail returns a new status")
        void withDetail() {
            HealthStatus base = HealthStatus.up();
            HealthStatus detailed = base.withDetail("k", 1);

            assertTrue(base.details().isEmpty());
            assertEquals(Map.of("k", 1), detailed.details());
            assertThrows(UnsupportedOperationException.class, () -> detailed.details().put("x", 2));
        }

        @Test
        @DisplayName("Severity orders UP below DEGRADED below DOWN")
        void severity() {
            assertTrue(HealthStatus.down("x").isWorseThan(HealthStatus.degraded("y")));
            assertTrue(HealthStatus.degraded("y").isWorseThan(HealthStatus.up()));
            assertFalse(HealthStatus.up().isWorseThan(HealthStatus.up("fine")));
        }

        @Test
        @DisplayName("A timed out first cycle is down and carries the failure")
        void ofCycleNeverPublished() {
            CycleReport report = CycleReport.notPublished("c-1", CycleOutcome.TIMED_OUT, 1L, Instant.EPOCH,
                    Duration.ofSeconds(300), List.of(), "Cycle exceeded 300000ms");

            HealthStatus status = HealthStatus.ofCycle(report, 0L);

            assertTrue(status.isDown());
            assertEquals("TIMED_OUT", status.details().get("lastOutcome"));
            assertEquals(300_000L, status.details().get("lastDurationMs"));
            assertEquals("Cycle exceeded 300000ms", status.details().get("failure"));
        }

        @Test
        @DisplayName("A failed cycle over an older snapshot is degraded")
        void ofCycleServingOlder() {
            CycleReport report = CycleReport.notPublished("c-4", CycleOutcome.FAILED, 4L, Instant.EPOCH,
                    Duration.ofMillis(5), List.of(), "Every source was rejected");

            HealthStatus status = HealthStatus.ofCycle(report, 3L);

            assertTrue(status.isDegraded());
            assertTrue(status.message().contains("serving version 3"));
        }
    }

    @Nested
    @DisplayName("HealthCheckRegistry")
    class RegistryTests {

        @Test
        @DisplayName("An empty registry is up")
        void empty() {
            assertTrue(new HealthCheckRegistry().checkAll().isUp());
        }

        @Test
        @DisplayName("The worst status wins and every result is kept")
        void worstWins() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(check("a", HealthStatus.up()));
            registry.register(check("b", HealthStatus.degraded("lagging")));
            registry.register(check("c", HealthStatus.down("broken")));
            registry.register(null);

            HealthStatus status = registry.checkAll();

            assertTrue(status.isDown());
            assertEquals("c: broken", status.message());
            assertEquals(3, registry.size());
            assertEquals(List.of("a", "b", "c"), List.copyOf(status.details().keySet()));
        }

        private HealthCheck check(String name, HealthStatus status) {
            return new HealthCheck() {
                @Override
                public String getName() {
                    return name;
                }

                @Override
                public HealthStatus check() {
                    return status;
                }
            };
        }
    }

    @Nested
    @DisplayName("CycleHealthCheck")
    class CycleHealthTests {

        private final AtomicLong version = new AtomicLong();
        private InMemoryDiagnosticsLog log;
        private CycleHealthCheck check;

        @BeforeEach
        void setUp() {
            log = new InMemoryDiagnosticsLog();
            check = new CycleHealthCheck(version::get, log);
        }

        private CycleReport published(List<SourceReport> sources) {
            return new CycleReport("c-ok", CycleOutcome.PUBLISHED, 1L, Instant.EPOCH, Duration.ofMillis(20),
                    sources, null, 2, null);
        }

        private CycleReport notPublished(CycleOutcome outcome) {
            return CycleReport.notPublished("c-bad", outcome, 2L, Instant.EPOCH, Duration.ofSeconds(1),
                    List.of(), "went wrong");
        }

        @Test
        @DisplayName("Up before any cycle")
        void noCycles() {
            HealthStatus status = check.check();
            assertTrue(status.isUp());
            assertEquals("cycles", check.getName());
        }

        @Test
        @DisplayName("Up after a clean publish")
        void cleanPublish() {
            version.set(1L);
            log.onCycleCompleted(published(List.of(
                    new SourceReport("ladder", SourceReport.Status.ACCEPTED, 3, 3, 0, List.of(), null))));

            HealthStatus status = check.check();

            assertTrue(status.isUp());
            assertEquals(1L, status.details().get("publishedVersion"));
            assertEquals("PUBLISHED", status.details().get("lastOutcome"));
        }

        @Test
        @DisplayName("Degraded after a partial publish")
        void partialPublish() {
            version.set(1L);
            log.onCycleCompleted(published(List.of(
                    new SourceReport("ladder", SourceReport.Status.PARTIAL, 3, 2, 1, List.of("bad level"), null))));

            HealthStatus status = check.check();

            assertTrue(status.isDegraded());
            assertEquals(1, status.details().get("rejectedRecords"));
        }

        @Test
        @DisplayName("Down when nothing was ever published")
        void neverPublished() {
            log.onCycleCompleted(notPublished(CycleOutcome.FAILED));

            HealthStatus status = check.check();

            assertTrue(status.isDown());
            assertEquals("went wrong", status.details().get("failure"));
        }

        @Test
        @DisplayName("Degraded while serving an older snapshot")
        void servingOlderSnapshot() {
            version.set(1L);
            log.onCycleCompleted(notPublished(CycleOutcome.TIMED_OUT));

            assertTrue(check.check().isDegraded());
        }

        @Test
        @DisplayName("Cancelled cycles are ignored")
        void cancelledIgnored() {
            version.set(1L);
            log.onCycleCompleted(published(List.of()));
            log.onCycleCompleted(notPublished(CycleOutcome.CANCELLED));

            assertTrue(check.check().isUp());
        }
    }
}
