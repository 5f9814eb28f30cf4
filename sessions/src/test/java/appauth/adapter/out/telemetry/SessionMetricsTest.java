package appauth.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Instant;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import appauth.config.TelemetryConfig;
import appauth.core.model.cleanup.SweepMode;
import appauth.core.model.cleanup.SweepReport;

@DisplayName("SessionMetrics")
class SessionMetricsTest {

    private static final Instant NOW = Instant.parse("2026-04-01T03:00:00Z");

    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
    }

    private SessionMetrics metrics(boolean enabled) {
        var config = mock(TelemetryConfig.class, RETURNS_DEEP_STUBS);
        when(config.metrics().enabled()).thenReturn(enabled);
        return new SessionMetrics(registry, config);
    }

    @Nested
    @DisplayName("when enabled")
    class WhenEnabled {

        @Test
        @DisplayName("should count timeouts and failures per operation")
        void shouldCountBackendProblems() {
            var metrics = metrics(true);

            metrics.recordBackendTimeout("redis", "get");
            metrics.recordBackendTimeout("redis", "get");
            metrics.recordBackendFailure("redis", "scan");

            assertTrue(metrics.isEnabled());
            assertEquals(
                    2.0,
                    registry.get("appauth.backend.timeouts.total")
                            .tag("operation", "get")
                            .counter()
                            .count());
            assertEquals(
                    1.0,
                    registry.get("appauth.backend.failures.total")
                            .tag("backend", "redis")
                            .tag("operation", "scan")
                            .counter()
                            .count());
        }

        @Test
        @DisplayName("should add evictions and ignore zero")
        void shouldCountEvictions() {
            var metrics = metrics(true);

            metrics.recordEvictions(0);
            assertNull(registry.find("appauth.sessions.evicted.total").counter());

            metrics.recordEvictions(3);
            assertEquals(3.0, registry.get("appauth.sessions.evicted.total").counter().count());
        }

        @Test
        @DisplayName("should tag sweeps with mode and outcome")
        void shouldTagSweeps() {
            var metrics = metrics(true);

            metrics.recordSweep(new SweepReport(
                    SweepMode.REPAIR_ORPHANS_AND_EXPIRED, 4, 9, 7, 2, 2, 1, 1, 2, NOW, NOW, false, "after:k"));

            assertEquals(
                    1.0,
                    registry.get("appauth.sweep.runs.total")
                            .tag("mode", "repair_orphans_and_expired")
                            .tag("outcome", "aborted")
                            .counter()
                            .count());
            assertEquals(2.0, registry.get("appauth.sweep.orphans.removed.total").counter().count());
            assertEquals(1.0, registry.get("appauth.sweep.expired.removed.total").counter().count());
        }
    }

    @Test
    @DisplayName("should record nothing when disabled")
    void shouldRecordNothingWhenDisabled() {
        var metrics = metrics(false);

        metrics.recordBackendTimeout("redis", "get");
        metrics.recordEvictions(2);
        metrics.recordSweep(new SweepReport(SweepMode.REPORT, 1, 1, 1, 0, 0, 0, 0, 0, NOW, NOW, true, "0"));

        assertFalse(metrics.isEnabled());
        assertTrue(registry.getMeters().isEmpty());
    }
}
