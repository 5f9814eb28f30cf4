package appauth.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import appauth.config.TelemetryConfig;
import appauth.core.model.cleanup.SweepReport;
import appauth.core.port.out.Metrics;

/**
 * Records session store metrics using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code appauth.backend.timeouts.total} - Backend operations that timed out, by backend and operation</li>
 *   <li>{@code appauth.backend.failures.total} - Backend operations that failed otherwise</li>
 *   <li>{@code appauth.sessions.evicted.total} - Sessions evicted to honour the per-user capacity</li>
 *   <li>{@code appauth.sweep.runs.total} - Sweeps by mode and outcome</li>
 *   <li>{@code appauth.sweep.orphans.removed.total} - Orphan references removed by sweeps</li>
 *   <li>{@code appauth.sweep.expired.removed.total} - Sessions deleted by sweeps for exceeding the maximum age</li>
 * </ul>
 */
@ApplicationScoped
public class SessionMetrics implements Metrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public SessionMetrics(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.metrics().enabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordBackendTimeout(String backend, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("appauth.backend.timeouts.total")
                .description("Backend operations that did not complete in time")
                .tag("backend", backend)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void recordBackendFailure(String backend, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("appauth.backend.failures.total")
                .description("Backend operations that failed")
                .tag("backend", backend)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void recordEvictions(int count) {
        if (!enabled || count <= 0) {
            return;
        }

        Counter.builder("appauth.sessions.evicted.total")
                .description("Sessions evicted because their user exceeded the session limit")
                .register(registry)
                .increment(count);
    }

    @Override
    public void recordSweep(SweepReport report) {
        if (!enabled) {
            return;
        }

        String mode = report.mode().name().toLowerCase();

        Counter.builder("appauth.sweep.runs.total")
                .description("Consistency sweeps run")
                .tag("mode", mode)
                .tag("outcome", report.complete() ? "complete" : "aborted")
                .register(registry)
                .increment();

        Counter.builder("appauth.sweep.orphans.removed.total")
                .description("Orphan index references removed by the consistency sweep")
                .tag("mode", mode)
                .register(registry)
                .increment(report.orphansRemoved());

        Counter.builder("appauth.sweep.expired.removed.total")
                .description("Sessions removed by the consistency sweep for exceeding the maximum age")
                .tag("mode", mode)
                .register(registry)
                .increment(report.expiredRemoved());
    }
}
