package appauth.core.port.out;

import appauth.core.model.cleanup.SweepReport;

/**
 * Port interface for recording session store metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface Metrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record a backend operation that timed out.
     *
     * @param backend backend name (e.g. {@code redis})
     * @param operation operation name
     */
    void recordBackendTimeout(String backend, String operation);

    /**
     * Record a backend operation that failed for a reason other than a timeout.
     *
     * @param backend backend name
     * @param operation operation name
     */
    void recordBackendFailure(String backend, String operation);

    /**
     * Record sessions evicted to honour the per-user capacity.
     *
     * @param count number of sessions evicted
     */
    void recordEvictions(int count);

    /**
     * Record the outcome of a consistency sweep.
     *
     * @param report the finished (or aborted) sweep report
     */
    void recordSweep(SweepReport report);
}
