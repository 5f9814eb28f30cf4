package appauth.adapter.out.storage.redis;

import java.time.Duration;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import appauth.core.port.out.BackendUnavailableException;
import appauth.core.port.out.Metrics;

/**
 * Helper for applying timeouts and failure handling to Redis operations.
 *
 * <h2>Operation Modes</h2>
 * <ul>
 *   <li>{@link #withTimeout} - Fail-fast: every timeout or failure surfaces as a
 *       {@link BackendUnavailableException}. Used by every storage operation.</li>
 *   <li>{@link #withTimeoutFallback} - Fail-open: returns a fallback on timeout or failure.
 *       Used for connectivity probes.</li>
 * </ul>
 *
 * <p>Nothing is retried here; callers retry whole operations.
 *
 * <h2>Metrics</h2>
 * Records separate metrics for timeouts ({@code appauth.backend.timeouts.total}) and
 * non-timeout failures ({@code appauth.backend.failures.total}).
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);
    private static final String BACKEND = "redis";

    private final Duration timeout;
    private final Metrics metrics;

    /**
     * Create a new timeout helper.
     *
     * @param timeout the timeout duration for Redis operations
     * @param metrics the metrics instance for recording timeouts (may be null)
     */
    public RedisTimeoutHelper(Duration timeout, Metrics metrics) {
        this.timeout = timeout;
        this.metrics = metrics;
    }

    /**
     * Apply timeout to an operation that must fail when Redis does not answer.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @param <T> the result type
     * @return a Uni that fails with {@link RedisTimeoutException} on timeout and with
     *     {@link BackendUnavailableException} on any other failure
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> {
                    LOG.warnv("Redis operation timeout: {0} after {1}", operationName, timeout);
                    recordTimeout(operationName);
                    return new RedisTimeoutException(operationName, timeout);
                })
                .onFailure(error -> !(error instanceof BackendUnavailableException))
                .transform(error -> {
                    LOG.warnv("Redis operation failure: {0}: {1}", operationName, error.getMessage());
                    recordFailure(operationName);
                    return new BackendUnavailableException(
                            operationName, "Redis operation failed: " + operationName, error);
                });
    }

    /**
     * Apply timeout with graceful degradation to custom fallback.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @param fallback supplier for fallback value on timeout or failure
     * @param <T> the result type
     * @return a Uni that returns fallback value on timeout or failure
     */
    public <T> Uni<T> withTimeoutFallback(Uni<T> operation, String operationName, Supplier<T> fallback) {
        return operation
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv("Redis operation timeout (fallback): {0} after {1}", operationName, timeout);
                    recordTimeout(operationName);
                    return fallback.get();
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Redis operation failure (fallback): {0}: {1}", operationName, error.getMessage());
                    recordFailure(operationName);
                    return fallback.get();
                });
    }

    private void recordTimeout(String operationName) {
        if (metrics != null) {
            metrics.recordBackendTimeout(BACKEND, operationName);
        }
    }

    private void recordFailure(String operationName) {
        if (metrics != null) {
            metrics.recordBackendFailure(BACKEND, operationName);
        }
    }

    /**
     * Exception indicating a Redis operation timeout.
     */
    public static class RedisTimeoutException extends BackendUnavailableException {

        public RedisTimeoutException(String operation, Duration timeout) {
            super(operation, "Redis operation timeout: " + operation + " after " + timeout);
        }
    }
}
