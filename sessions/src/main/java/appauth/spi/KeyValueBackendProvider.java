package appauth.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

import appauth.core.port.out.KeyValueBackend;

/**
 * SPI for key-value backends that hold sessions, user indices and handshake state.
 *
 * <p>Platform teams can implement this interface to plug in another store, as long
 * as it honours the {@link KeyValueBackend} contract (atomic pop, atomic guarded
 * index removal, paginated scan).
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>redis (priority: 100) - Redis-based storage</li>
 *   <li>memory (priority: 0) - In-memory storage (development and tests only)</li>
 * </ul>
 *
 * <p>Provider selection order:
 * <ol>
 *   <li>Configured provider (appauth.session.storage.provider)</li>
 *   <li>Highest priority available provider</li>
 *   <li>Memory fallback (always available)</li>
 * </ol>
 */
public interface KeyValueBackendProvider {

    /**
     * Return the provider name for configuration selection.
     *
     * @return Provider name (e.g., "redis", "memory")
     */
    String name();

    /**
     * Return the provider priority for automatic selection.
     *
     * @return Priority value (higher = more preferred)
     */
    int priority();

    /**
     * Check if this provider is available and ready to use.
     *
     * @return true if the provider can be used
     */
    boolean isAvailable();

    /**
     * Create the backend implementation. Implementations should return the same
     * instance on repeated calls.
     *
     * @return Backend instance
     */
    KeyValueBackend createBackend();

    /**
     * Report the health of this backend.
     *
     * @return Health check response, or empty if not supported
     */
    Optional<HealthCheckResponse> healthCheck();
}
