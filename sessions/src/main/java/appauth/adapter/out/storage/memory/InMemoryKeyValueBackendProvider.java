package appauth.adapter.out.storage.memory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import appauth.core.port.out.KeyValueBackend;
import appauth.spi.KeyValueBackendProvider;

/**
 * In-memory backend provider.
 *
 * <p>This provider is always available and serves as a fallback when Redis is
 * unavailable.
 *
 * <p><strong>Warning:</strong> sessions held in memory are invisible to other
 * instances, and the consistency sweep only sees this instance. Not recommended
 * for production.
 */
@ApplicationScoped
public class InMemoryKeyValueBackendProvider implements KeyValueBackendProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryKeyValueBackendProvider.class);
    private static final int PRIORITY = 0; // Lowest priority - fallback only

    private final Clock clock;
    private final AtomicBoolean warningLogged = new AtomicBoolean(false);
    private volatile InMemoryKeyValueBackend backend;

    @Inject
    public InMemoryKeyValueBackendProvider(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public KeyValueBackend createBackend() {
        if (warningLogged.compareAndSet(false, true)) {
            LOG.warn("========================================================================");
            LOG.warn("  WARNING: Session storage is in-memory only!");
            LOG.warn("  Sessions are lost on restart and not shared between instances.");
            LOG.warn("  Configure Redis or a custom KeyValueBackendProvider for production.");
            LOG.warn("========================================================================");
        }

        if (backend == null) {
            synchronized (this) {
                if (backend == null) {
                    backend = new InMemoryKeyValueBackend(clock);
                }
            }
        }
        return backend;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("session-backend-memory")
                .up()
                .withData("type", "in-memory")
                .withData("keys", backend != null ? backend.size() : 0)
                .build());
    }

    @PreDestroy
    void shutdown() {
        if (backend != null) {
            backend.shutdown();
        }
    }
}
