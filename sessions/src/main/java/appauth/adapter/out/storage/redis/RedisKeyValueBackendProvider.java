package appauth.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import appauth.core.config.ResiliencyConfig;
import appauth.core.config.SessionConfig;
import appauth.core.port.out.KeyValueBackend;
import appauth.core.port.out.Metrics;
import appauth.spi.KeyValueBackendProvider;

/**
 * Redis-based backend provider.
 *
 * <p>This is the recommended provider for production deployments.
 */
@ApplicationScoped
public class RedisKeyValueBackendProvider implements KeyValueBackendProvider {

    private static final Logger LOG = Logger.getLogger(RedisKeyValueBackendProvider.class);
    private static final int PRIORITY = 100;
    private static final Duration STARTUP_PROBE_TIMEOUT = Duration.ofSeconds(5);

    private final ReactiveRedisDataSource redisDataSource;
    private final SessionConfig sessionConfig;
    private final RedisTimeoutHelper timeoutHelper;

    private volatile RedisKeyValueBackend backend;
    private final AtomicBoolean available = new AtomicBoolean(false);
    private final CountDownLatch checkLatch = new CountDownLatch(1);

    @Inject
    public RedisKeyValueBackendProvider(
            ReactiveRedisDataSource redisDataSource,
            SessionConfig sessionConfig,
            ResiliencyConfig resiliencyConfig,
            Metrics metrics) {
        this.redisDataSource = redisDataSource;
        this.sessionConfig = sessionConfig;
        this.timeoutHelper = new RedisTimeoutHelper(resiliencyConfig.redis().operationTimeout(), metrics);
    }

    @PostConstruct
    void checkAvailability() {
        redisDataSource
                .key(String.class)
                .exists(sessionConfig.keyPrefix() + ":probe")
                .ifNoItem()
                .after(STARTUP_PROBE_TIMEOUT)
                .fail()
                .subscribe()
                .with(
                        result -> {
                            available.set(true);
                            checkLatch.countDown();
                            LOG.info("Redis backend is available");
                        },
                        error -> {
                            available.set(false);
                            checkLatch.countDown();
                            LOG.warnf("Redis backend is not available: %s", error.getMessage());
                        });
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        try {
            if (!checkLatch.await(STARTUP_PROBE_TIMEOUT.toSeconds() + 1, TimeUnit.SECONDS)) {
                LOG.warn("Redis availability check timed out");
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return available.get();
    }

    @Override
    public KeyValueBackend createBackend() {
        if (backend == null) {
            synchronized (this) {
                if (backend == null) {
                    backend = new RedisKeyValueBackend(redisDataSource, timeoutHelper);
                    LOG.infof("Created Redis backend with key prefix: %s", sessionConfig.keyPrefix());
                }
            }
        }
        return backend;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        boolean reachable = timeoutHelper
                .withTimeoutFallback(
                        redisDataSource.execute("PING").map(response -> response != null), "ping", () -> false)
                .await()
                .indefinitely();
        available.set(reachable);

        var builder = HealthCheckResponse.named("session-backend-redis")
                .withData("type", "redis")
                .withData("keyPrefix", sessionConfig.keyPrefix());
        if (reachable) {
            return Optional.of(builder.up().build());
        }
        return Optional.of(builder.down().withData("error", "Redis did not answer PING").build());
    }
}
