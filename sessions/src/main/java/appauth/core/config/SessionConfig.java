package appauth.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the session store.
 *
 * <p>Configuration prefix: {@code appauth.session}
 *
 * <p>Example configuration:
 * <pre>{@code
 * appauth.session.key-prefix=appauth
 * appauth.session.max-sessions-per-user=5
 * appauth.session.sliding.enabled=true
 * appauth.session.sliding.window=PT1H
 * appauth.session.absolute-lifetime=P7D
 * appauth.session.min-ttl=PT60S
 * }</pre>
 */
@ConfigMapping(prefix = "appauth.session")
public interface SessionConfig {

    /**
     * Namespace for every key written by this service.
     *
     * @return Key prefix (default: appauth)
     */
    @WithDefault("appauth")
    String keyPrefix();

    /**
     * Maximum concurrent sessions per user.
     *
     * <p>When a new session pushes a user over the limit, the oldest sessions
     * are evicted. Zero disables the limit.
     *
     * @return Max sessions (default: 5)
     */
    @WithDefault("5")
    int maxSessionsPerUser();

    /**
     * Maximum number of summaries returned when listing a user's sessions.
     *
     * @return List limit (default: 20)
     */
    @WithDefault("20")
    int listLimit();

    /**
     * Initial session lifetime when sliding expiration is disabled.
     *
     * @return Default TTL (default: 1 hour)
     */
    @WithDefault("PT1H")
    Duration defaultTtl();

    /**
     * Hard cap on a session's lifetime measured from issue time.
     *
     * <p>Renewal never extends a session past {@code issuedAt + absoluteLifetime}.
     * When not set, sessions can be renewed indefinitely.
     *
     * @return Absolute lifetime (optional)
     */
    Optional<Duration> absoluteLifetime();

    /**
     * Floor for the cache-native TTL written with each record.
     *
     * @return Minimum TTL (default: 60 seconds)
     */
    @WithDefault("PT60S")
    Duration minTtl();

    /**
     * Sliding expiration configuration.
     */
    SlidingConfig sliding();

    /**
     * ID generation configuration.
     */
    IdGenerationConfig idGeneration();

    /**
     * Storage configuration.
     */
    StorageConfig storage();

    /**
     * Sliding expiration options.
     */
    interface SlidingConfig {

        /**
         * Enable sliding expiration.
         *
         * @return true if sessions are renewed on activity (default: true)
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * Window added to "now" on each renewal.
         *
         * @return Sliding window (default: 1 hour)
         */
        @WithDefault("PT1H")
        Duration window();
    }

    /**
     * Session ID generation configuration.
     */
    interface IdGenerationConfig {

        /**
         * Maximum retries for session ID collision.
         *
         * @return Max retry attempts (default: 3)
         */
        @WithDefault("3")
        int maxRetries();
    }

    /**
     * Storage configuration options.
     */
    interface StorageConfig {

        /**
         * Backend provider name.
         *
         * <p>Available providers: redis, memory, or custom SPI name.
         *
         * @return Provider name (default: redis)
         */
        @WithDefault("redis")
        String provider();
    }
}
