package appauth.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for backend timeouts.
 *
 * <p>Configuration prefix: {@code appauth.resiliency}
 */
@ConfigMapping(prefix = "appauth.resiliency")
public interface ResiliencyConfig {

    /**
     * Redis timeout configuration.
     */
    RedisConfig redis();

    /**
     * Redis timeout settings.
     */
    interface RedisConfig {

        /**
         * Maximum time to wait for a Redis operation to complete.
         *
         * <p>On timeout the operation fails with
         * {@link appauth.core.port.out.BackendUnavailableException}; nothing is retried
         * inside the same call.
         *
         * @return Operation timeout duration (default: 1 second)
         */
        @WithDefault("PT1S")
        Duration operationTimeout();
    }
}
