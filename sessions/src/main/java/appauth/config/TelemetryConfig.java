package appauth.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for telemetry.
 *
 * <p>Example configuration:
 * <pre>{@code
 * appauth.telemetry.metrics.enabled=true
 * }</pre>
 */
@ConfigMapping(prefix = "appauth.telemetry")
public interface TelemetryConfig {

    /**
     * Metrics configuration for Micrometer metrics collection.
     */
    MetricsConfig metrics();

    /**
     * Metrics configuration.
     */
    interface MetricsConfig {
        /**
         * Record session store metrics.
         */
        @WithDefault("true")
        boolean enabled();
    }
}
