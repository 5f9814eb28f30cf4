package appauth.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the consistency sweep.
 *
 * <p>Configuration prefix: {@code appauth.cleanup}
 *
 * <p>Example configuration:
 * <pre>{@code
 * appauth.cleanup.enabled=true
 * appauth.cleanup.every=1h
 * appauth.cleanup.include-expired=false
 * appauth.cleanup.max-age=P30D
 * }</pre>
 */
@ConfigMapping(prefix = "appauth.cleanup")
public interface CleanupConfig {

    /**
     * Run the scheduled sweep.
     *
     * @return true if the scheduled sweep runs (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Interval of the scheduled sweep, in Quarkus scheduler syntax.
     *
     * @return Interval (default: 1h)
     */
    @WithDefault("1h")
    String every();

    /**
     * Delay before the first scheduled sweep after startup.
     *
     * @return Initial delay (default: 5m)
     */
    @WithDefault("5m")
    String initialDelay();

    /**
     * Also delete live sessions older than {@link #maxAge()}.
     *
     * <p>This forces logout of long-lived sessions and is therefore off by default.
     *
     * @return true to include expired-session repair (default: false)
     */
    @WithDefault("false")
    boolean includeExpired();

    /**
     * Age after which a live session is considered expired by the sweep.
     *
     * @return Max age (default: 30 days)
     */
    @WithDefault("P30D")
    Duration maxAge();

    /**
     * Page size hint for the key scan.
     *
     * @return Scan count (default: 500)
     */
    @WithDefault("500")
    int pageSize();
}
