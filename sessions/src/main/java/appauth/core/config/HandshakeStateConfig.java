package appauth.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for OAuth handshake state.
 *
 * <p>Configuration prefix: {@code appauth.state}
 */
@ConfigMapping(prefix = "appauth.state")
public interface HandshakeStateConfig {

    /**
     * How long a handshake state entry remains valid after the authorization
     * request is initiated.
     *
     * @return State TTL (default: 10 minutes)
     */
    @WithDefault("PT10M")
    Duration ttl();
}
