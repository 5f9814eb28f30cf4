package appauth.core.port.in;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import appauth.core.model.state.HandshakeState;

/**
 * Inbound port for short-lived, single-use OAuth handshake state.
 */
public interface HandshakeStateManagement {

    /**
     * Save handshake state under a state token with the configured short TTL.
     *
     * @param stateToken OAuth state parameter
     * @param redirectUri post-login redirect target
     * @param verifier PKCE code verifier
     * @param provider identity provider tag
     * @return the saved entry; fails with {@link IllegalArgumentException} for a blank
     *     token or verifier
     */
    Uni<HandshakeState> save(String stateToken, String redirectUri, String verifier, String provider);

    /**
     * Atomically read and remove handshake state.
     *
     * <p>A second call with the same token returns empty, regardless of concurrent
     * callers. Expired, already-used and never-issued tokens all return empty; callers
     * must treat empty as an authentication failure and never retry.
     *
     * @param stateToken OAuth state parameter
     * @return the entry if it was present and unexpired
     */
    Uni<Optional<HandshakeState>> popState(String stateToken);

    /**
     * Like {@link #popState(String)}, but fails with {@link StateExpiredOrUsedException}
     * when no usable entry exists.
     *
     * @param stateToken OAuth state parameter
     * @return the consumed entry
     */
    Uni<HandshakeState> consume(String stateToken);

    /**
     * The handshake token is unknown, expired or already consumed.
     *
     * <p>The backend cannot tell these cases apart, so they share one exception.
     */
    class StateExpiredOrUsedException extends RuntimeException {
        public StateExpiredOrUsedException(String message) {
            super(message);
        }
    }
}
