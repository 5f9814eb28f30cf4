package appauth.core.model.state;

import java.time.Instant;

/**
 * Short-lived state saved between the start and the callback of an OAuth handshake.
 *
 * @param stateToken the OAuth {@code state} parameter, used as the storage key
 * @param redirectUri where to send the user after the callback
 * @param verifier the PKCE code verifier
 * @param provider identity provider tag (e.g. {@code google})
 * @param createdAt when the handshake started
 * @param expiresAt when the entry stops being accepted
 */
public record HandshakeState(
        String stateToken,
        String redirectUri,
        String verifier,
        String provider,
        Instant createdAt,
        Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
