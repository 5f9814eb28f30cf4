package appauth.core.service.state;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import appauth.core.config.HandshakeStateConfig;
import appauth.core.config.SessionConfig;
import appauth.core.model.state.HandshakeState;
import appauth.core.model.storage.StorageKeys;
import appauth.core.port.in.HandshakeStateManagement;
import appauth.core.service.session.KeyValueBackendRegistry;

/**
 * Service for single-use OAuth handshake state.
 *
 * <p>The redirect target and the PKCE verifier are stored together under one key,
 * so that one atomic get-and-delete is enough to consume both. Two callbacks
 * racing on the same state token can never both succeed.
 */
@ApplicationScoped
public class HandshakeStateService implements HandshakeStateManagement {

    private static final Logger LOG = Logger.getLogger(HandshakeStateService.class);

    private final KeyValueBackendRegistry backendRegistry;
    private final HandshakeStateConfig config;
    private final Clock clock;
    private final StorageKeys keys;
    private final HandshakeStateCodec codec = new HandshakeStateCodec();

    @Inject
    public HandshakeStateService(
            KeyValueBackendRegistry backendRegistry,
            HandshakeStateConfig config,
            SessionConfig sessionConfig,
            Clock clock) {
        this.backendRegistry = backendRegistry;
        this.config = config;
        this.clock = clock;
        this.keys = new StorageKeys(sessionConfig.keyPrefix());
    }

    @Override
    public Uni<HandshakeState> save(String stateToken, String redirectUri, String verifier, String provider) {
        if (stateToken == null || stateToken.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("stateToken must not be null or blank"));
        }
        if (verifier == null || verifier.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("verifier must not be null or blank"));
        }

        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        HandshakeState state =
                new HandshakeState(stateToken, redirectUri, verifier, provider, now, now.plus(config.ttl()));

        LOG.debugf("Saving handshake state for provider %s, redirect %s", provider, redirectUri);
        return backendRegistry
                .getBackend()
                .setWithTtl(keys.state(stateToken), codec.encode(state), config.ttl())
                .replaceWith(state);
    }

    @Override
    public Uni<Optional<HandshakeState>> popState(String stateToken) {
        if (stateToken == null || stateToken.isBlank()) {
            return Uni.createFrom().item(Optional.empty());
        }

        return backendRegistry.getBackend().getAndDelete(keys.state(stateToken)).map(raw -> {
            if (raw.isEmpty()) {
                LOG.debugf("No handshake state found for token %s", abbreviate(stateToken));
                return Optional.<HandshakeState>empty();
            }

            HandshakeState state;
            try {
                state = codec.decode(stateToken, raw.get());
            } catch (IllegalArgumentException e) {
                LOG.warnf("Discarding unreadable handshake state: %s", e.getMessage());
                return Optional.<HandshakeState>empty();
            }

            if (state.isExpired(clock.instant())) {
                LOG.debugf("Handshake state for token %s expired at %s", abbreviate(stateToken), state.expiresAt());
                return Optional.<HandshakeState>empty();
            }
            return Optional.of(state);
        });
    }

    @Override
    public Uni<HandshakeState> consume(String stateToken) {
        return popState(stateToken).flatMap(state -> {
            if (state.isEmpty()) {
                return Uni.createFrom()
                        .failure(new StateExpiredOrUsedException("Handshake state is unknown, expired or already used"));
            }
            return Uni.createFrom().item(state.get());
        });
    }

    private static String abbreviate(String token) {
        return token.length() <= 8 ? token : token.substring(0, 8) + "...";
    }
}
