package appauth.core.service.state;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import appauth.core.model.state.HandshakeState;

/**
 * JSON form of handshake state. Timestamps are whole epoch seconds.
 */
class HandshakeStateCodec {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    String encode(HandshakeState state) {
        StoredState stored = new StoredState(
                state.redirectUri(),
                state.verifier(),
                state.provider(),
                state.createdAt().getEpochSecond(),
                state.expiresAt().getEpochSecond());
        try {
            return OBJECT_MAPPER.writeValueAsString(stored);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize handshake state", e);
        }
    }

    HandshakeState decode(String stateToken, String json) {
        StoredState stored;
        try {
            stored = OBJECT_MAPPER.readValue(json, StoredState.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed handshake state: " + e.getOriginalMessage(), e);
        }
        if (stored.verifier() == null || stored.expiresAt() == null) {
            throw new IllegalArgumentException("Handshake state is missing code_verifier or exp");
        }
        long createdAt = stored.createdAt() != null ? stored.createdAt() : stored.expiresAt();
        return new HandshakeState(
                stateToken,
                stored.redirectUri(),
                stored.verifier(),
                stored.provider(),
                Instant.ofEpochSecond(createdAt),
                Instant.ofEpochSecond(stored.expiresAt()));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StoredState(
            @JsonProperty("redirect_uri") String redirectUri,
            @JsonProperty("code_verifier") String verifier,
            @JsonProperty("provider") String provider,
            @JsonProperty("ts") Long createdAt,
            @JsonProperty("exp") Long expiresAt) {}
}
