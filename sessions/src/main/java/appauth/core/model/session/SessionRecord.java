package appauth.core.model.session;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Server-side record of an authenticated session.
 *
 * <p>Records are owned by the session store and are only mutated through
 * renewal or deletion. The {@code attributes} map is an opaque payload
 * (user claims, user agent, provider, ...) that the store never inspects.
 *
 * @param id opaque, high-entropy session identifier
 * @param userId owning user identifier (the index the record is listed under)
 * @param attributes opaque payload
 * @param issuedAt when the session was created; the absolute lifetime counts from here
 * @param expiresAt current logical expiry
 * @param lastRenewedAt last time the expiry was pushed forward (equals issuedAt until renewed)
 */
public record SessionRecord(
        String id,
        String userId,
        Map<String, Object> attributes,
        Instant issuedAt,
        Instant expiresAt,
        Instant lastRenewedAt) {

    public SessionRecord {
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * Creates a copy with a new expiry, stamped as renewed at {@code renewedAt}.
     */
    public SessionRecord renewed(Instant newExpiresAt, Instant renewedAt) {
        return new SessionRecord(id, userId, attributes, issuedAt, newExpiresAt, renewedAt);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    /**
     * Time left until {@link #expiresAt()}, never negative.
     */
    public Duration remaining(Instant now) {
        if (expiresAt == null || !now.isBefore(expiresAt)) {
            return Duration.ZERO;
        }
        return Duration.between(now, expiresAt);
    }

    public boolean isOwnedBy(String candidateUserId) {
        return userId != null && userId.equals(candidateUserId);
    }
}
