package appauth.core.model.session;

import java.time.Instant;
import java.util.Map;

/**
 * Listing view of a live session, as returned to "active sessions" screens.
 */
public record SessionSummary(
        String sessionId, Instant createdAt, Instant expiresAt, Instant lastRenewedAt, Map<String, Object> attributes) {

    public static SessionSummary of(SessionRecord record) {
        return new SessionSummary(
                record.id(), record.issuedAt(), record.expiresAt(), record.lastRenewedAt(), record.attributes());
    }
}
