package appauth.core.model.session;

import java.util.Optional;

/**
 * Event fired when a session, or all sessions of a user, are invalidated.
 *
 * <p>Capacity evictions travel through this event with reason
 * {@link InvalidationReason#EVICTED}; it is a notification, not a failure.
 *
 * @param sessionId the invalidated session ID (present for single-session events)
 * @param userId the owning user (always present when known)
 * @param reason why the session was invalidated
 */
public record SessionInvalidatedEvent(Optional<String> sessionId, Optional<String> userId, InvalidationReason reason) {

    public static SessionInvalidatedEvent forSession(String sessionId, String userId, InvalidationReason reason) {
        return new SessionInvalidatedEvent(Optional.of(sessionId), Optional.ofNullable(userId), reason);
    }

    public static SessionInvalidatedEvent forUser(String userId) {
        return new SessionInvalidatedEvent(Optional.empty(), Optional.of(userId), InvalidationReason.LOGOUT_ALL);
    }

    /**
     * Check if a given session matches this event.
     *
     * @param targetSessionId the session ID to check
     * @param targetUserId the user ID associated with the session
     * @return true if this event applies to the given session
     */
    public boolean appliesTo(String targetSessionId, String targetUserId) {
        if (sessionId.isPresent()) {
            return sessionId.get().equals(targetSessionId);
        }
        return userId.isPresent() && userId.get().equals(targetUserId);
    }
}
