package appauth.core.model.session;

import java.util.Optional;

/**
 * Outcome of a session read that keeps "logged out" apart from "cannot verify".
 *
 * <p>Edge layers should map {@link Status#UNAVAILABLE} to a retryable error and
 * never to a logout, so a backend outage does not terminate valid sessions.
 *
 * @param status lookup outcome
 * @param session the record when {@code status} is {@link Status#FOUND}
 */
public record SessionLookup(Status status, Optional<SessionRecord> session) {

    public enum Status {
        FOUND,
        NOT_FOUND,
        UNAVAILABLE
    }

    public static SessionLookup found(SessionRecord record) {
        return new SessionLookup(Status.FOUND, Optional.of(record));
    }

    public static SessionLookup notFound() {
        return new SessionLookup(Status.NOT_FOUND, Optional.empty());
    }

    public static SessionLookup unavailable() {
        return new SessionLookup(Status.UNAVAILABLE, Optional.empty());
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    public boolean isUnavailable() {
        return status == Status.UNAVAILABLE;
    }
}
