package appauth.core.port.in;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import appauth.core.model.session.SessionCreated;
import appauth.core.model.session.SessionLookup;
import appauth.core.model.session.SessionRecord;
import appauth.core.model.session.SessionSummary;

/**
 * Inbound port for session lifecycle operations.
 *
 * <p>Every mutation keeps the session record and the owning user's index in step.
 * The two writes are not transactional: a crash between them leaves an orphan index
 * reference that {@link #listSessions(String)} or the consistency sweep removes later.
 */
public interface SessionManagement {

    /**
     * Creates a session for a user.
     *
     * <p>Generates a random ID (retrying on collision), stores the record, indexes it
     * under the user and then enforces the per-user capacity. <strong>Side effect:</strong>
     * if the user is over capacity, their oldest sessions are deleted and reported in
     * {@link SessionCreated#evictedSessionIds()}.
     *
     * @param userId owning user identifier
     * @param attributes opaque payload stored with the session
     * @return the created session and any sessions evicted to make room
     * @throws SessionCreationException if no unique ID could be generated
     */
    Uni<SessionCreated> create(String userId, Map<String, Object> attributes);

    /**
     * Fetch a session, degrading to empty when the backend is unreachable.
     *
     * <p>Use {@link #lookup(String)} where "logged out" and "cannot verify" must differ.
     *
     * @param sessionId session identifier
     * @return the live session, or empty
     */
    Uni<Optional<SessionRecord>> fetch(String sessionId);

    /**
     * Fetch a session on behalf of a known owner.
     *
     * <p>If the record is gone (or belongs to someone else) while the ID is still in
     * {@code userId}'s index, the dangling index entry is removed before returning.
     *
     * @param sessionId session identifier
     * @param userId the user whose index is expected to reference the session
     * @return the live session owned by {@code userId}, or empty
     */
    Uni<Optional<SessionRecord>> fetch(String sessionId, String userId);

    /**
     * Fetch a session and report whether absence means "not found" or "backend unavailable".
     *
     * @param sessionId session identifier
     * @return lookup outcome; never fails
     */
    Uni<SessionLookup> lookup(String sessionId);

    /**
     * Apply sliding expiration to a session.
     *
     * <p>The new expiry is {@code min(issuedAt + absoluteLifetime, now + slidingWindow)}.
     * The record is only rewritten when the new expiry is materially later than the
     * current one; otherwise this is a no-op.
     *
     * @param record the session as last read
     * @return the new expiry if the session was renewed, empty otherwise
     */
    Uni<Optional<Instant>> renew(SessionRecord record);

    /**
     * Delete a session and its reference in the user's index.
     *
     * @param sessionId session identifier
     * @param userId owning user
     * @return true if a session record was removed
     */
    Uni<Boolean> delete(String sessionId, String userId);

    /**
     * Delete a session whose owner is not known to the caller.
     *
     * <p>The owner is read from the stored record. If the record is already gone
     * there is no index to update and the call reports false.
     *
     * @param sessionId session identifier
     * @return true if a session record was removed
     */
    Uni<Boolean> delete(String sessionId);

    /**
     * Delete every session of a user ("logout everywhere").
     *
     * @param userId owning user
     * @return number of session records removed
     */
    Uni<Integer> deleteAllForUser(String userId);

    /**
     * List a user's live sessions, newest first.
     *
     * <p>This is the main lazy-cleanup trigger: index entries whose record is gone are
     * removed from the index as a side effect.
     *
     * @param userId owning user
     * @return summaries of live sessions, at most the configured list limit
     */
    Uni<List<SessionSummary>> listSessions(String userId);

    /**
     * Exception thrown when session creation fails.
     */
    class SessionCreationException extends RuntimeException {
        public SessionCreationException(String message) {
            super(message);
        }
    }
}
