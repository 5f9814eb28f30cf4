package appauth.core.model.session;

import java.util.List;

/**
 * Result of creating a session.
 *
 * <p>{@code evictedSessionIds} lists sessions of the same user that were removed
 * to stay within the per-user capacity. A new login can therefore log out the
 * user's oldest session; callers should log or notify on a non-empty list.
 *
 * @param session the newly stored record
 * @param evictedSessionIds ids evicted oldest-first as a side effect, possibly empty
 */
public record SessionCreated(SessionRecord session, List<String> evictedSessionIds) {

    public SessionCreated {
        evictedSessionIds = List.copyOf(evictedSessionIds);
    }

    public boolean evictedOthers() {
        return !evictedSessionIds.isEmpty();
    }
}
