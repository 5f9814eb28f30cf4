package appauth.core.model.session;

/**
 * Why a session stopped being valid.
 */
public enum InvalidationReason {
    /** Explicit logout of a single session. */
    LOGOUT,
    /** "Logout everywhere" for a user. */
    LOGOUT_ALL,
    /** Removed to keep the user within the per-user session capacity. */
    EVICTED,
    /** Found past its logical expiry on read. */
    EXPIRED,
    /** Removed by the sweep because it exceeded the maximum age. */
    MAX_AGE
}
