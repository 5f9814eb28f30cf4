package appauth.core.model.cleanup;

/**
 * Classification of a single session reference found in a user index.
 */
public enum ReferenceStatus {
    LIVE,
    ORPHAN,
    EXPIRED
}
