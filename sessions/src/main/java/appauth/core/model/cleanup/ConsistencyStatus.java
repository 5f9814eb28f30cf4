package appauth.core.model.cleanup;

/**
 * Overall verdict of a sweep run.
 */
public enum ConsistencyStatus {
    /** No orphan references were found. */
    GOOD,
    /** Orphans were found and all of them were removed. */
    REPAIRED,
    /** Orphans remain (dry run, or a partially completed sweep). */
    NEEDS_REPAIR
}
