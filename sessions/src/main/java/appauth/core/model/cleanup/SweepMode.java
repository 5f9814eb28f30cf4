package appauth.core.model.cleanup;

/**
 * How far a consistency sweep is allowed to go.
 */
public enum SweepMode {
    /** Classify and count only. Never writes. */
    REPORT(false, false),
    /** Remove index references whose session record is gone. */
    REPAIR_ORPHANS(true, false),
    /**
     * Orphan repair plus deletion of live sessions older than the configured
     * maximum age. Forces logout of long-lived sessions, so it is opt-in.
     */
    REPAIR_ORPHANS_AND_EXPIRED(true, true);

    private final boolean mutating;
    private final boolean expiredRepair;

    SweepMode(boolean mutating, boolean expiredRepair) {
        this.mutating = mutating;
        this.expiredRepair = expiredRepair;
    }

    public boolean isMutating() {
        return mutating;
    }

    public boolean repairsExpired() {
        return expiredRepair;
    }

    public static SweepMode of(boolean dryRun, boolean includeExpired) {
        if (dryRun) {
            return REPORT;
        }
        return includeExpired ? REPAIR_ORPHANS_AND_EXPIRED : REPAIR_ORPHANS;
    }
}
