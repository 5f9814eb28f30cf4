package appauth.core.model.cleanup;

import java.time.Instant;

/**
 * Counters produced by one consistency sweep.
 *
 * <p>A report with {@code complete == false} describes a sweep that stopped early;
 * {@code resumeCursor} is the scan cursor of the first page that was not fully
 * processed and can be passed back to continue.
 *
 * @param mode the mode the sweep ran in
 * @param indicesScanned user-index keys visited
 * @param sessionRefsChecked session references examined across all indices
 * @param liveFound references whose record exists
 * @param orphansFound references whose record is absent
 * @param orphansRemoved orphan references removed from their index
 * @param expiredRemoved live sessions deleted for exceeding the maximum age
 * @param emptyIndicesRemoved index keys that ended up empty and were removed
 * @param indicesCleaned indices that had at least one reference removed
 * @param startedAt when the sweep began
 * @param finishedAt when the sweep ended (or was aborted)
 * @param complete whether the whole key space was traversed
 * @param resumeCursor cursor to resume from; {@code "0"} once complete
 */
public record SweepReport(
        SweepMode mode,
        long indicesScanned,
        long sessionRefsChecked,
        long liveFound,
        long orphansFound,
        long orphansRemoved,
        long expiredRemoved,
        long emptyIndicesRemoved,
        long indicesCleaned,
        Instant startedAt,
        Instant finishedAt,
        boolean complete,
        String resumeCursor) {

    public ConsistencyStatus consistencyStatus() {
        if (orphansFound == 0) {
            return ConsistencyStatus.GOOD;
        }
        return orphansRemoved >= orphansFound ? ConsistencyStatus.REPAIRED : ConsistencyStatus.NEEDS_REPAIR;
    }

    /**
     * Human-readable, multi-line rendering for logs and the operator CLI.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("=== Session cleanup report ===\n");
        sb.append("mode: ").append(mode).append(mode.isMutating() ? "" : " (dry run)").append('\n');
        sb.append("started: ").append(startedAt).append('\n');
        sb.append("finished: ").append(finishedAt).append('\n');
        sb.append("complete: ").append(complete);
        if (!complete) {
            sb.append(" (resume from cursor ").append(resumeCursor).append(')');
        }
        sb.append('\n');
        sb.append("indices_scanned: ").append(indicesScanned).append('\n');
        sb.append("session_refs_checked: ").append(sessionRefsChecked).append('\n');
        sb.append("live_found: ").append(liveFound).append('\n');
        sb.append("orphans_found: ").append(orphansFound).append('\n');
        sb.append("orphans_removed: ").append(orphansRemoved).append('\n');
        sb.append("expired_removed: ").append(expiredRemoved).append('\n');
        sb.append("empty_indices_removed: ").append(emptyIndicesRemoved).append('\n');
        sb.append("indices_cleaned: ").append(indicesCleaned).append('\n');
        sb.append("consistency: ").append(consistencyStatus());
        return sb.toString();
    }
}
