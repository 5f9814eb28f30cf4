package appauth.core.port.in;

import java.time.Duration;

import io.smallrye.mutiny.Uni;

import appauth.core.model.cleanup.SweepMode;
import appauth.core.model.cleanup.SweepReport;
import appauth.core.model.storage.ScanPage;

/**
 * Inbound port for the consistency sweep over all user indices.
 *
 * <p>The sweep takes no lock and is safe to run against live traffic and
 * concurrently with itself: every repair re-verifies absence atomically right
 * before removing an index reference, and every repair is idempotent.
 */
public interface SessionCleanup {

    /**
     * Sweep the whole key space from the beginning.
     *
     * @param mode what the sweep may change
     * @param maxAge age beyond which a live session counts as expired; required by
     *     {@link SweepMode#REPAIR_ORPHANS_AND_EXPIRED}, ignored and may be null otherwise
     * @return the report; fails with {@link SweepAbortedException} if the backend
     *     becomes unavailable mid-sweep
     */
    default Uni<SweepReport> sweep(SweepMode mode, Duration maxAge) {
        return sweep(mode, maxAge, ScanPage.START);
    }

    /**
     * Sweep starting from a scan cursor returned by an earlier, aborted sweep.
     */
    Uni<SweepReport> sweep(SweepMode mode, Duration maxAge, String cursor);

    /**
     * A sweep stopped because the backend became unavailable.
     *
     * <p>Everything before the failed page was processed; the failed page is left
     * untouched or partially repaired, never worse than before. Resume with
     * {@code getPartialReport().resumeCursor()}.
     */
    class SweepAbortedException extends RuntimeException {
        private final SweepReport partialReport;

        public SweepAbortedException(SweepReport partialReport, Throwable cause) {
            super("Session sweep aborted at cursor " + partialReport.resumeCursor() + ": " + cause.getMessage(), cause);
            this.partialReport = partialReport;
        }

        public SweepReport getPartialReport() {
            return partialReport;
        }
    }
}
