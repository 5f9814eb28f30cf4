package appauth.core.service.cleanup;

import java.util.concurrent.atomic.AtomicReference;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import appauth.core.config.CleanupConfig;
import appauth.core.model.cleanup.SweepMode;
import appauth.core.model.storage.ScanPage;
import appauth.core.port.in.SessionCleanup;
import appauth.core.port.in.SessionCleanup.SweepAbortedException;

/**
 * Periodic consistency sweep.
 *
 * <p>Runs orphan repair, plus expired-session repair when
 * {@code appauth.cleanup.include-expired} is set. A sweep aborted by a backend
 * outage resumes from its last cursor on the next run.
 */
@ApplicationScoped
public class ScheduledSessionSweep {

    private static final Logger LOG = Logger.getLogger(ScheduledSessionSweep.class);

    private final SessionCleanup sessionCleanup;
    private final CleanupConfig config;
    private final AtomicReference<String> resumeCursor = new AtomicReference<>(ScanPage.START);

    @Inject
    public ScheduledSessionSweep(SessionCleanup sessionCleanup, CleanupConfig config) {
        this.sessionCleanup = sessionCleanup;
        this.config = config;
    }

    @Scheduled(
            every = "${appauth.cleanup.every:1h}",
            delayed = "${appauth.cleanup.initial-delay:5m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> runScheduledSweep() {
        if (!config.enabled()) {
            return Uni.createFrom().voidItem();
        }

        SweepMode mode = SweepMode.of(false, config.includeExpired());
        String cursor = resumeCursor.get();
        if (!ScanPage.START.equals(cursor)) {
            LOG.infof("Resuming interrupted session sweep from cursor %s", cursor);
        }

        return sessionCleanup
                .sweep(mode, config.maxAge(), cursor)
                .invoke(report -> {
                    resumeCursor.set(ScanPage.START);
                    LOG.info(report.render());
                })
                .replaceWithVoid()
                .onFailure(SweepAbortedException.class)
                .recoverWithUni(e -> {
                    resumeCursor.set(((SweepAbortedException) e).getPartialReport().resumeCursor());
                    return Uni.createFrom().voidItem();
                })
                .onFailure()
                .invoke(e -> LOG.error("Scheduled session sweep failed", e));
    }

    String pendingResumeCursor() {
        return resumeCursor.get();
    }
}
