package appauth.core.service.cleanup;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import appauth.core.config.CleanupConfig;
import appauth.core.config.SessionConfig;
import appauth.core.model.cleanup.ReferenceStatus;
import appauth.core.model.cleanup.SweepMode;
import appauth.core.model.cleanup.SweepReport;
import appauth.core.model.session.InvalidationReason;
import appauth.core.model.session.SessionInvalidatedEvent;
import appauth.core.model.session.SessionRecord;
import appauth.core.model.storage.ScanPage;
import appauth.core.model.storage.StorageKeys;
import appauth.core.port.in.SessionCleanup;
import appauth.core.port.out.BackendUnavailableException;
import appauth.core.port.out.KeyValueBackend;
import appauth.core.port.out.Metrics;
import appauth.core.service.session.KeyValueBackendRegistry;
import appauth.core.service.session.SessionRecordCodec;

/**
 * Consistency sweep over every user index.
 *
 * <p>Index keys are visited page by page in scan order, and the members of each
 * index in index order. Every classification is a fresh read; orphan removal goes
 * through {@link KeyValueBackend#removeFromIndexIfAbsent} so that a session
 * recreated under the same ID between the check and the repair is never unlinked.
 *
 * <p>Only sessions reachable from an index are aged out. A record that no index
 * references is never seen here; its storage TTL bounds how long it survives.
 *
 * <p>If the backend fails, the sweep stops with a {@link SweepAbortedException}
 * whose partial report carries the cursor of the page that failed.
 */
@ApplicationScoped
public class SessionSweepService implements SessionCleanup {

    private static final Logger LOG = Logger.getLogger(SessionSweepService.class);

    private final KeyValueBackendRegistry backendRegistry;
    private final CleanupConfig cleanupConfig;
    private final Clock clock;
    private final Event<SessionInvalidatedEvent> sessionInvalidatedEvent;
    private final Metrics metrics;
    private final StorageKeys keys;
    private final SessionRecordCodec codec = new SessionRecordCodec();

    @Inject
    public SessionSweepService(
            KeyValueBackendRegistry backendRegistry,
            SessionConfig sessionConfig,
            CleanupConfig cleanupConfig,
            Clock clock,
            Event<SessionInvalidatedEvent> sessionInvalidatedEvent,
            Metrics metrics) {
        this.backendRegistry = backendRegistry;
        this.cleanupConfig = cleanupConfig;
        this.clock = clock;
        this.sessionInvalidatedEvent = sessionInvalidatedEvent;
        this.metrics = metrics;
        this.keys = new StorageKeys(sessionConfig.keyPrefix());
    }

    @Override
    public Uni<SweepReport> sweep(SweepMode mode, Duration maxAge, String cursor) {
        if (mode.repairsExpired() && maxAge == null) {
            return Uni.createFrom().failure(new IllegalArgumentException("maxAge is required for " + mode));
        }
        Instant startedAt = clock.instant();
        Instant cutoff = mode.repairsExpired() ? startedAt.minus(maxAge) : null;
        Tally tally = new Tally();
        AtomicReference<String> pageCursor = new AtomicReference<>(cursor == null ? ScanPage.START : cursor);

        LOG.infof("Session sweep started (mode %s, cursor %s)", mode, pageCursor.get());

        return Multi.createBy()
                .repeating()
                .uni(() -> pageCursor, position -> backend()
                        .scan(keys.userIndexPattern(), position.get(), cleanupConfig.pageSize())
                        .call(page -> sweepPage(page.keys(), mode, cutoff, tally))
                        .invoke(page -> position.set(page.cursor())))
                .whilst(page -> !page.isLast())
                .collect()
                .last()
                .map(last -> tally.toReport(mode, startedAt, clock.instant(), true, ScanPage.START))
                .invoke(this::completed)
                .onFailure(BackendUnavailableException.class)
                .transform(e -> aborted(tally.toReport(mode, startedAt, clock.instant(), false, pageCursor.get()), e));
    }

    private Uni<Void> sweepPage(List<String> indexKeys, SweepMode mode, Instant cutoff, Tally tally) {
        if (indexKeys.isEmpty()) {
            return Uni.createFrom().voidItem();
        }
        return Multi.createFrom()
                .iterable(indexKeys)
                .onItem()
                .transformToUniAndConcatenate(indexKey -> sweepIndex(indexKey, mode, cutoff, tally))
                .collect()
                .last()
                .replaceWithVoid();
    }

    private Uni<Void> sweepIndex(String indexKey, SweepMode mode, Instant cutoff, Tally tally) {
        tally.indicesScanned++;

        return backend().indexMembers(indexKey).flatMap(members -> {
            if (members.isEmpty()) {
                return Uni.createFrom().voidItem();
            }
            LOG.debugf("Checking %d session reference(s) in %s", members.size(), indexKey);

            return Multi.createFrom()
                    .iterable(members)
                    .onItem()
                    .transformToUniAndConcatenate(sessionId -> checkReference(indexKey, sessionId, mode, cutoff, tally))
                    .collect()
                    .asList()
                    .flatMap(removals -> {
                        if (removals.stream().noneMatch(Boolean::booleanValue)) {
                            return Uni.createFrom().voidItem();
                        }
                        tally.indicesCleaned++;
                        return backend().exists(indexKey).invoke(stillThere -> {
                            if (!stillThere) {
                                tally.emptyIndicesRemoved++;
                                LOG.debugf("Index %s is empty and was removed", indexKey);
                            }
                        }).replaceWithVoid();
                    });
        });
    }

    /**
     * Classify and, in mutating modes, repair one reference.
     *
     * @return whether the reference was removed from the index
     */
    private Uni<Boolean> checkReference(
            String indexKey, String sessionId, SweepMode mode, Instant cutoff, Tally tally) {
        tally.sessionRefsChecked++;

        return classify(sessionId, mode, cutoff).flatMap(status -> switch (status) {
            case LIVE -> {
                tally.liveFound++;
                yield Uni.createFrom().item(false);
            }
            case ORPHAN -> {
                tally.orphansFound++;
                if (!mode.isMutating()) {
                    yield Uni.createFrom().item(false);
                }
                yield backend()
                        .removeFromIndexIfAbsent(indexKey, sessionId, keys.session(sessionId))
                        .invoke(removed -> {
                            if (removed) {
                                tally.orphansRemoved++;
                            }
                        });
            }
            case EXPIRED -> {
                tally.liveFound++;
                yield removeExpired(indexKey, sessionId).invoke(removed -> {
                    if (removed) {
                        tally.expiredRemoved++;
                    }
                });
            }
        });
    }

    private Uni<ReferenceStatus> classify(String sessionId, SweepMode mode, Instant cutoff) {
        if (!mode.repairsExpired()) {
            return backend()
                    .exists(keys.session(sessionId))
                    .map(exists -> exists ? ReferenceStatus.LIVE : ReferenceStatus.ORPHAN);
        }
        return backend().get(keys.session(sessionId)).map(raw -> {
            if (raw.isEmpty()) {
                return ReferenceStatus.ORPHAN;
            }
            try {
                SessionRecord record = codec.decode(sessionId, raw.get());
                return record.issuedAt().isBefore(cutoff) ? ReferenceStatus.EXPIRED : ReferenceStatus.LIVE;
            } catch (IllegalArgumentException e) {
                LOG.warnf("Unreadable session record %s left in place: %s", sessionId, e.getMessage());
                return ReferenceStatus.LIVE;
            }
        });
    }

    private Uni<Boolean> removeExpired(String indexKey, String sessionId) {
        return backend()
                .delete(keys.session(sessionId))
                .call(() -> backend().removeFromIndex(indexKey, List.of(sessionId)))
                .invoke(deleted -> {
                    if (deleted) {
                        sessionInvalidatedEvent.fireAsync(SessionInvalidatedEvent.forSession(
                                sessionId, keys.userKeyOf(indexKey), InvalidationReason.MAX_AGE));
                    }
                });
    }

    private void completed(SweepReport report) {
        metrics.recordSweep(report);
        LOG.infof(
                "Session sweep finished: %d indices, %d references, %d live, %d orphans found, %d removed, %d expired removed",
                report.indicesScanned(),
                report.sessionRefsChecked(),
                report.liveFound(),
                report.orphansFound(),
                report.orphansRemoved(),
                report.expiredRemoved());
        if (report.orphansFound() > 0) {
            LOG.warnf(
                    "Session sweep found %d orphan reference(s), consistency %s",
                    report.orphansFound(), report.consistencyStatus());
        }
    }

    private SweepAbortedException aborted(SweepReport partial, Throwable cause) {
        metrics.recordSweep(partial);
        LOG.warnf(
                "Session sweep aborted after %d indices, resume from cursor %s: %s",
                partial.indicesScanned(), partial.resumeCursor(), cause.getMessage());
        return new SweepAbortedException(partial, cause);
    }

    private KeyValueBackend backend() {
        return backendRegistry.getBackend();
    }

    /** Running counters; a sweep touches them from one sequential pipeline. */
    private static final class Tally {
        long indicesScanned;
        long sessionRefsChecked;
        long liveFound;
        long orphansFound;
        long orphansRemoved;
        long expiredRemoved;
        long emptyIndicesRemoved;
        long indicesCleaned;

        SweepReport toReport(SweepMode mode, Instant startedAt, Instant finishedAt, boolean complete, String cursor) {
            return new SweepReport(
                    mode,
                    indicesScanned,
                    sessionRefsChecked,
                    liveFound,
                    orphansFound,
                    orphansRemoved,
                    expiredRemoved,
                    emptyIndicesRemoved,
                    indicesCleaned,
                    startedAt,
                    finishedAt,
                    complete,
                    cursor);
        }
    }
}
