package appauth.core.service.session;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import appauth.core.config.SessionConfig;
import appauth.core.model.session.InvalidationReason;
import appauth.core.model.session.SessionCreated;
import appauth.core.model.session.SessionInvalidatedEvent;
import appauth.core.model.session.SessionLookup;
import appauth.core.model.session.SessionRecord;
import appauth.core.model.session.SessionSummary;
import appauth.core.model.storage.StorageKeys;
import appauth.core.port.in.SessionManagement;
import appauth.core.port.out.BackendUnavailableException;
import appauth.core.port.out.KeyValueBackend;
import appauth.core.port.out.Metrics;

/**
 * Implementation of session lifecycle operations.
 *
 * <p>Each session lives in two places: the record under {@code <prefix>:sess:<id>} and a
 * reference in the owner's index under {@code <prefix>:usess:<user>}. The backend offers no
 * transaction across the two keys, so every mutation writes them in a fixed order and
 * tolerates being interrupted in between:
 * <ul>
 *   <li>create: record, then index reference, then capacity eviction</li>
 *   <li>delete and eviction: record, then index reference</li>
 * </ul>
 * An interrupted mutation can therefore leave an orphan reference, but never a live
 * record that its owner's index does not know about (apart from the create window,
 * which the record TTL bounds). Orphans are removed lazily by {@link #listSessions} and
 * {@link #fetch(String, String)}, and in bulk by the consistency sweep.
 */
@ApplicationScoped
public class SessionService implements SessionManagement {

    private static final Logger LOG = Logger.getLogger(SessionService.class);

    private final KeyValueBackendRegistry backendRegistry;
    private final SessionIdGenerator idGenerator;
    private final SessionConfig config;
    private final Clock clock;
    private final Event<SessionInvalidatedEvent> sessionInvalidatedEvent;
    private final Metrics metrics;
    private final SessionTtlPolicy ttlPolicy;
    private final StorageKeys keys;
    private final SessionRecordCodec codec = new SessionRecordCodec();

    @Inject
    public SessionService(
            KeyValueBackendRegistry backendRegistry,
            SessionIdGenerator idGenerator,
            SessionConfig config,
            Clock clock,
            Event<SessionInvalidatedEvent> sessionInvalidatedEvent,
            Metrics metrics) {
        this.backendRegistry = backendRegistry;
        this.idGenerator = idGenerator;
        this.config = config;
        this.clock = clock;
        this.sessionInvalidatedEvent = sessionInvalidatedEvent;
        this.metrics = metrics;
        this.ttlPolicy = SessionTtlPolicy.from(config);
        this.keys = new StorageKeys(config.keyPrefix());
    }

    @Override
    public Uni<SessionCreated> create(String userId, Map<String, Object> attributes) {
        if (userId == null || userId.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("userId must not be blank"));
        }
        Map<String, Object> payload = attributes == null ? Map.of() : attributes;
        for (String reserved : SessionRecordCodec.RESERVED) {
            if (payload.containsKey(reserved)) {
                return Uni.createFrom()
                        .failure(new IllegalArgumentException("Attribute name is reserved: " + reserved));
            }
        }

        Instant now = clock.instant();
        Instant expiresAt = ttlPolicy.initialExpiry(now);

        return createWithRetry(userId, payload, now, expiresAt, 0)
                .call(this::indexSession)
                .flatMap(record -> enforceCapacity(record).map(evicted -> new SessionCreated(record, evicted)));
    }

    private Uni<SessionRecord> createWithRetry(
            String userId, Map<String, Object> attributes, Instant issuedAt, Instant expiresAt, int attempt) {

        int maxRetries = config.idGeneration().maxRetries();

        if (attempt >= maxRetries) {
            return Uni.createFrom()
                    .failure(new SessionCreationException(
                            "Failed to generate unique session ID after " + maxRetries + " attempts"));
        }

        String sessionId = idGenerator.generate();
        SessionRecord record = new SessionRecord(sessionId, userId, attributes, issuedAt, expiresAt, issuedAt);

        return backend()
                .setIfAbsentWithTtl(
                        keys.session(sessionId), codec.encode(record), ttlPolicy.storageTtl(expiresAt, issuedAt))
                .flatMap(saved -> {
                    if (saved) {
                        LOG.infof("Session created for user %s", userId);
                        LOG.debugf("Session created: %s (expires %s)", sessionId, expiresAt);
                        return Uni.createFrom().item(record);
                    }

                    LOG.warnf("Session ID collision detected (attempt %d/%d), retrying", attempt + 1, maxRetries);
                    return createWithRetry(userId, attributes, issuedAt, expiresAt, attempt + 1);
                });
    }

    private Uni<Void> indexSession(SessionRecord record) {
        double score = record.issuedAt().toEpochMilli() / 1000.0;
        return backend()
                .appendToIndex(keys.userIndex(record.userId()), record.id(), score)
                .onFailure()
                .call(() -> backend()
                        .delete(keys.session(record.id()))
                        .onFailure()
                        .recoverWithItem(e -> {
                            LOG.warnf(
                                    "Could not remove unindexed session %s, it will expire by TTL: %s",
                                    record.id(), e.getMessage());
                            return false;
                        }));
    }

    /**
     * Evict the user's oldest sessions beyond the configured capacity. The freshly
     * created session is never a candidate.
     */
    private Uni<List<String>> enforceCapacity(SessionRecord created) {
        int max = config.maxSessionsPerUser();
        if (max <= 0) {
            return Uni.createFrom().item(List.of());
        }

        String indexKey = keys.userIndex(created.userId());
        return backend().indexMembers(indexKey).flatMap(members -> {
            int excess = members.size() - max;
            if (excess <= 0) {
                return Uni.createFrom().item(List.<String>of());
            }
            List<String> victims = members.stream()
                    .filter(id -> !id.equals(created.id()))
                    .limit(excess)
                    .toList();
            return evict(created.userId(), indexKey, victims).replaceWith(victims);
        });
    }

    private Uni<Void> evict(String userId, String indexKey, List<String> victims) {
        if (victims.isEmpty()) {
            return Uni.createFrom().voidItem();
        }
        List<Uni<Boolean>> deletions =
                victims.stream().map(id -> backend().delete(keys.session(id))).toList();

        return Uni.join()
                .all(deletions)
                .andFailFast()
                .flatMap(deleted -> backend().removeFromIndex(indexKey, victims))
                .invoke(removed -> {
                    LOG.infof(
                            "Evicted %d oldest session(s) of user %s to stay within %d sessions",
                            victims.size(), userId, config.maxSessionsPerUser());
                    metrics.recordEvictions(victims.size());
                    for (String id : victims) {
                        sessionInvalidatedEvent.fireAsync(
                                SessionInvalidatedEvent.forSession(id, userId, InvalidationReason.EVICTED));
                    }
                })
                .replaceWithVoid();
    }

    @Override
    public Uni<Optional<SessionRecord>> fetch(String sessionId) {
        return lookup(sessionId).map(SessionLookup::session);
    }

    @Override
    public Uni<Optional<SessionRecord>> fetch(String sessionId, String userId) {
        String indexKey = keys.userIndex(userId);

        return lookup(sessionId)
                .flatMap(result -> {
                    if (result.isUnavailable()) {
                        return Uni.createFrom().item(Optional.<SessionRecord>empty());
                    }
                    if (result.isFound()) {
                        SessionRecord record = result.session().get();
                        if (record.isOwnedBy(userId)) {
                            return Uni.createFrom().item(Optional.of(record));
                        }
                        LOG.warnf("Session %s is indexed under user %s but owned by another user", sessionId, userId);
                        return backend()
                                .removeFromIndex(indexKey, List.of(sessionId))
                                .replaceWith(Optional.<SessionRecord>empty());
                    }
                    return pruneDangling(indexKey, sessionId).replaceWith(Optional.<SessionRecord>empty());
                })
                .onFailure(BackendUnavailableException.class)
                .recoverWithItem(e -> {
                    LOG.warnf("Lazy cleanup of session %s skipped, backend unavailable: %s", sessionId, e.getMessage());
                    return Optional.empty();
                });
    }

    @Override
    public Uni<SessionLookup> lookup(String sessionId) {
        return readRecord(sessionId)
                .flatMap(found -> {
                    if (found.isEmpty()) {
                        return Uni.createFrom().item(SessionLookup.notFound());
                    }
                    SessionRecord record = found.get();
                    if (record.isExpired(clock.instant())) {
                        LOG.debugf("Session %s is past its expiry", sessionId);
                        return discard(record, InvalidationReason.EXPIRED).replaceWith(SessionLookup.notFound());
                    }
                    return Uni.createFrom().item(SessionLookup.found(record));
                })
                .onFailure(BackendUnavailableException.class)
                .recoverWithItem(e -> {
                    LOG.warnf("Cannot verify session, backend unavailable: %s", e.getMessage());
                    return SessionLookup.unavailable();
                });
    }

    @Override
    public Uni<Optional<Instant>> renew(SessionRecord record) {
        Instant now = clock.instant();
        Optional<Instant> next = ttlPolicy.renewal(record, now);
        if (next.isEmpty()) {
            return Uni.createFrom().item(Optional.empty());
        }

        Instant newExpiry = next.get();
        SessionRecord renewed = record.renewed(newExpiry, now);

        return backend()
                .replaceIfPresentWithTtl(
                        keys.session(record.id()), codec.encode(renewed), ttlPolicy.storageTtl(newExpiry, now))
                .map(written -> {
                    if (!written) {
                        LOG.debugf("Session %s disappeared before renewal", record.id());
                        return Optional.<Instant>empty();
                    }
                    LOG.debugf("Session %s renewed until %s", record.id(), newExpiry);
                    return Optional.of(newExpiry);
                });
    }

    @Override
    public Uni<Boolean> delete(String sessionId, String userId) {
        return removeSession(sessionId, userId, InvalidationReason.LOGOUT);
    }

    @Override
    public Uni<Boolean> delete(String sessionId) {
        return readRecord(sessionId).flatMap(found -> {
            if (found.isEmpty()) {
                return backend().delete(keys.session(sessionId));
            }
            return removeSession(sessionId, found.get().userId(), InvalidationReason.LOGOUT);
        });
    }

    @Override
    public Uni<Integer> deleteAllForUser(String userId) {
        String indexKey = keys.userIndex(userId);

        return backend().indexMembers(indexKey)
                .flatMap(members -> {
                    if (members.isEmpty()) {
                        return Uni.createFrom().item(0);
                    }
                    List<Uni<Boolean>> deletions = members.stream()
                            .map(id -> backend().delete(keys.session(id)))
                            .toList();
                    return Uni.join()
                            .all(deletions)
                            .andFailFast()
                            .map(results -> (int)
                                    results.stream().filter(Boolean::booleanValue).count())
                            .call(() -> backend().removeFromIndex(indexKey, members));
                })
                .invoke(count -> {
                    LOG.infof("Invalidated %d session(s) for user %s", count, userId);
                    sessionInvalidatedEvent.fireAsync(SessionInvalidatedEvent.forUser(userId));
                });
    }

    @Override
    public Uni<List<SessionSummary>> listSessions(String userId) {
        String indexKey = keys.userIndex(userId);
        Instant now = clock.instant();

        return backend().indexMembers(indexKey)
                .onItem()
                .transformToMulti(members -> Multi.createFrom().iterable(members))
                .onItem()
                .transformToUniAndConcatenate(sessionId -> inspect(indexKey, userId, sessionId, now))
                .collect()
                .asList()
                .map(inspected -> {
                    List<SessionSummary> newestFirst = new ArrayList<>();
                    for (int i = inspected.size() - 1; i >= 0 && newestFirst.size() < config.listLimit(); i--) {
                        inspected.get(i).ifPresent(record -> newestFirst.add(SessionSummary.of(record)));
                    }
                    return newestFirst;
                });
    }

    /**
     * Resolve one index reference for {@link #listSessions}, repairing it if it is stale.
     */
    private Uni<Optional<SessionRecord>> inspect(String indexKey, String userId, String sessionId, Instant now) {
        return readRecord(sessionId).flatMap(found -> {
            if (found.isEmpty()) {
                return pruneDangling(indexKey, sessionId).replaceWith(Optional.<SessionRecord>empty());
            }
            SessionRecord record = found.get();
            if (!record.isOwnedBy(userId)) {
                LOG.warnf("Session %s is indexed under user %s but owned by another user", sessionId, userId);
                return backend()
                        .removeFromIndex(indexKey, List.of(sessionId))
                        .replaceWith(Optional.<SessionRecord>empty());
            }
            if (record.isExpired(now)) {
                return removeSession(sessionId, userId, InvalidationReason.EXPIRED)
                        .replaceWith(Optional.<SessionRecord>empty());
            }
            return Uni.createFrom().item(Optional.of(record));
        });
    }

    private Uni<Boolean> pruneDangling(String indexKey, String sessionId) {
        return backend()
                .removeFromIndexIfAbsent(indexKey, sessionId, keys.session(sessionId))
                .invoke(removed -> {
                    if (removed) {
                        LOG.infof("Lazy cleanup removed dangling session reference %s from %s", sessionId, indexKey);
                    }
                });
    }

    private Uni<Boolean> removeSession(String sessionId, String userId, InvalidationReason reason) {
        // Record before index: an interrupted delete leaves an orphan reference, never an unindexed session.
        return backend()
                .delete(keys.session(sessionId))
                .call(() -> backend().removeFromIndex(keys.userIndex(userId), List.of(sessionId)))
                .invoke(deleted -> {
                    if (deleted) {
                        LOG.infof("Session invalidated for user %s (%s)", userId, reason);
                        LOG.debugf("Session invalidated: %s", sessionId);
                        sessionInvalidatedEvent.fireAsync(
                                SessionInvalidatedEvent.forSession(sessionId, userId, reason));
                    }
                });
    }

    private Uni<Void> discard(SessionRecord record, InvalidationReason reason) {
        return removeSession(record.id(), record.userId(), reason)
                .replaceWithVoid()
                .onFailure()
                .recoverWithItem(e -> {
                    LOG.warnf("Failed to clean up session %s: %s", record.id(), e.getMessage());
                    return null;
                });
    }

    private Uni<Optional<SessionRecord>> readRecord(String sessionId) {
        return backend().get(keys.session(sessionId)).map(value -> value.flatMap(json -> decode(sessionId, json)));
    }

    private Optional<SessionRecord> decode(String sessionId, String json) {
        try {
            return Optional.of(codec.decode(sessionId, json));
        } catch (IllegalArgumentException e) {
            LOG.warnf("Ignoring unreadable session record %s: %s", sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    private KeyValueBackend backend() {
        return backendRegistry.getBackend();
    }
}
