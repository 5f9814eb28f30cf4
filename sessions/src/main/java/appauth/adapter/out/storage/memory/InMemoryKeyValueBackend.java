package appauth.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.regex.Pattern;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import appauth.core.model.storage.ScanPage;
import appauth.core.port.out.KeyValueBackend;

/**
 * In-memory implementation of {@link KeyValueBackend}.
 *
 * <p>This implementation is intended for development and testing only. Data is lost
 * on restart and not shared across instances.
 *
 * <p>All operations run under one lock, which makes every operation atomic with
 * respect to every other, including {@link #getAndDelete} and
 * {@link #removeFromIndexIfAbsent}. TTLs are evaluated against the supplied
 * {@link Clock}; expired values are invisible immediately and purged periodically.
 * Index members are ordered by score, ties broken by member name as Redis does.
 *
 * <p><strong>Warning:</strong> Do not use in production with multiple instances.
 */
public class InMemoryKeyValueBackend implements KeyValueBackend {

    private static final Logger LOG = Logger.getLogger(InMemoryKeyValueBackend.class);
    private static final String CURSOR_PREFIX = "after:";

    private final Object lock = new Object();
    private final Map<String, ValueEntry> values = new HashMap<>();
    private final Map<String, Map<String, Double>> indices = new HashMap<>();
    private final Clock clock;
    private final ScheduledExecutorService cleanupExecutor;

    public InMemoryKeyValueBackend(Clock clock) {
        this.clock = clock;
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "kv-memory-cleanup");
            t.setDaemon(true);
            return t;
        });

        cleanupExecutor.scheduleAtFixedRate(this::purgeExpired, 1, 1, TimeUnit.MINUTES);
        LOG.info("Initialized in-memory key-value backend");
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        return locked(() -> Optional.ofNullable(liveValue(key)));
    }

    @Override
    public Uni<Void> setWithTtl(String key, String value, Duration ttl) {
        return locked(() -> {
            indices.remove(key);
            values.put(key, new ValueEntry(value, clock.instant().plus(ttl)));
            return null;
        });
    }

    @Override
    public Uni<Boolean> setIfAbsentWithTtl(String key, String value, Duration ttl) {
        return locked(() -> {
            if (liveValue(key) != null || indices.containsKey(key)) {
                return false;
            }
            values.put(key, new ValueEntry(value, clock.instant().plus(ttl)));
            return true;
        });
    }

    @Override
    public Uni<Boolean> replaceIfPresentWithTtl(String key, String value, Duration ttl) {
        return locked(() -> {
            if (liveValue(key) == null) {
                return false;
            }
            values.put(key, new ValueEntry(value, clock.instant().plus(ttl)));
            return true;
        });
    }

    @Override
    public Uni<Boolean> delete(String key) {
        return locked(() -> {
            boolean hadValue = liveValue(key) != null;
            values.remove(key);
            return indices.remove(key) != null || hadValue;
        });
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return locked(() -> liveValue(key) != null || indices.containsKey(key));
    }

    @Override
    public Uni<Optional<String>> getAndDelete(String key) {
        return locked(() -> {
            String value = liveValue(key);
            values.remove(key);
            return Optional.ofNullable(value);
        });
    }

    @Override
    public Uni<Void> addToIndex(String indexKey, String member, double score) {
        return locked(() -> {
            values.remove(indexKey);
            indices.computeIfAbsent(indexKey, k -> new HashMap<>()).put(member, score);
            return null;
        });
    }

    @Override
    public Uni<Void> appendToIndex(String indexKey, String member, double score) {
        return locked(() -> {
            values.remove(indexKey);
            Map<String, Double> index = indices.computeIfAbsent(indexKey, k -> new HashMap<>());
            double stored = score;
            for (Map.Entry<String, Double> entry : index.entrySet()) {
                if (!entry.getKey().equals(member)) {
                    stored = Math.max(stored, entry.getValue() + APPEND_SCORE_STEP);
                }
            }
            index.put(member, stored);
            return null;
        });
    }

    @Override
    public Uni<Integer> removeFromIndex(String indexKey, List<String> members) {
        return locked(() -> {
            Map<String, Double> index = indices.get(indexKey);
            if (index == null) {
                return 0;
            }
            int removed = 0;
            for (String member : members) {
                if (index.remove(member) != null) {
                    removed++;
                }
            }
            if (index.isEmpty()) {
                indices.remove(indexKey);
            }
            return removed;
        });
    }

    @Override
    public Uni<List<String>> indexMembers(String indexKey) {
        return locked(() -> {
            Map<String, Double> index = indices.get(indexKey);
            if (index == null) {
                return List.<String>of();
            }
            return index.entrySet().stream()
                    .sorted(Map.Entry.<String, Double>comparingByValue().thenComparing(Map.Entry.<String, Double>comparingByKey()))
                    .map(Map.Entry::getKey)
                    .toList();
        });
    }

    @Override
    public Uni<Boolean> removeFromIndexIfAbsent(String indexKey, String member, String guardKey) {
        return locked(() -> {
            if (liveValue(guardKey) != null || indices.containsKey(guardKey)) {
                return false;
            }
            Map<String, Double> index = indices.get(indexKey);
            if (index == null || index.remove(member) == null) {
                return false;
            }
            if (index.isEmpty()) {
                indices.remove(indexKey);
            }
            return true;
        });
    }

    /**
     * Page through matching keys in lexicographic order. The cursor carries the last
     * key returned, so every key present for the whole scan is returned exactly once
     * even when earlier keys are deleted in between; as with Redis, keys written
     * during a scan may or may not be seen.
     */
    @Override
    public Uni<ScanPage> scan(String pattern, String cursor, int count) {
        return locked(() -> {
            String after = parseCursor(cursor);
            Pattern matcher = globToRegex(pattern);
            Instant now = clock.instant();

            List<String> matching = new ArrayList<>();
            values.forEach((key, entry) -> {
                if (!entry.isExpired(now) && matcher.matcher(key).matches()) {
                    matching.add(key);
                }
            });
            indices.keySet().stream().filter(key -> matcher.matcher(key).matches()).forEach(matching::add);
            if (after != null) {
                matching.removeIf(key -> key.compareTo(after) <= 0);
            }
            matching.sort(Comparator.naturalOrder());

            int to = Math.min(Math.max(count, 1), matching.size());
            List<String> page = List.copyOf(matching.subList(0, to));
            String next = to >= matching.size() ? ScanPage.START : CURSOR_PREFIX + page.get(page.size() - 1);
            return new ScanPage(next, page);
        });
    }

    /**
     * Remove every value whose TTL has elapsed.
     *
     * @return number of values removed
     */
    public int purgeExpired() {
        synchronized (lock) {
            Instant now = clock.instant();
            int before = values.size();
            values.entrySet().removeIf(entry -> entry.getValue().isExpired(now));
            int removed = before - values.size();
            if (removed > 0) {
                LOG.debugf("Cleaned up %d expired entries", removed);
            }
            return removed;
        }
    }

    /**
     * Shuts down the cleanup executor.
     */
    public void shutdown() {
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Number of live keys (values and indices).
     */
    public int size() {
        synchronized (lock) {
            Instant now = clock.instant();
            long liveValues =
                    values.values().stream().filter(e -> !e.isExpired(now)).count();
            return (int) liveValues + indices.size();
        }
    }

    /**
     * Sorted snapshot of every live key and its content, for comparing store states
     * in tests. Index content is rendered as {@code member=score} pairs in index order.
     */
    public Map<String, String> dump() {
        synchronized (lock) {
            Instant now = clock.instant();
            Map<String, String> snapshot = new TreeMap<>();
            values.forEach((key, entry) -> {
                if (!entry.isExpired(now)) {
                    snapshot.put(key, entry.value() + " @" + entry.expiresAt());
                }
            });
            indices.forEach((key, index) -> snapshot.put(key, new TreeMap<>(index).toString()));
            return snapshot;
        }
    }

    /**
     * Clear all entries (for testing).
     */
    public void clear() {
        synchronized (lock) {
            values.clear();
            indices.clear();
        }
    }

    private <T> Uni<T> locked(Supplier<T> operation) {
        return Uni.createFrom().item(() -> {
            synchronized (lock) {
                return operation.get();
            }
        });
    }

    private String liveValue(String key) {
        ValueEntry entry = values.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(clock.instant())) {
            values.remove(key);
            return null;
        }
        return entry.value();
    }

    private static String parseCursor(String cursor) {
        if (cursor == null || ScanPage.START.equals(cursor)) {
            return null;
        }
        if (!cursor.startsWith(CURSOR_PREFIX)) {
            throw new IllegalArgumentException("Invalid scan cursor: " + cursor);
        }
        return cursor.substring(CURSOR_PREFIX.length());
    }

    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString());
    }

    private record ValueEntry(String value, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
