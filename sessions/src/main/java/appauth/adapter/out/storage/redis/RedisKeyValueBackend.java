package appauth.adapter.out.storage.redis;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.sortedset.ReactiveSortedSetCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;

import appauth.core.model.storage.ScanPage;
import appauth.core.port.out.KeyValueBackend;

/**
 * Redis implementation of {@link KeyValueBackend}.
 *
 * <p>Records and handshake state are plain strings with a millisecond TTL; user
 * indices are sorted sets scored by creation time. Conditional writes use
 * {@code SET ... NX|XX}, pop-once uses {@code GETDEL}, and the guarded index
 * removal runs as a Lua script so the existence check and the {@code ZREM} are a
 * single atomic step. Appending to an index is scripted the same way, reading the
 * highest score and writing the new member together. Redis drops a sorted set when its last member is removed.
 */
public class RedisKeyValueBackend implements KeyValueBackend {

    static final String REMOVE_IF_ABSENT_SCRIPT = "if redis.call('EXISTS', KEYS[2]) == 0 then "
            + "return redis.call('ZREM', KEYS[1], ARGV[1]) "
            + "else return 0 end";

    static final String APPEND_SCRIPT = "local last = redis.call('ZRANGE', KEYS[1], -1, -1, 'WITHSCORES') "
            + "local score = tonumber(ARGV[2]) "
            + "if last[2] and last[1] ~= ARGV[1] then "
            + "local floor = tonumber(last[2]) + tonumber(ARGV[3]) "
            + "if floor > score then score = floor end "
            + "end "
            + "return redis.call('ZADD', KEYS[1], score, ARGV[1])";

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final ReactiveSortedSetCommands<String, String> sortedSetCommands;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisKeyValueBackend(ReactiveRedisDataSource redisDataSource, RedisTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.sortedSetCommands = redisDataSource.sortedSet(String.class, String.class);
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        var operation = valueCommands.get(key).map(Optional::ofNullable);
        return timeoutHelper.withTimeout(operation, "get");
    }

    @Override
    public Uni<Void> setWithTtl(String key, String value, Duration ttl) {
        var operation = valueCommands.psetex(key, ttl.toMillis(), value);
        return timeoutHelper.withTimeout(operation, "setWithTtl");
    }

    @Override
    public Uni<Boolean> setIfAbsentWithTtl(String key, String value, Duration ttl) {
        return timeoutHelper.withTimeout(conditionalSet(key, value, ttl, "NX"), "setIfAbsentWithTtl");
    }

    @Override
    public Uni<Boolean> replaceIfPresentWithTtl(String key, String value, Duration ttl) {
        return timeoutHelper.withTimeout(conditionalSet(key, value, ttl, "XX"), "replaceIfPresentWithTtl");
    }

    private Uni<Boolean> conditionalSet(String key, String value, Duration ttl, String condition) {
        // SET replies nil when the NX/XX condition prevented the write
        return redisDataSource
                .execute("SET", key, value, "PX", String.valueOf(ttl.toMillis()), condition)
                .map(response -> response != null);
    }

    @Override
    public Uni<Boolean> delete(String key) {
        var operation = keyCommands.del(key).map(removed -> removed > 0);
        return timeoutHelper.withTimeout(operation, "delete");
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return timeoutHelper.withTimeout(keyCommands.exists(key), "exists");
    }

    @Override
    public Uni<Optional<String>> getAndDelete(String key) {
        var operation = valueCommands.getdel(key).map(Optional::ofNullable);
        return timeoutHelper.withTimeout(operation, "getAndDelete");
    }

    @Override
    public Uni<Void> addToIndex(String indexKey, String member, double score) {
        var operation = sortedSetCommands.zadd(indexKey, score, member).replaceWithVoid();
        return timeoutHelper.withTimeout(operation, "addToIndex");
    }

    @Override
    public Uni<Void> appendToIndex(String indexKey, String member, double score) {
        var operation = redisDataSource
                .execute(
                        "EVAL",
                        APPEND_SCRIPT,
                        "1",
                        indexKey,
                        member,
                        String.valueOf(score),
                        String.valueOf(APPEND_SCORE_STEP))
                .replaceWithVoid();
        return timeoutHelper.withTimeout(operation, "appendToIndex");
    }

    @Override
    public Uni<Integer> removeFromIndex(String indexKey, List<String> members) {
        if (members.isEmpty()) {
            return Uni.createFrom().item(0);
        }
        var operation = sortedSetCommands.zrem(indexKey, members.toArray(new String[0]));
        return timeoutHelper.withTimeout(operation, "removeFromIndex");
    }

    @Override
    public Uni<List<String>> indexMembers(String indexKey) {
        return timeoutHelper.withTimeout(sortedSetCommands.zrange(indexKey, 0, -1), "indexMembers");
    }

    @Override
    public Uni<Boolean> removeFromIndexIfAbsent(String indexKey, String member, String guardKey) {
        var operation = redisDataSource
                .execute("EVAL", REMOVE_IF_ABSENT_SCRIPT, "2", indexKey, guardKey, member)
                .map(response -> response != null && response.toInteger() > 0);
        return timeoutHelper.withTimeout(operation, "removeFromIndexIfAbsent");
    }

    @Override
    public Uni<ScanPage> scan(String pattern, String cursor, int count) {
        var operation = redisDataSource
                .execute("SCAN", cursor, "MATCH", pattern, "COUNT", String.valueOf(count))
                .map(RedisKeyValueBackend::toScanPage);
        return timeoutHelper.withTimeout(operation, "scan");
    }

    static ScanPage toScanPage(Response response) {
        String next = response.get(0).toString();
        List<String> keys = new ArrayList<>();
        for (Response key : response.get(1)) {
            keys.add(key.toString());
        }
        return new ScanPage(next, keys);
    }
}
