package appauth.mock;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.BiPredicate;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;

import appauth.core.model.storage.ScanPage;
import appauth.core.port.out.BackendUnavailableException;
import appauth.core.port.out.KeyValueBackend;

/**
 * Delegating backend that fails selected calls with {@link BackendUnavailableException}.
 *
 * <p>The failure predicate receives the operation name and its key (the cursor for
 * {@code scan}).
 */
public class FlakyKeyValueBackend implements KeyValueBackend {

    private final KeyValueBackend delegate;
    private volatile BiPredicate<String, String> failure = (operation, key) -> false;

    public FlakyKeyValueBackend(KeyValueBackend delegate) {
        this.delegate = delegate;
    }

    public void failWhen(BiPredicate<String, String> failure) {
        this.failure = failure;
    }

    public void failEverything() {
        failWhen((operation, key) -> true);
    }

    public void recover() {
        failWhen((operation, key) -> false);
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        return call("get", key, () -> delegate.get(key));
    }

    @Override
    public Uni<Void> setWithTtl(String key, String value, Duration ttl) {
        return call("setWithTtl", key, () -> delegate.setWithTtl(key, value, ttl));
    }

    @Override
    public Uni<Boolean> setIfAbsentWithTtl(String key, String value, Duration ttl) {
        return call("setIfAbsentWithTtl", key, () -> delegate.setIfAbsentWithTtl(key, value, ttl));
    }

    @Override
    public Uni<Boolean> replaceIfPresentWithTtl(String key, String value, Duration ttl) {
        return call("replaceIfPresentWithTtl", key, () -> delegate.replaceIfPresentWithTtl(key, value, ttl));
    }

    @Override
    public Uni<Boolean> delete(String key) {
        return call("delete", key, () -> delegate.delete(key));
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return call("exists", key, () -> delegate.exists(key));
    }

    @Override
    public Uni<Optional<String>> getAndDelete(String key) {
        return call("getAndDelete", key, () -> delegate.getAndDelete(key));
    }

    @Override
    public Uni<Void> addToIndex(String indexKey, String member, double score) {
        return call("addToIndex", indexKey, () -> delegate.addToIndex(indexKey, member, score));
    }

    @Override
    public Uni<Void> appendToIndex(String indexKey, String member, double score) {
        return call("appendToIndex", indexKey, () -> delegate.appendToIndex(indexKey, member, score));
    }

    @Override
    public Uni<Integer> removeFromIndex(String indexKey, List<String> members) {
        return call("removeFromIndex", indexKey, () -> delegate.removeFromIndex(indexKey, members));
    }

    @Override
    public Uni<List<String>> indexMembers(String indexKey) {
        return call("indexMembers", indexKey, () -> delegate.indexMembers(indexKey));
    }

    @Override
    public Uni<Boolean> removeFromIndexIfAbsent(String indexKey, String member, String guardKey) {
        return call(
                "removeFromIndexIfAbsent",
                indexKey,
                () -> delegate.removeFromIndexIfAbsent(indexKey, member, guardKey));
    }

    @Override
    public Uni<ScanPage> scan(String pattern, String cursor, int count) {
        return call("scan", cursor, () -> delegate.scan(pattern, cursor, count));
    }

    private <T> Uni<T> call(String operation, String key, Supplier<Uni<T>> target) {
        return Uni.createFrom().deferred(() -> {
            if (failure.test(operation, key)) {
                return Uni.createFrom().failure(new BackendUnavailableException(operation, "Simulated outage"));
            }
            return target.get();
        });
    }
}
