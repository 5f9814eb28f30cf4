package appauth.core.port.out;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import appauth.core.model.storage.ScanPage;

/**
 * Outbound port over the remote key-value store holding sessions, user indices
 * and handshake state.
 *
 * <p>Every operation is a single round trip bounded by the backend timeout and
 * fails with {@link BackendUnavailableException} when the store cannot be reached
 * in time. Implementations never retry internally; all mutations are idempotent
 * at the key level, so callers may retry whole operations.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Values MUST disappear once their TTL elapses</li>
 *   <li>{@link #getAndDelete} MUST be atomic: two concurrent callers never both see the value</li>
 *   <li>{@link #removeFromIndexIfAbsent} MUST check and remove in one atomic step</li>
 *   <li>{@link #appendToIndex} MUST read the highest score and add in one atomic step</li>
 *   <li>An index whose last member is removed MUST disappear</li>
 *   <li>{@link #scan} MUST be cursor-paginated and never block the store for the whole key space</li>
 * </ul>
 *
 * <p>Built-in implementations: Redis (production) and an in-memory map (tests and development).
 */
public interface KeyValueBackend {

    /** Minimum score gap between appended index members (one millisecond in epoch seconds). */
    double APPEND_SCORE_STEP = 0.001;

    /**
     * Read a value.
     *
     * @param key full storage key
     * @return the value, or empty if absent or expired
     */
    Uni<Optional<String>> get(String key);

    /**
     * Write a value with a time-to-live, replacing any existing value.
     */
    Uni<Void> setWithTtl(String key, String value, Duration ttl);

    /**
     * Write a value only if the key does not exist yet.
     *
     * @return true if written, false if the key already existed
     */
    Uni<Boolean> setIfAbsentWithTtl(String key, String value, Duration ttl);

    /**
     * Overwrite a value only if the key still exists.
     *
     * <p>Used for renewals so that a concurrent delete is never undone.
     *
     * @return true if written, false if the key was gone
     */
    Uni<Boolean> replaceIfPresentWithTtl(String key, String value, Duration ttl);

    /**
     * Delete a key. Deleting an absent key is not an error.
     *
     * @return true if a key was removed
     */
    Uni<Boolean> delete(String key);

    Uni<Boolean> exists(String key);

    /**
     * Atomically read and delete a value (pop-once).
     *
     * @return the value if it was present, empty otherwise
     */
    Uni<Optional<String>> getAndDelete(String key);

    /**
     * Add a member to an ordered index. Re-adding an existing member updates its score.
     *
     * @param indexKey full index key
     * @param member member to add
     * @param score ordering score (lower sorts first)
     */
    Uni<Void> addToIndex(String indexKey, String member, double score);

    /**
     * Atomically add a member after every other member of an ordered index.
     *
     * <p>The stored score is {@code score}, raised to the highest score of any other
     * member plus {@link #APPEND_SCORE_STEP} when needed, so members appended within
     * the same clock tick still keep their insertion order.
     *
     * @param indexKey full index key
     * @param member member to add
     * @param score preferred ordering score
     */
    Uni<Void> appendToIndex(String indexKey, String member, double score);

    /**
     * Remove members from an index. Removing the last member removes the index key.
     *
     * @return number of members actually removed
     */
    Uni<Integer> removeFromIndex(String indexKey, List<String> members);

    /**
     * List index members ordered by ascending score (oldest first).
     */
    Uni<List<String>> indexMembers(String indexKey);

    /**
     * Atomically remove {@code member} from the index only if {@code guardKey} does not exist.
     *
     * <p>This is the re-verify-then-repair primitive: the absence check and the removal
     * cannot be separated by a concurrent write of {@code guardKey}.
     *
     * @return true if the member was removed
     */
    Uni<Boolean> removeFromIndexIfAbsent(String indexKey, String member, String guardKey);

    /**
     * Fetch one page of keys matching a glob pattern.
     *
     * @param pattern glob pattern ({@code *} wildcard)
     * @param cursor {@link ScanPage#START} to begin, or the cursor of the previous page
     * @param count page size hint
     */
    Uni<ScanPage> scan(String pattern, String cursor, int count);
}
