package appauth.core.model.storage;

/**
 * Key layout shared with every existing deployment.
 *
 * <ul>
 *   <li>{@code <prefix>:sess:<sessionId>} - serialized session record</li>
 *   <li>{@code <prefix>:usess:<userKey>} - per-user index of session ids (sorted by creation time)</li>
 *   <li>{@code <prefix>:state:<stateToken>} - serialized handshake state</li>
 * </ul>
 *
 * <p>These formats must not change without a data migration.
 */
public final class StorageKeys {

    private static final String SESSION = "sess";
    private static final String USER_INDEX = "usess";
    private static final String STATE = "state";

    private final String prefix;

    public StorageKeys(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Key prefix must not be blank");
        }
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    public String session(String sessionId) {
        return key(SESSION, sessionId);
    }

    public String userIndex(String userKey) {
        return key(USER_INDEX, userKey);
    }

    public String state(String stateToken) {
        return key(STATE, stateToken);
    }

    /**
     * Glob pattern matching every user-index key, for SCAN MATCH.
     */
    public String userIndexPattern() {
        return key(USER_INDEX, "*");
    }

    /**
     * Extract the user key from a full user-index key.
     */
    public String userKeyOf(String userIndexKey) {
        String head = key(USER_INDEX, "");
        if (!userIndexKey.startsWith(head)) {
            throw new IllegalArgumentException("Not a user index key: " + userIndexKey);
        }
        return userIndexKey.substring(head.length());
    }

    private String key(String kind, String ident) {
        return prefix + ":" + kind + ":" + ident;
    }
}
