package appauth.core.port.out;

/**
 * The key-value backend could not be reached, or did not answer in time.
 *
 * <p>Transient and safe to retry at the level of a whole operation. It never
 * means "not found": absence is always reported as an empty result.
 */
public class BackendUnavailableException extends RuntimeException {

    private final String operation;

    public BackendUnavailableException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public BackendUnavailableException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    /** Returns the name of the backend operation that failed. */
    public String getOperation() {
        return operation;
    }
}
