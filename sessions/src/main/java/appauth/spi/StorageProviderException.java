package appauth.spi;

/**
 * Exception thrown when no storage provider can be selected or initialized.
 */
public class StorageProviderException extends RuntimeException {

    public StorageProviderException(String message) {
        super(message);
    }

    public StorageProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
