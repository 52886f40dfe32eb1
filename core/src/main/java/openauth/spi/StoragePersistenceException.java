package openauth.spi;

/**
 * Exception thrown when a storage backend cannot load or save its state.
 */
public class StoragePersistenceException extends RuntimeException {

    public StoragePersistenceException(String message) {
        super(message);
    }

    public StoragePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
