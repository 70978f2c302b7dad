package tagcache.spi;

/**
 * Exception thrown when a backing store provider cannot be selected or initialized.
 */
public class StoreProviderException extends RuntimeException {

    public StoreProviderException(String message) {
        super(message);
    }

    public StoreProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
