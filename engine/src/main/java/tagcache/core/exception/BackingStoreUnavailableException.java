package tagcache.core.exception;

/**
 * The backing store could not be reached or failed the operation.
 *
 * <p>Callers decide whether to treat this as a miss and fall back to the
 * system of record; the engine never does so on their behalf.
 */
public class BackingStoreUnavailableException extends CacheException {

    private final String operation;
    private final String store;

    public BackingStoreUnavailableException(String operation, String store, Throwable cause) {
        super("Backing store unavailable: " + operation + " on " + store
                + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""),
                cause);
        this.operation = operation;
        this.store = store;
    }

    /** Returns the name of the operation that failed. */
    public String getOperation() {
        return operation;
    }

    /** Returns the name of the backing store. */
    public String getStore() {
        return store;
    }
}
