package tagcache.core.exception;

import java.time.Duration;

/**
 * A backing store operation did not complete within its timeout.
 *
 * <p>Distinct from {@link BackingStoreUnavailableException}: the store may
 * still have applied the operation.
 */
public class CacheTimeoutException extends CacheException {

    private final String operation;
    private final String store;
    private final Duration timeout;

    public CacheTimeoutException(String operation, String store, Duration timeout) {
        super("Backing store timeout: " + operation + " on " + store + " after " + timeout);
        this.operation = operation;
        this.store = store;
        this.timeout = timeout;
    }

    /** Returns the name of the operation that timed out. */
    public String getOperation() {
        return operation;
    }

    /** Returns the name of the backing store. */
    public String getStore() {
        return store;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
