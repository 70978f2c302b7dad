package tagcache.core.service;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tagcache.core.exception.BackingStoreUnavailableException;
import tagcache.core.exception.CacheException;
import tagcache.core.exception.CacheTimeoutException;
import tagcache.core.port.out.CacheMetrics;

/**
 * Applies timeouts and failure translation to backing store calls.
 *
 * <p>Every store call made by the engine goes through {@link #await}, which
 * waits on the calling thread and turns the outcome into one of:
 * <ul>
 *   <li>the result, when the store answered in time</li>
 *   <li>{@link CacheTimeoutException}, when no answer arrived within the timeout</li>
 *   <li>{@link BackingStoreUnavailableException}, for any other store failure</li>
 * </ul>
 * Failures are never turned into empty results here; that policy belongs to the caller.
 *
 * <h2>Metrics</h2>
 * Records separate metrics for timeouts ({@code tagcache.store.timeouts}) and
 * non-timeout failures ({@code tagcache.store.failures}).
 */
final class StoreOperationGuard {

    private static final Logger LOG = Logger.getLogger(StoreOperationGuard.class);

    private final String storeName;
    private final CacheMetrics metrics;

    /**
     * Create a new guard.
     *
     * @param storeName the store name for logging, errors and metrics
     * @param metrics the metrics instance (may be null)
     */
    StoreOperationGuard(String storeName, CacheMetrics metrics) {
        this.storeName = storeName;
        this.metrics = metrics;
    }

    /**
     * Run a store operation and wait for its result.
     *
     * @param operation the store operation
     * @param operationName name for logging, errors and metrics
     * @param timeout maximum time to wait
     * @param <T> the result type
     * @return the operation result
     * @throws CacheTimeoutException if the operation did not complete in time
     * @throws BackingStoreUnavailableException if the operation failed
     */
    <T> T await(Uni<T> operation, String operationName, Duration timeout) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> {
                    LOG.warnv("Store operation timeout: {0} on {1} after {2}", operationName, storeName, timeout);
                    recordTimeout(operationName);
                    return new CacheTimeoutException(operationName, storeName, timeout);
                })
                .onFailure(error -> !(error instanceof CacheException))
                .transform(error -> {
                    LOG.warnv("Store operation failure: {0} on {1}: {2}", operationName, storeName, error.getMessage());
                    recordFailure(operationName);
                    return new BackingStoreUnavailableException(operationName, storeName, error);
                })
                .await()
                .indefinitely();
    }

    private void recordTimeout(String operationName) {
        if (metrics != null) {
            metrics.recordStoreTimeout(storeName, operationName);
        }
    }

    private void recordFailure(String operationName) {
        if (metrics != null) {
            metrics.recordStoreFailure(storeName, operationName);
        }
    }
}
