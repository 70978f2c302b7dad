package tagcache.core.port.out;

import java.util.function.LongSupplier;

/**
 * Port interface for recording cache metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 * These metrics are cumulative and independent of the resettable statistics
 * the engine keeps for operators.
 */
public interface CacheMetrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record a cache hit.
     *
     * @param namespace the key namespace
     */
    void recordHit(String namespace);

    /**
     * Record a cache miss.
     *
     * @param namespace the key namespace
     */
    void recordMiss(String namespace);

    /**
     * Record how long a cache operation took, including backing store calls.
     *
     * @param operation the operation (get, set, invalidateTag)
     * @param namespace the namespace of the key or tag
     * @param durationNanos elapsed time in nanoseconds
     */
    void recordOperation(String operation, String namespace, long durationNanos);

    /**
     * Record a tag invalidation.
     *
     * @param tag the invalidated tag
     * @param keyCount number of entries removed
     */
    void recordInvalidation(String tag, int keyCount);

    /**
     * Record a backing store timeout.
     *
     * @param store the store name
     * @param operation the operation that timed out
     */
    void recordStoreTimeout(String store, String operation);

    /**
     * Record a backing store failure other than a timeout.
     *
     * @param store the store name
     * @param operation the operation that failed
     */
    void recordStoreFailure(String store, String operation);

    /**
     * Expose the number of indexed keys as a gauge.
     *
     * @param indexSize supplier of the current index size
     */
    void bindIndexSize(LongSupplier indexSize);
}
