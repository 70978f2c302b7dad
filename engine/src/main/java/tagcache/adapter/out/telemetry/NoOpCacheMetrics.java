package tagcache.adapter.out.telemetry;

import java.util.function.LongSupplier;

import tagcache.core.port.out.CacheMetrics;

/**
 * No-operation metrics for when no meter registry is wired.
 */
public final class NoOpCacheMetrics implements CacheMetrics {

    public static final NoOpCacheMetrics INSTANCE = new NoOpCacheMetrics();

    private NoOpCacheMetrics() {}

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public void recordHit(String namespace) {}

    @Override
    public void recordMiss(String namespace) {}

    @Override
    public void recordOperation(String operation, String namespace, long durationNanos) {}

    @Override
    public void recordInvalidation(String tag, int keyCount) {}

    @Override
    public void recordStoreTimeout(String store, String operation) {}

    @Override
    public void recordStoreFailure(String store, String operation) {}

    @Override
    public void bindIndexSize(LongSupplier indexSize) {}
}
