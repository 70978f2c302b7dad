package tagcache.adapter.out.telemetry;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import tagcache.core.config.TaggedCacheConfig;
import tagcache.core.port.out.CacheMetrics;

/**
 * Records cache metrics using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code tagcache.requests} - Lookups by namespace and result (hit, miss)</li>
 *   <li>{@code tagcache.operation.duration} - Time spent in get, set and invalidateTag by namespace</li>
 *   <li>{@code tagcache.invalidations} - Tag invalidations by tag</li>
 *   <li>{@code tagcache.invalidated.entries} - Entries removed by tag invalidations</li>
 *   <li>{@code tagcache.store.timeouts} - Backing store timeouts by store and operation</li>
 *   <li>{@code tagcache.store.failures} - Backing store failures by store and operation</li>
 *   <li>{@code tagcache.index.keys} - Number of indexed keys</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerCacheMetrics implements CacheMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerCacheMetrics(MeterRegistry registry, TaggedCacheConfig config) {
        this(registry, config != null && config.metrics().enabled());
    }

    public MicrometerCacheMetrics(MeterRegistry registry, boolean enabled) {
        this.registry = registry;
        this.enabled = enabled;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordHit(String namespace) {
        recordLookup(namespace, "hit");
    }

    @Override
    public void recordMiss(String namespace) {
        recordLookup(namespace, "miss");
    }

    private void recordLookup(String namespace, String result) {
        if (!enabled) {
            return;
        }

        Counter.builder("tagcache.requests")
                .description("Cache lookups by outcome")
                .tag("namespace", namespace)
                .tag("result", result)
                .register(registry)
                .increment();
    }

    @Override
    public void recordOperation(String operation, String namespace, long durationNanos) {
        if (!enabled) {
            return;
        }

        Timer.builder("tagcache.operation.duration")
                .description("Time spent in cache operations, backing store calls included")
                .tag("operation", operation)
                .tag("namespace", namespace)
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void recordInvalidation(String tag, int keyCount) {
        if (!enabled) {
            return;
        }

        Counter.builder("tagcache.invalidations")
                .description("Tag invalidations performed")
                .tag("tag", tag)
                .register(registry)
                .increment();

        Counter.builder("tagcache.invalidated.entries")
                .description("Entries removed by tag invalidations")
                .tag("tag", tag)
                .register(registry)
                .increment(keyCount);
    }

    @Override
    public void recordStoreTimeout(String store, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("tagcache.store.timeouts")
                .description("Backing store operations that timed out")
                .tag("store", store)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreFailure(String store, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("tagcache.store.failures")
                .description("Backing store operations that failed")
                .tag("store", store)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void bindIndexSize(LongSupplier indexSize) {
        if (!enabled) {
            return;
        }

        Gauge.builder("tagcache.index.keys", indexSize::getAsLong)
                .description("Number of keys held in the tag index")
                .register(registry);
    }
}
