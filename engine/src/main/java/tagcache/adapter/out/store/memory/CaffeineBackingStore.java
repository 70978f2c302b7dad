package tagcache.adapter.out.store.memory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import io.smallrye.mutiny.Uni;

import tagcache.core.port.out.BackingStore;

/**
 * Caffeine-backed in-process store with per-entry TTL.
 *
 * <p>Each payload expires after the TTL it was written with. The store is bounded;
 * entries evicted for size simply read as absent and the engine prunes their index
 * records lazily.
 *
 * <p>Payloads are copied on the way in and out, so no caller can alter a stored
 * value through a shared array.
 *
 * <p>This store lives and dies with the process. The Redis store keeps payloads
 * across restarts, but neither store makes entries visible to another engine
 * instance: liveness is decided by each instance's own tag index.
 */
public class CaffeineBackingStore implements BackingStore {

    public static final String NAME = "caffeine";

    private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

    private final Cache<String, StoredValue> cache;

    /**
     * Create a store using the system ticker.
     *
     * @param maxEntries the maximum number of entries held
     */
    public CaffeineBackingStore(long maxEntries) {
        this(maxEntries, Ticker.systemTicker());
    }

    /**
     * Create a store with an explicit time source.
     *
     * @param maxEntries the maximum number of entries held
     * @param ticker the time source used for expiry
     */
    public CaffeineBackingStore(long maxEntries, Ticker ticker) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive, got: " + maxEntries);
        }
        this.cache = Caffeine.newBuilder()
                .expireAfter(new PerEntryExpiry())
                .maximumSize(maxEntries)
                .ticker(ticker)
                .build();
    }

    private record StoredValue(byte[] payload, long ttlNanos) {}

    /**
     * Expiry policy honoring the TTL each payload was written with.
     */
    private static final class PerEntryExpiry implements Expiry<String, StoredValue> {
        @Override
        public long expireAfterCreate(String key, StoredValue value, long currentTime) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, StoredValue value, long currentTime, long currentDuration) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, StoredValue value, long currentTime, long currentDuration) {
            return currentDuration; // Don't change TTL on read
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Uni<Optional<byte[]>> rawGet(String key) {
        return Uni.createFrom().item(() -> Optional.ofNullable(cache.getIfPresent(key))
                .map(stored -> stored.payload().clone()));
    }

    @Override
    public Uni<Void> rawSet(String key, byte[] value, Duration ttl) {
        return Uni.createFrom().item(() -> {
            cache.put(key, new StoredValue(value.clone(), toNanosSaturated(ttl)));
            return null;
        });
    }

    // Caffeine caps expiry durations itself; only the conversion can overflow
    private static long toNanosSaturated(Duration ttl) {
        return ttl.compareTo(MAX_NANOS) >= 0 ? Long.MAX_VALUE : ttl.toNanos();
    }

    @Override
    public Uni<Boolean> rawDelete(String key) {
        return Uni.createFrom().item(() -> cache.asMap().remove(key) != null);
    }

    @Override
    public Uni<List<String>> rawScanByPrefix(String prefix) {
        return Uni.createFrom().item(() -> cache.asMap().keySet().stream()
                .filter(key -> key.startsWith(prefix))
                .toList());
    }

    @Override
    public void close() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    /**
     * Returns the estimated number of payloads held.
     *
     * @return estimated entry count
     */
    public long estimatedSize() {
        return cache.estimatedSize();
    }
}
