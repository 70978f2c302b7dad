package tagcache.core.config;

import java.time.Duration;

import tagcache.core.model.CacheKeys;

/**
 * Resolved engine settings.
 *
 * <p>Decoupled from {@link TaggedCacheConfig} so the engine can be constructed
 * without a configuration source.
 */
public record CacheSettings(
        Duration defaultTtl,
        Duration operationTimeout,
        String namespaceSeparator,
        String keyPrefix,
        int lockStripes) {

    public CacheSettings {
        requirePositive(defaultTtl, "defaultTtl");
        requirePositive(operationTimeout, "operationTimeout");
        if (namespaceSeparator == null) {
            namespaceSeparator = CacheKeys.DEFAULT_SEPARATOR;
        }
        if (keyPrefix == null) {
            keyPrefix = "";
        }
        if (lockStripes < 1) {
            throw new IllegalArgumentException("lockStripes must be at least 1, got: " + lockStripes);
        }
    }

    public static CacheSettings defaults() {
        return new CacheSettings(
                Duration.ofMinutes(5), Duration.ofSeconds(2), CacheKeys.DEFAULT_SEPARATOR, "tagcache:entry:", 64);
    }

    public static CacheSettings from(TaggedCacheConfig config) {
        return new CacheSettings(
                config.defaultTtl(),
                config.operationTimeout(),
                config.namespaceSeparator(),
                config.keyPrefix(),
                config.lockStripes());
    }

    public CacheSettings withOperationTimeout(Duration timeout) {
        return new CacheSettings(defaultTtl, timeout, namespaceSeparator, keyPrefix, lockStripes);
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, got: " + duration);
        }
    }
}
