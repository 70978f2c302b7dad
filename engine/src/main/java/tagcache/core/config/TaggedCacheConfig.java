package tagcache.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the tagged cache engine.
 *
 * <p>Configuration prefix: {@code tagcache}
 *
 * <h2>Configuration Properties</h2>
 * <ul>
 *   <li>{@code tagcache.default-ttl} - TTL used when a caller does not pass one</li>
 *   <li>{@code tagcache.operation-timeout} - default timeout for backing store calls</li>
 *   <li>{@code tagcache.namespace-separator} - separator that ends a key's namespace</li>
 *   <li>{@code tagcache.key-prefix} - prefix of every key written to the store</li>
 *   <li>{@code tagcache.lock-stripes} - number of per-key lock stripes</li>
 * </ul>
 *
 * <p>The backing store itself is selected with {@code tagcache.store.provider}
 * and configured through provider-specific keys.
 */
@ConfigMapping(prefix = "tagcache")
public interface TaggedCacheConfig {

    /**
     * TTL applied when the caller does not specify one.
     *
     * @return default TTL (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration defaultTtl();

    /**
     * Maximum time to wait for a single backing store call.
     *
     * <p>Exceeding it raises {@code CacheTimeoutException} rather than a miss.
     *
     * @return operation timeout (default: 2 seconds)
     */
    @WithDefault("PT2S")
    Duration operationTimeout();

    /**
     * Separator ending the namespace part of a key, used for statistics.
     *
     * @return separator (default: "_")
     */
    @WithDefault("_")
    String namespaceSeparator();

    /**
     * Prefix of every key the engine writes to the backing store.
     *
     * @return key prefix (default: "tagcache:entry:")
     */
    @WithDefault("tagcache:entry:")
    String keyPrefix();

    /**
     * Number of lock stripes guarding per-key operations.
     *
     * @return stripe count (default: 64)
     */
    @WithDefault("64")
    int lockStripes();

    /**
     * Expiry sweep settings.
     */
    SweepConfig sweep();

    /**
     * Event-driven invalidation settings.
     */
    InvalidationConfig invalidation();

    /**
     * Startup warm-up settings.
     */
    WarmupConfig warmup();

    /**
     * Metrics settings.
     */
    MetricsConfig metrics();

    interface SweepConfig {

        /**
         * Whether the periodic index sweep runs.
         *
         * @return true to sweep (default: true)
         */
        @WithDefault("true")
        boolean enabled();
    }

    interface InvalidationConfig {

        /**
         * Tags invalidated in addition to the entity's own tag.
         *
         * <p>Example: {@code tagcache.invalidation.related-tags.passenger=user}
         * clears user caches whenever a passenger changes.
         *
         * @return entity type to related tags
         */
        Map<String, List<String>> relatedTags();
    }

    interface WarmupConfig {

        /**
         * Whether warm-up sources are loaded at startup.
         *
         * @return true to warm up (default: false)
         */
        @WithDefault("false")
        boolean enabled();

        /**
         * TTL of warmed entries.
         *
         * @return warm-up TTL (default: 1 hour)
         */
        @WithDefault("PT1H")
        Duration ttl();

        /**
         * Names of the warm-up sources to load. Unset loads every source.
         *
         * @return selected source names
         */
        Optional<List<String>> sources();
    }

    interface MetricsConfig {

        @WithDefault("true")
        boolean enabled();
    }
}
