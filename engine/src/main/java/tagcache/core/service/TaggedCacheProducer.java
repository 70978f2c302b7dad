package tagcache.core.service;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import tagcache.core.config.CacheSettings;
import tagcache.core.config.TaggedCacheConfig;
import tagcache.core.port.out.BackingStore;
import tagcache.core.port.out.CacheMetrics;
import tagcache.core.port.out.ValueCodec;

/**
 * Produces the shared {@link TaggedCache} instance and releases it on shutdown.
 */
@ApplicationScoped
public class TaggedCacheProducer {

    @Produces
    @Singleton
    public TaggedCache taggedCache(
            BackingStore store, ValueCodec codec, CacheMetrics metrics, TaggedCacheConfig config) {
        return new TaggedCache(store, codec, metrics, Clock.systemUTC(), CacheSettings.from(config));
    }

    void close(@Disposes TaggedCache cache) {
        cache.close();
    }
}
