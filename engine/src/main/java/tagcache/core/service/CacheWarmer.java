package tagcache.core.service;

import java.time.Duration;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import tagcache.core.config.TaggedCacheConfig;
import tagcache.core.model.WarmupEntry;
import tagcache.core.port.out.WarmupSource;

/**
 * Preloads frequently read values so the first requests after startup hit.
 *
 * <p>A failing source is logged and skipped; the remaining sources still load, and
 * the entries it cached before failing stay cached and counted. When source names
 * are selected, only those sources are loaded.
 */
@ApplicationScoped
public class CacheWarmer {

    private static final Logger LOG = Logger.getLogger(CacheWarmer.class);

    private final TaggedCache cache;
    private final Iterable<WarmupSource> sources;
    private final boolean enabled;
    private final Duration ttl;
    private final Set<String> selected;

    @Inject
    public CacheWarmer(TaggedCache cache, @Any Instance<WarmupSource> sources, TaggedCacheConfig config) {
        this(
                cache,
                sources,
                config.warmup().enabled(),
                config.warmup().ttl(),
                config.warmup().sources().orElse(List.of()));
    }

    public CacheWarmer(TaggedCache cache, Iterable<WarmupSource> sources, boolean enabled, Duration ttl) {
        this(cache, sources, enabled, ttl, List.of());
    }

    /**
     * Create a warmer that loads only some of the sources.
     *
     * @param cache the cache to fill
     * @param sources every available source
     * @param enabled whether {@link #warmUp()} loads anything
     * @param ttl TTL of warmed entries
     * @param selected names of the sources to load; empty loads every source
     */
    public CacheWarmer(
            TaggedCache cache,
            Iterable<WarmupSource> sources,
            boolean enabled,
            Duration ttl,
            Collection<String> selected) {
        this.cache = cache;
        this.sources = sources;
        this.enabled = enabled;
        this.ttl = ttl;
        this.selected = Set.copyOf(selected);
    }

    /**
     * Load every warm-up source into the cache.
     *
     * @return number of entries cached
     */
    public int warmUp() {
        if (!enabled) {
            LOG.debug("Cache warm-up disabled");
            return 0;
        }

        var warmed = 0;
        final var seen = new HashSet<String>();
        for (WarmupSource source : sources) {
            seen.add(source.name());
            if (!selected.isEmpty() && !selected.contains(source.name())) {
                LOG.debugv("Skipping warm-up source {0}", source.name());
                continue;
            }
            var count = 0;
            try {
                for (WarmupEntry entry : source.entries()) {
                    cache.set(entry.key(), entry.value(), ttl, entry.tags());
                    count++;
                }
                LOG.infov("Warmed {0} entries from {1}", count, source.name());
            } catch (RuntimeException e) {
                LOG.warnv(e, "Cache warm-up source {0} failed after {1} entries", source.name(), count);
            }
            warmed += count;
        }
        for (String name : selected) {
            if (!seen.contains(name)) {
                LOG.warnv("Unknown cache warm-up source {0}", name);
            }
        }
        LOG.infov("Cache warm-up complete: {0} entries, TTL {1}", warmed, ttl);
        return warmed;
    }
}
