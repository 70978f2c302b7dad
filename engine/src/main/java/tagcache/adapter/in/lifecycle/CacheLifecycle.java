package tagcache.adapter.in.lifecycle;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import tagcache.core.service.CacheWarmer;
import tagcache.core.service.TaggedCache;

/**
 * Starts the cache at application startup.
 *
 * <p>Removes store entries left without an index record by a previous run,
 * then loads the configured warm-up sources.
 */
@ApplicationScoped
public class CacheLifecycle {

    private static final Logger LOG = Logger.getLogger(CacheLifecycle.class);

    private final TaggedCache cache;
    private final CacheWarmer warmer;

    @Inject
    public CacheLifecycle(TaggedCache cache, CacheWarmer warmer) {
        this.cache = cache;
        this.warmer = warmer;
    }

    void onStart(@Observes StartupEvent event) {
        cache.start();
        final var warmed = warmer.warmUp();
        if (warmed > 0) {
            LOG.infov("Warmed {0} cache entries", warmed);
        }
    }
}
