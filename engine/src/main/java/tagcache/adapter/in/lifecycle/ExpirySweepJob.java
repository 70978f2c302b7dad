package tagcache.adapter.in.lifecycle;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import org.jboss.logging.Logger;

import tagcache.core.config.TaggedCacheConfig;
import tagcache.core.service.TaggedCache;

/**
 * Periodically drops expired records from the tag index.
 *
 * <p>Expired entries already read as misses; the sweep keeps the index from
 * holding keys nobody reads again.
 */
@ApplicationScoped
public class ExpirySweepJob {

    private static final Logger LOG = Logger.getLogger(ExpirySweepJob.class);

    private final TaggedCache cache;
    private final boolean enabled;

    @Inject
    public ExpirySweepJob(TaggedCache cache, TaggedCacheConfig config) {
        this(cache, config.sweep().enabled());
    }

    ExpirySweepJob(TaggedCache cache, boolean enabled) {
        this.cache = cache;
        this.enabled = enabled;
    }

    @Scheduled(
            every = "${tagcache.sweep.interval:1m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void sweep() {
        if (!enabled) {
            return;
        }
        final var purged = cache.purgeExpired();
        if (purged > 0) {
            LOG.debugv("Expiry sweep dropped {0} index records", purged);
        }
    }
}
