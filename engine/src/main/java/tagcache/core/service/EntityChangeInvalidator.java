package tagcache.core.service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import tagcache.core.config.TaggedCacheConfig;
import tagcache.core.model.EntityChangedEvent;
import tagcache.core.model.InvalidationResult;

/**
 * Invalidates cache tags in response to domain mutations.
 *
 * <p>A change to an entity invalidates the tag named after its type plus any
 * related tags configured for that type, for example user caches that embed
 * passenger data. Observers run synchronously, so a cache failure reaches the
 * code that fired the event.
 */
@ApplicationScoped
public class EntityChangeInvalidator {

    private static final Logger LOG = Logger.getLogger(EntityChangeInvalidator.class);

    private final TaggedCache cache;
    private final Map<String, List<String>> relatedTags;

    @Inject
    public EntityChangeInvalidator(TaggedCache cache, TaggedCacheConfig config) {
        this(cache, config.invalidation().relatedTags());
    }

    public EntityChangeInvalidator(TaggedCache cache, Map<String, List<String>> relatedTags) {
        this.cache = cache;
        this.relatedTags = relatedTags == null ? Map.of() : Map.copyOf(relatedTags);
    }

    void onEntityChanged(@Observes EntityChangedEvent event) {
        invalidate(event);
    }

    /**
     * Invalidate the caches affected by a change.
     *
     * @param event the change
     * @return one result per invalidated tag, entity tag first
     */
    public List<InvalidationResult> invalidate(EntityChangedEvent event) {
        final var tags = new LinkedHashSet<String>();
        tags.add(event.entityType());
        tags.addAll(relatedTags.getOrDefault(event.entityType(), List.of()));

        final var results = cache.invalidateTags(tags);
        final var removed = results.stream().mapToInt(InvalidationResult::count).sum();
        LOG.infov(
                "Invalidated {0} entries for {1} {2} after {3} (tags {4})",
                removed,
                event.entityType(),
                event.entityId(),
                event.changeType(),
                tags);
        return results;
    }
}
