package tagcache.adapter.in.rest;

import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import org.jboss.logging.Logger;

import tagcache.adapter.in.dto.CacheOverviewDto;
import tagcache.adapter.in.dto.CacheStatisticsDto;
import tagcache.adapter.in.dto.InvalidationResultDto;
import tagcache.adapter.in.dto.KeyDeletionDto;
import tagcache.adapter.in.dto.TagDto;
import tagcache.core.service.TaggedCache;

/**
 * REST resource for cache administration.
 *
 * <p>
 * Provides endpoints for:
 * <ul>
 * <li>Reading and resetting hit/miss statistics</li>
 * <li>Listing tags and the keys carrying them</li>
 * <li>Invalidating a tag, deleting a key, or clearing the cache</li>
 * </ul>
 *
 * <p>
 * Methods block on the backing store and therefore run on worker threads.
 */
@Path("/admin/cache")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class CacheAdminResource {

    private static final Logger LOG = Logger.getLogger(CacheAdminResource.class);

    private final TaggedCache cache;

    public CacheAdminResource(TaggedCache cache) {
        this.cache = cache;
    }

    @GET
    @Path("/stats")
    public CacheOverviewDto statistics() {
        final var namespaces = cache.statistics().values().stream()
                .map(CacheStatisticsDto::fromModel)
                .toList();
        return new CacheOverviewDto(cache.storeName(), cache.size(), cache.tags().size(), namespaces);
    }

    @GET
    @Path("/stats/{namespace}")
    public CacheStatisticsDto namespaceStatistics(@PathParam("namespace") String namespace) {
        return CacheStatisticsDto.fromModel(cache.statistics(namespace));
    }

    /**
     * Reset hit/miss counters.
     *
     * @param namespace the namespace to reset, or null for all namespaces
     * @return the reset scope
     */
    @POST
    @Path("/stats/reset")
    public Map<String, String> resetStatistics(@QueryParam("namespace") String namespace) {
        if (namespace == null || namespace.isBlank()) {
            cache.resetStatistics();
            LOG.info("Reset cache statistics for all namespaces");
            return Map.of("reset", "all");
        }
        cache.resetStatistics(namespace);
        LOG.infov("Reset cache statistics for namespace {0}", namespace);
        return Map.of("reset", namespace);
    }

    @GET
    @Path("/tags")
    public List<TagDto> tags() {
        return cache.tags().stream().sorted().map(tag -> TagDto.of(tag, cache.keys(tag))).toList();
    }

    @GET
    @Path("/tags/{tag}")
    public TagDto tag(@PathParam("tag") String tag) {
        return TagDto.of(tag, cache.keys(tag));
    }

    @DELETE
    @Path("/tags/{tag}")
    public InvalidationResultDto invalidateTag(@PathParam("tag") String tag) {
        final var result = cache.invalidateTag(tag);
        LOG.infov("Admin invalidated tag {0}: {1} entries", tag, result.count());
        return InvalidationResultDto.fromModel(result);
    }

    @DELETE
    @Path("/keys/{key}")
    public KeyDeletionDto deleteKey(@PathParam("key") String key) {
        final var deleted = cache.delete(key);
        LOG.infov("Admin deleted key {0} (existed: {1})", key, deleted);
        return new KeyDeletionDto(key, deleted, deleted ? 1 : 0);
    }

    @DELETE
    public KeyDeletionDto clear() {
        final var removed = cache.clear();
        LOG.infov("Admin cleared cache: {0} entries", removed);
        return new KeyDeletionDto(null, removed > 0, removed);
    }
}
