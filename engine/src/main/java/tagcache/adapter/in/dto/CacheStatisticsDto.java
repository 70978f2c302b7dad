package tagcache.adapter.in.dto;

import tagcache.core.model.CacheStatistics;

/**
 * Hit/miss statistics of one namespace.
 */
public record CacheStatisticsDto(String namespace, long hits, long misses, long requests, double hitRatio) {

    public static CacheStatisticsDto fromModel(CacheStatistics statistics) {
        return new CacheStatisticsDto(
                statistics.namespace(),
                statistics.hits(),
                statistics.misses(),
                statistics.requests(),
                statistics.hitRatio());
    }
}
