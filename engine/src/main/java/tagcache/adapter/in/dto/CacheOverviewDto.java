package tagcache.adapter.in.dto;

import java.util.List;

/**
 * Statistics of every namespace together with the index size.
 */
public record CacheOverviewDto(String store, int indexedKeys, int tags, List<CacheStatisticsDto> namespaces) {}
