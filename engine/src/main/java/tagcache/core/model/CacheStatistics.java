package tagcache.core.model;

/**
 * Snapshot of hit/miss counters for one namespace.
 *
 * @param namespace the key namespace (prefix before the first separator)
 * @param hits      cumulative hits since start or last reset
 * @param misses    cumulative misses since start or last reset
 */
public record CacheStatistics(String namespace, long hits, long misses) {

    public static CacheStatistics empty(String namespace) {
        return new CacheStatistics(namespace, 0, 0);
    }

    public long requests() {
        return hits + misses;
    }

    /**
     * Fraction of lookups that were hits.
     *
     * @return hit ratio between 0.0 and 1.0, or 0.0 when nothing was looked up
     */
    public double hitRatio() {
        final var total = requests();
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
