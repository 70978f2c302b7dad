package tagcache.core.service;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.LongAdder;

import tagcache.core.model.CacheStatistics;

/**
 * Per-namespace hit and miss counters.
 *
 * <p>Counters only grow until an operator resets them. Increments racing a
 * reset may be lost; statistics are approximate by contract.
 */
final class HitMissCounters {

    private final ConcurrentMap<String, Counters> byNamespace = new ConcurrentHashMap<>();

    void hit(String namespace) {
        counters(namespace).hits.increment();
    }

    void miss(String namespace) {
        counters(namespace).misses.increment();
    }

    CacheStatistics snapshot(String namespace) {
        final var counters = byNamespace.get(namespace);
        if (counters == null) {
            return CacheStatistics.empty(namespace);
        }
        return new CacheStatistics(namespace, counters.hits.sum(), counters.misses.sum());
    }

    Map<String, CacheStatistics> snapshotAll() {
        final var result = new TreeMap<String, CacheStatistics>();
        byNamespace.keySet().forEach(namespace -> result.put(namespace, snapshot(namespace)));
        return result;
    }

    void reset() {
        byNamespace.clear();
    }

    void reset(String namespace) {
        byNamespace.remove(namespace);
    }

    private Counters counters(String namespace) {
        return byNamespace.computeIfAbsent(namespace, n -> new Counters());
    }

    private static final class Counters {
        private final LongAdder hits = new LongAdder();
        private final LongAdder misses = new LongAdder();
    }
}
