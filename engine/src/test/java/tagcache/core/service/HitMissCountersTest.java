package tagcache.core.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tagcache.core.model.CacheStatistics;

@DisplayName("HitMissCounters")
class HitMissCountersTest {

    private final HitMissCounters counters = new HitMissCounters();

    @Test
    @DisplayName("should report zeros for an unseen namespace")
    void shouldReportZerosForUnseenNamespace() {
        assertEquals(CacheStatistics.empty("user"), counters.snapshot("user"));
        assertTrue(counters.snapshotAll().isEmpty());
    }

    @Test
    @DisplayName("should count hits and misses separately per namespace")
    void shouldCountSeparately() {
        counters.hit("user");
        counters.miss("user");
        counters.miss("user");
        counters.hit("passenger");

        assertEquals(new CacheStatistics("user", 1, 2), counters.snapshot("user"));
        assertEquals(List.of("passenger", "user"), List.copyOf(counters.snapshotAll().keySet()));
    }

    @Test
    @DisplayName("should not lose increments from concurrent callers")
    void shouldCountConcurrentIncrements() throws InterruptedException {
        final ExecutorService executor = Executors.newFixedThreadPool(8);
        for (int i = 0; i < 10_000; i++) {
            executor.execute(() -> counters.hit("user"));
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(10_000, counters.snapshot("user").hits());
    }

    @Test
    @DisplayName("should reset one namespace or all of them")
    void shouldReset() {
        counters.hit("user");
        counters.hit("passenger");

        counters.reset("user");
        assertEquals(0, counters.snapshot("user").hits());
        assertEquals(1, counters.snapshot("passenger").hits());

        counters.reset();
        assertTrue(counters.snapshotAll().isEmpty());
    }
}
