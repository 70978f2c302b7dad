package tagcache.core.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import tagcache.adapter.out.codec.JacksonValueCodec;
import tagcache.adapter.out.store.memory.CaffeineBackingStore;
import tagcache.adapter.out.telemetry.NoOpCacheMetrics;
import tagcache.core.config.CacheSettings;
import tagcache.support.MutableClock;
import tagcache.support.User;

@DisplayName("TaggedCache under concurrent access")
class TaggedCacheConcurrencyTest {

    private static final Duration TTL = Duration.ofSeconds(300);

    private ExecutorService executor;
    private TaggedCache cache;
    private CaffeineBackingStore store;

    @BeforeEach
    void setUp() {
        final var clock = new MutableClock();
        executor = Executors.newFixedThreadPool(16);
        store = new CaffeineBackingStore(100_000, clock.ticker());
        cache = new TaggedCache(
                store,
                new JacksonValueCodec(new ObjectMapper()),
                NoOpCacheMetrics.INSTANCE,
                clock,
                CacheSettings.defaults());
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
        cache.close();
    }

    @Test
    @DisplayName("should cache overlapping write-throughs in commit order")
    void shouldCacheWriteThroughsInCommitOrder() throws Exception {
        final var database = new AtomicReference<String>();
        final var firstCommitted = new CountDownLatch(1);
        final var releaseFirst = new CountDownLatch(1);

        final var first = executor.submit(() -> cache.writeThrough("user_1", TTL, Set.of("user"), () -> {
            database.set("A");
            firstCommitted.countDown();
            releaseFirst.await(5, TimeUnit.SECONDS);
            return "A";
        }));
        assertTrue(firstCommitted.await(5, TimeUnit.SECONDS));

        final var second = executor.submit(() -> cache.writeThrough("user_1", TTL, Set.of("user"), () -> {
            database.set("B");
            return "B";
        }));
        try {
            second.get(200, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // Expected: the second writer waits for the first to finish
        }
        assertFalse(second.isDone());
        releaseFirst.countDown();
        first.get(5, TimeUnit.SECONDS);
        second.get(5, TimeUnit.SECONDS);

        assertEquals("B", database.get());
        assertEquals(Optional.of("B"), cache.get("user_1", String.class));
    }

    @Test
    @DisplayName("should keep exactly one of 100 concurrently written values")
    void shouldKeepOneOfConcurrentWrites() throws Exception {
        final var written = new HashSet<User>();
        final var start = new CountDownLatch(1);
        final var futures = new ArrayList<Future<?>>();
        for (int i = 0; i < 100; i++) {
            final var user = new User("1", "writer-" + i);
            written.add(user);
            futures.add(executor.submit(() -> {
                start.await();
                cache.set("user_1", user, TTL, Set.of("user", "writer-" + user.name()));
                return null;
            }));
        }

        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }

        final var result = cache.get("user_1", User.class).orElseThrow();
        assertTrue(written.contains(result));
        final var entry = cache.entry("user_1").orElseThrow();
        assertEquals(Set.of("user", "writer-" + result.name()), entry.tags());
        assertEquals(2, cache.tags().size());
    }

    @RepeatedTest(20)
    @DisplayName("should leave index and store consistent when set races invalidateTag")
    void shouldStayConsistentWhenSetRacesInvalidation() throws Exception {
        final var keys = new ArrayList<String>();
        for (int i = 0; i < 50; i++) {
            final var key = "user_" + i;
            keys.add(key);
            cache.set(key, new User(String.valueOf(i), "old"), TTL, Set.of("user"));
        }

        final var start = new CountDownLatch(1);
        final List<Future<?>> futures = new ArrayList<>();
        futures.add(executor.submit(() -> {
            start.await();
            return cache.invalidateTag("user");
        }));
        for (String key : keys) {
            futures.add(executor.submit(() -> {
                start.await();
                cache.set(key, new User(key, "new"), TTL, Set.of("user"));
                return null;
            }));
        }

        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }

        final var tagged = cache.keys("user");
        for (String key : keys) {
            final var indexed = cache.entry(key).isPresent();
            final var stored = store.rawGet("tagcache:entry:" + key).await().indefinitely().isPresent();
            assertEquals(indexed, stored, "index and store disagree for " + key);
            assertEquals(indexed, tagged.contains(key), "tag membership disagrees for " + key);
            cache.get(key, User.class).ifPresent(user -> assertEquals("new", user.name()));
        }
    }

    @Test
    @DisplayName("should not lose tag memberships under concurrent writes to distinct keys")
    void shouldKeepAllMembershipsForDistinctKeys() throws Exception {
        final var start = new CountDownLatch(1);
        final var futures = new ArrayList<Future<?>>();
        for (int i = 0; i < 500; i++) {
            final var key = "order_" + i;
            futures.add(executor.submit(() -> {
                start.await();
                cache.set(key, key, TTL, Set.of("order", "shared"));
                return null;
            }));
        }

        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }

        assertEquals(500, cache.keys("order").size());
        assertEquals(500, cache.keys("shared").size());
        assertEquals(500, cache.invalidateTag("shared").count());
        assertTrue(cache.tags().isEmpty());
    }
}
