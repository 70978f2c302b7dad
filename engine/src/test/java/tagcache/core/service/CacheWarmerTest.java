package tagcache.core.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import tagcache.core.model.WarmupEntry;
import tagcache.core.port.out.WarmupSource;

@DisplayName("CacheWarmer")
@ExtendWith(MockitoExtension.class)
class CacheWarmerTest {

    private static final Duration TTL = Duration.ofHours(1);

    @Mock
    private TaggedCache cache;

    private static WarmupSource source(String name, List<WarmupEntry> entries) {
        return new WarmupSource() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public List<WarmupEntry> entries() {
                return entries;
            }
        };
    }

    private static WarmupSource failingSource() {
        return new WarmupSource() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public List<WarmupEntry> entries() {
                throw new IllegalStateException("database down");
            }
        };
    }

    @Test
    @DisplayName("should cache every entry with the warm-up TTL")
    void shouldCacheEveryEntry() {
        final var users = source(
                "users",
                List.of(
                        new WarmupEntry("user_list", List.of("a", "b"), Set.of("user")),
                        new WarmupEntry("user_1", "a", Set.of("user"))));
        final var warmer = new CacheWarmer(cache, List.of(users), true, TTL);

        assertEquals(2, warmer.warmUp());

        verify(cache).set("user_list", List.of("a", "b"), TTL, Set.of("user"));
        verify(cache).set("user_1", "a", TTL, Set.of("user"));
    }

    @Test
    @DisplayName("should skip a failing source and load the rest")
    void shouldSkipFailingSource() {
        final var passengers =
                source("passengers", List.of(new WarmupEntry("passenger_list", List.of(), Set.of("passenger"))));
        final var warmer = new CacheWarmer(cache, List.of(failingSource(), passengers), true, TTL);

        assertEquals(1, warmer.warmUp());

        verify(cache).set("passenger_list", List.of(), TTL, Set.of("passenger"));
    }

    @Test
    @DisplayName("should count the entries a source cached before it failed")
    void shouldCountEntriesBeforeFailure() {
        final var users = source(
                "users",
                List.of(
                        new WarmupEntry("user_1", "a", Set.of("user")),
                        new WarmupEntry("user_2", "b", Set.of("user")),
                        new WarmupEntry("user_3", "c", Set.of("user"))));
        lenient().doThrow(new IllegalStateException("store down")).when(cache).set("user_2", "b", TTL, Set.of("user"));
        final var warmer = new CacheWarmer(cache, List.of(users), true, TTL);

        assertEquals(1, warmer.warmUp());

        verify(cache).set("user_1", "a", TTL, Set.of("user"));
        verify(cache, never()).set("user_3", "c", TTL, Set.of("user"));
    }

    @Test
    @DisplayName("should load only the selected sources")
    void shouldLoadOnlySelectedSources() {
        final var users = source("users", List.of(new WarmupEntry("user_1", "a", Set.of("user"))));
        final var passengers =
                source("passengers", List.of(new WarmupEntry("passenger_1", "p", Set.of("passenger"))));
        final var warmer =
                new CacheWarmer(cache, List.of(users, passengers), true, TTL, List.of("passengers", "drivers"));

        assertEquals(1, warmer.warmUp());

        verify(cache).set("passenger_1", "p", TTL, Set.of("passenger"));
        verify(cache, never()).set("user_1", "a", TTL, Set.of("user"));
    }

    @Test
    @DisplayName("should do nothing when disabled")
    void shouldDoNothingWhenDisabled() {
        final var users = source("users", List.of(new WarmupEntry("user_1", "a", Set.of())));
        final var warmer = new CacheWarmer(cache, List.of(users), false, TTL);

        assertEquals(0, warmer.warmUp());

        verify(cache, never()).set(anyString(), any(), any(Duration.class), any());
    }
}
