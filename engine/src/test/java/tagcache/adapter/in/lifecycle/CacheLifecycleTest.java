package tagcache.adapter.in.lifecycle;

import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import tagcache.core.service.CacheWarmer;
import tagcache.core.service.TaggedCache;

@DisplayName("CacheLifecycle")
@ExtendWith(MockitoExtension.class)
class CacheLifecycleTest {

    @Mock
    private TaggedCache cache;

    @Mock
    private CacheWarmer warmer;

    @Test
    @DisplayName("should start the cache before warming it")
    void shouldStartBeforeWarming() {
        when(warmer.warmUp()).thenReturn(2);

        new CacheLifecycle(cache, warmer).onStart(null);

        final var order = inOrder(cache, warmer);
        order.verify(cache).start();
        order.verify(warmer).warmUp();
    }
}
