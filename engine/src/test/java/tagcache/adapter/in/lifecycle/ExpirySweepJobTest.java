package tagcache.adapter.in.lifecycle;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import tagcache.core.service.TaggedCache;

@DisplayName("ExpirySweepJob")
@ExtendWith(MockitoExtension.class)
class ExpirySweepJobTest {

    @Mock
    private TaggedCache cache;

    @Test
    @DisplayName("should purge expired records when enabled")
    void shouldPurgeWhenEnabled() {
        when(cache.purgeExpired()).thenReturn(4);

        new ExpirySweepJob(cache, true).sweep();

        verify(cache).purgeExpired();
    }

    @Test
    @DisplayName("should do nothing when disabled")
    void shouldDoNothingWhenDisabled() {
        new ExpirySweepJob(cache, false).sweep();

        verify(cache, never()).purgeExpired();
    }
}
