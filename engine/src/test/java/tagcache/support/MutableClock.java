package tagcache.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

import com.github.benmanes.caffeine.cache.Ticker;

/**
 * Clock whose time only moves when a test advances it.
 *
 * <p>{@link #ticker()} reads the same time, so a Caffeine store and the engine
 * agree on when entries expire.
 */
public final class MutableClock extends Clock {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private final AtomicReference<Instant> now = new AtomicReference<>(START);

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    @Override
    public Instant instant() {
        return now.get();
    }

    public void advance(Duration duration) {
        now.updateAndGet(current -> current.plus(duration));
    }

    public Ticker ticker() {
        return () -> Duration.between(START, now.get()).toNanos();
    }
}
