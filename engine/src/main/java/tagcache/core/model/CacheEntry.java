package tagcache.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Index-side view of a cached entry.
 *
 * <p>The payload itself lives in the backing store; this record carries what the
 * engine needs to decide liveness and tag membership for a key.
 *
 * @param key       the caller-defined cache key
 * @param expiresAt the instant after which the entry is treated as absent
 * @param tags      the tags the entry is registered under (possibly empty)
 */
public record CacheEntry(String key, Instant expiresAt, Set<String> tags) {

    public CacheEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(expiresAt, "expiresAt");
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    /**
     * Whether this entry is no longer live at the given instant.
     *
     * @param now the current instant
     * @return true once {@code now} has reached {@link #expiresAt()}
     */
    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }
}
