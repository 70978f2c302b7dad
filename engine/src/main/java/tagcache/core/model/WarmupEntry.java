package tagcache.core.model;

import java.util.Objects;
import java.util.Set;

/**
 * A value to preload into the cache at startup.
 */
public record WarmupEntry(String key, Object value, Set<String> tags) {

    public WarmupEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }
}
