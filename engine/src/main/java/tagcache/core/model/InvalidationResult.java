package tagcache.core.model;

import java.util.List;

/**
 * Outcome of invalidating a tag.
 *
 * @param tag  the invalidated tag
 * @param keys the keys whose entries were removed, in removal order
 */
public record InvalidationResult(String tag, List<String> keys) {

    public InvalidationResult {
        keys = keys == null ? List.of() : List.copyOf(keys);
    }

    public static InvalidationResult none(String tag) {
        return new InvalidationResult(tag, List.of());
    }

    public int count() {
        return keys.size();
    }
}
