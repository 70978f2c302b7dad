package tagcache.adapter.in.dto;

import java.util.List;
import java.util.Set;

/**
 * A tag and the keys currently carrying it.
 */
public record TagDto(String tag, List<String> keys, int count) {

    public static TagDto of(String tag, Set<String> keys) {
        final var sorted = keys.stream().sorted().toList();
        return new TagDto(tag, sorted, sorted.size());
    }
}
