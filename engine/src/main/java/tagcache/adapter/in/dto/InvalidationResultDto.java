package tagcache.adapter.in.dto;

import java.util.List;

import tagcache.core.model.InvalidationResult;

/**
 * Keys removed by a tag invalidation.
 */
public record InvalidationResultDto(String tag, List<String> invalidatedKeys, int count) {

    public static InvalidationResultDto fromModel(InvalidationResult result) {
        return new InvalidationResultDto(result.tag(), result.keys(), result.count());
    }
}
