package tagcache.adapter.in.dto;

/**
 * Outcome of deleting a key, or of clearing the cache when {@code key} is null.
 */
public record KeyDeletionDto(String key, boolean deleted, int count) {}
