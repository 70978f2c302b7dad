package tagcache.support;

/**
 * Sample cached value.
 */
public record User(String id, String name) {}
