package tagcache.core.model;

/**
 * Key naming conventions shared by cache clients.
 *
 * <p>Collections are cached as {@code {entityType}_list} and single records as
 * {@code {entityType}_{id}}. Tags conventionally carry the entity type, so that
 * invalidating tag {@code user} clears {@code user_list} and every {@code user_{id}}.
 */
public final class CacheKeys {

    public static final String DEFAULT_SEPARATOR = "_";
    public static final String LIST_SUFFIX = "list";

    private CacheKeys() {}

    public static String list(String entityType) {
        return requireEntityType(entityType) + DEFAULT_SEPARATOR + LIST_SUFFIX;
    }

    public static String record(String entityType, Object id) {
        if (id == null) {
            throw new IllegalArgumentException("Record id must not be null");
        }
        return requireEntityType(entityType) + DEFAULT_SEPARATOR + id;
    }

    /**
     * Derive the statistics namespace of a key.
     *
     * @param key       the cache key
     * @param separator the namespace separator
     * @return the portion of the key before the first separator, or the whole key
     */
    public static String namespaceOf(String key, String separator) {
        if (separator == null || separator.isEmpty()) {
            return key;
        }
        final var index = key.indexOf(separator);
        return index <= 0 ? key : key.substring(0, index);
    }

    private static String requireEntityType(String entityType) {
        if (entityType == null || entityType.isBlank()) {
            throw new IllegalArgumentException("Entity type must not be blank");
        }
        return entityType;
    }
}
