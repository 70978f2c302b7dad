package tagcache.core.model;

/**
 * Health status for backing stores.
 */
public record StoreHealth(boolean healthy, String name, String message, long latencyMs) {

    public static StoreHealth healthy(String name, long latencyMs) {
        return new StoreHealth(true, name, "OK", latencyMs);
    }

    public static StoreHealth unhealthy(String name, String message) {
        return new StoreHealth(false, name, message, -1);
    }
}
