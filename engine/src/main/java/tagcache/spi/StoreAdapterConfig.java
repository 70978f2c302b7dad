package tagcache.spi;

import java.util.Optional;

/**
 * Per-store settings handed to a {@link BackingStoreProvider}.
 *
 * <p>Each store reads its own properties under {@code tagcache.store.<store>.}, so
 * {@code property("caffeine", "max-entries")} resolves
 * {@code tagcache.store.caffeine.max-entries}.
 */
public interface StoreAdapterConfig {

    String PREFIX = "tagcache.store.";

    /**
     * Look up a raw property of one store.
     *
     * @param store the store name, as returned by {@link BackingStoreProvider#name()}
     * @param name the property name within the store's section
     * @return the value, if configured
     */
    Optional<String> property(String store, String name);

    /**
     * Look up a numeric property of one store.
     *
     * @param store the store name
     * @param name the property name within the store's section
     * @return the value, if configured
     * @throws StoreProviderException if the value is not a whole number
     */
    default Optional<Long> longProperty(String store, String name) {
        return property(store, name).map(value -> {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                throw new StoreProviderException(
                        "Store setting " + key(store, name) + " must be a whole number, got: " + value, e);
            }
        });
    }

    static String key(String store, String name) {
        return PREFIX + store + "." + name;
    }
}
