package tagcache.spi;

import java.util.Optional;

import tagcache.core.port.out.BackingStore;
import tagcache.core.port.out.StoreHealthIndicator;

/**
 * Service Provider Interface for backing store implementations.
 *
 * <p>Providers are discovered with {@link java.util.ServiceLoader}. Platform teams
 * implement this interface to plug another key-value store under the engine.
 */
public interface BackingStoreProvider {

    /**
     * Unique name identifying this provider.
     *
     * <p>Used in configuration: tagcache.store.provider={name}
     *
     * @return The provider name
     */
    String name();

    /**
     * Human-readable description of this provider.
     *
     * @return Description for logging and diagnostics
     */
    default String description() {
        return name() + " backing store";
    }

    /**
     * Priority for auto-selection when no explicit provider is configured.
     *
     * <p>Higher values = higher priority.
     *
     * @return The provider priority
     */
    default int priority() {
        return 0;
    }

    /**
     * Check if this provider is available (dependencies present, etc.)
     *
     * @return true if the provider can be used
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Create the store.
     *
     * <p>Called once at startup. The returned instance must be thread-safe.
     *
     * @param config Access to configuration properties
     * @return Store implementation
     * @throws StoreProviderException if initialization fails
     */
    BackingStore createStore(StoreAdapterConfig config);

    /**
     * Optionally provide a health indicator for the store.
     *
     * @param config Access to configuration properties
     * @return Health indicator, or empty if not supported
     */
    default Optional<StoreHealthIndicator> createHealthIndicator(StoreAdapterConfig config) {
        return Optional.empty();
    }
}
