package tagcache.adapter.out.store.memory;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import tagcache.core.model.StoreHealth;
import tagcache.core.port.out.BackingStore;
import tagcache.core.port.out.StoreHealthIndicator;
import tagcache.spi.BackingStoreProvider;
import tagcache.spi.StoreAdapterConfig;

/**
 * In-process Caffeine store provider.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>tagcache.store.caffeine.max-entries - maximum entries held (default: 100000)</li>
 * </ul>
 */
public class CaffeineStoreProvider implements BackingStoreProvider {

    static final String MAX_ENTRIES = "max-entries";
    static final long DEFAULT_MAX_ENTRIES = 100_000;

    @Override
    public String name() {
        return CaffeineBackingStore.NAME;
    }

    @Override
    public String description() {
        return "Caffeine in-process store";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public BackingStore createStore(StoreAdapterConfig config) {
        final long maxEntries = config.longProperty(name(), MAX_ENTRIES).orElse(DEFAULT_MAX_ENTRIES);
        return new CaffeineBackingStore(maxEntries);
    }

    @Override
    public Optional<StoreHealthIndicator> createHealthIndicator(StoreAdapterConfig config) {
        return Optional.of(() -> Uni.createFrom().item(StoreHealth.healthy(name(), 0)));
    }
}
