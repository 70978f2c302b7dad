package tagcache.adapter.out.store;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.Config;

import tagcache.spi.StoreAdapterConfig;

/**
 * Resolves store settings from MicroProfile Config, so they can come from
 * {@code application.properties}, environment variables or system properties.
 */
@ApplicationScoped
public class MicroProfileStoreAdapterConfig implements StoreAdapterConfig {

    private final Config config;

    @Inject
    public MicroProfileStoreAdapterConfig(Config config) {
        this.config = config;
    }

    @Override
    public Optional<String> property(String store, String name) {
        return config.getOptionalValue(StoreAdapterConfig.key(store, name), String.class);
    }
}
