package tagcache.adapter.out.store;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import tagcache.core.port.out.BackingStore;
import tagcache.core.port.out.StoreHealthIndicator;
import tagcache.spi.BackingStoreProvider;
import tagcache.spi.StoreAdapterConfig;
import tagcache.spi.StoreProviderException;

/**
 * Discovers and loads backing store providers via ServiceLoader.
 *
 * <p>Provider selection:
 * <ol>
 *   <li>If tagcache.store.provider is set, use that provider</li>
 *   <li>Otherwise, select the highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class BackingStoreProviderLoader {

    private static final Logger LOG = Logger.getLogger(BackingStoreProviderLoader.class);

    private final Optional<String> configuredProvider;
    private final StoreAdapterConfig config;

    private BackingStoreProvider provider;

    @Inject
    public BackingStoreProviderLoader(
            @ConfigProperty(name = "tagcache.store.provider") Optional<String> configuredProvider,
            StoreAdapterConfig config) {
        this.configuredProvider = configuredProvider;
        this.config = config;
    }

    @Produces
    @ApplicationScoped
    public BackingStore backingStore() {
        final var selected = provider();
        LOG.infof("Creating backing store from provider: %s (%s)", selected.name(), selected.description());
        return selected.createStore(config);
    }

    @Produces
    @ApplicationScoped
    public List<StoreHealthIndicator> healthIndicators() {
        final var indicators = new ArrayList<StoreHealthIndicator>();
        provider().createHealthIndicator(config).ifPresent(indicators::add);
        return indicators;
    }

    /**
     * Resolve the provider to use, once.
     *
     * @return the selected provider
     * @throws StoreProviderException if none is found or the configured one is missing
     */
    synchronized BackingStoreProvider provider() {
        if (provider != null) {
            return provider;
        }

        final var providers = new ArrayList<BackingStoreProvider>();
        ServiceLoader.load(BackingStoreProvider.class).forEach(providers::add);

        if (providers.isEmpty()) {
            throw new StoreProviderException(
                    "No backing store providers found. Ensure a provider JAR is on the classpath.");
        }

        LOG.infof(
                "Found %d backing store provider(s): %s",
                providers.size(),
                providers.stream().map(BackingStoreProvider::name).toList());

        provider = selectProvider(providers, configuredProvider.orElse(null));
        return provider;
    }

    static BackingStoreProvider selectProvider(List<BackingStoreProvider> providers, String configured) {
        // Explicit configuration takes precedence
        if (configured != null && !configured.isBlank()) {
            return providers.stream()
                    .filter(p -> p.name().equals(configured))
                    .findFirst()
                    .orElseThrow(() -> new StoreProviderException("Configured backing store provider not found: "
                            + configured + ". Available: "
                            + providers.stream().map(BackingStoreProvider::name).toList()));
        }

        return providers.stream()
                .filter(BackingStoreProvider::isAvailable)
                .max(Comparator.comparingInt(BackingStoreProvider::priority))
                .orElseThrow(() -> new StoreProviderException("No available backing store providers"));
    }
}
