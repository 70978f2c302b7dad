package tagcache.adapter.out.store.redis;

import java.util.Optional;

import jakarta.enterprise.inject.spi.CDI;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;

import tagcache.core.model.StoreHealth;
import tagcache.core.port.out.BackingStore;
import tagcache.core.port.out.StoreHealthIndicator;
import tagcache.spi.BackingStoreProvider;
import tagcache.spi.StoreAdapterConfig;
import tagcache.spi.StoreProviderException;

/**
 * Redis backing store provider.
 *
 * <p>Redis connection is configured via Quarkus Redis properties:
 * <ul>
 *   <li>quarkus.redis.hosts - Redis server URL (default: redis://localhost:6379)</li>
 *   <li>quarkus.redis.password - Redis password (optional)</li>
 *   <li>quarkus.redis.database - Redis database index (default: 0)</li>
 * </ul>
 */
public class RedisStoreProvider implements BackingStoreProvider {

    static final String HEALTH_KEY = "tagcache:health:ping";

    private ReactiveRedisDataSource dataSource;

    @Override
    public String name() {
        return RedisBackingStore.NAME;
    }

    @Override
    public String description() {
        return "Redis shared store";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean isAvailable() {
        try {
            Class.forName("io.quarkus.redis.datasource.ReactiveRedisDataSource");
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }

    @Override
    public BackingStore createStore(StoreAdapterConfig config) {
        try {
            this.dataSource = CDI.current().select(ReactiveRedisDataSource.class).get();
        } catch (Exception e) {
            throw new StoreProviderException("Failed to obtain Redis data source from CDI", e);
        }
        return new RedisBackingStore(dataSource);
    }

    @Override
    public Optional<StoreHealthIndicator> createHealthIndicator(StoreAdapterConfig config) {
        return Optional.of(() -> {
            if (dataSource == null) {
                return Uni.createFrom().item(StoreHealth.unhealthy(name(), "Data source not initialized"));
            }

            final long start = System.currentTimeMillis();
            return dataSource
                    .value(String.class, String.class)
                    .get(HEALTH_KEY)
                    .map(result -> StoreHealth.healthy(name(), System.currentTimeMillis() - start))
                    .onFailure()
                    .recoverWithItem(e -> StoreHealth.unhealthy(name(), e.getMessage()));
        });
    }
}
