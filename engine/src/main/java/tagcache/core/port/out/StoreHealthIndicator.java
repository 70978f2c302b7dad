package tagcache.core.port.out;

import io.smallrye.mutiny.Uni;

import tagcache.core.model.StoreHealth;

/**
 * Optional interface for backing store health checks.
 *
 * <p>Providers may implement this to expose health status via /q/health endpoints.
 */
public interface StoreHealthIndicator {

    /**
     * Check if the backing store is healthy.
     *
     * @return Uni with health status
     */
    Uni<StoreHealth> check();
}
