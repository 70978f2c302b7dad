package tagcache.adapter.in.health;

import java.time.Duration;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

import tagcache.core.model.StoreHealth;
import tagcache.core.port.out.StoreHealthIndicator;
import tagcache.core.service.TaggedCache;

/**
 * Readiness check for the backing store.
 *
 * <p>Reports DOWN when any store health indicator reports unhealthy or does not
 * answer within the check timeout. Index size is reported alongside.
 */
@Readiness
@ApplicationScoped
public class BackingStoreHealthCheck implements HealthCheck {

    private static final Logger LOG = Logger.getLogger(BackingStoreHealthCheck.class);

    static final Duration CHECK_TIMEOUT = Duration.ofSeconds(2);

    private final List<StoreHealthIndicator> indicators;
    private final TaggedCache cache;

    @Inject
    public BackingStoreHealthCheck(List<StoreHealthIndicator> indicators, TaggedCache cache) {
        this.indicators = indicators;
        this.cache = cache;
    }

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.builder().name("backing-store");
        builder.withData("store", cache.storeName());
        builder.withData("index.keys", cache.size());

        boolean up = true;
        for (StoreHealthIndicator indicator : indicators) {
            final var health = check(indicator);
            builder.withData(health.name() + ".status", health.healthy() ? "UP" : "DOWN");
            if (health.healthy()) {
                builder.withData(health.name() + ".latencyMs", health.latencyMs());
            } else {
                builder.withData(health.name() + ".message", String.valueOf(health.message()));
                up = false;
            }
        }

        return builder.status(up).build();
    }

    private StoreHealth check(StoreHealthIndicator indicator) {
        try {
            return indicator.check().await().atMost(CHECK_TIMEOUT);
        } catch (RuntimeException e) {
            LOG.warnv("Backing store health check failed: {0}", e.getMessage());
            return StoreHealth.unhealthy(cache.storeName(), e.getMessage());
        }
    }
}
