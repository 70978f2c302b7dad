package tagcache.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import com.tietoevry.quarkus.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import tagcache.core.exception.BackingStoreUnavailableException;
import tagcache.core.exception.CacheSerializationException;
import tagcache.core.exception.CacheTimeoutException;

/**
 * Exception mappers converting cache errors to RFC 7807 Problem Details.
 *
 * <p>A store timeout and an unavailable store map to different statuses so
 * callers can tell a slow store from a down one.
 */
@ApplicationScoped
public class CacheExceptionMappers {

    private static final Logger LOG = Logger.getLogger(CacheExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(CacheProblem.validationError(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapCacheTimeoutException(CacheTimeoutException e) {
        LOG.warnv("Backing store timeout: {0}", e.getMessage());
        return toResponse(CacheProblem.storeTimeout(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapBackingStoreUnavailableException(BackingStoreUnavailableException e) {
        LOG.warnv("Backing store unavailable: {0}", e.getMessage());
        return toResponse(CacheProblem.storeUnavailable(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapCacheSerializationException(CacheSerializationException e) {
        LOG.errorv(e, "Cached value could not be converted: {0}", e.getMessage());
        return toResponse(CacheProblem.internalError(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapIllegalStateException(IllegalStateException e) {
        LOG.debugv("State error: {0}", e.getMessage());
        return toResponse(CacheProblem.cacheClosed(e.getMessage()));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
