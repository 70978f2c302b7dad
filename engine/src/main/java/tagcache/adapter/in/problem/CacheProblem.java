package tagcache.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import com.tietoevry.quarkus.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for cache errors.
 *
 * <p>Provides static factory methods that create {@link HttpProblem} instances
 * from quarkus-resteasy-problem for consistent error responses across the
 * admin endpoints.
 */
public final class CacheProblem {

    private CacheProblem() {
        // Utility class - prevent instantiation
    }

    public static HttpProblem validationError(String detail) {
        return HttpProblem.builder()
                .withTitle("Validation Error")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem storeUnavailable(String detail) {
        return HttpProblem.builder()
                .withTitle("Backing Store Unavailable")
                .withStatus(Status.SERVICE_UNAVAILABLE)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem storeTimeout(String detail) {
        return HttpProblem.builder()
                .withTitle("Backing Store Timeout")
                .withStatus(Status.GATEWAY_TIMEOUT)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem cacheClosed(String detail) {
        return HttpProblem.builder()
                .withTitle("Cache Closed")
                .withStatus(Status.SERVICE_UNAVAILABLE)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem internalError(String detail) {
        return HttpProblem.builder()
                .withTitle("Internal Server Error")
                .withStatus(Status.INTERNAL_SERVER_ERROR)
                .withDetail(detail)
                .build();
    }
}
