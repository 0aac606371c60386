package warden.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for admin endpoint errors.
 *
 * <p>All 4xx client errors are expected operator mistakes and are not logged as errors.
 */
public final class WardenProblem {

    private WardenProblem() {
        // Utility class - prevent instantiation
    }

    // ========== Not Found Errors ==========

    public static HttpProblem resourceNotFound(String resourceType, String resourceId) {
        return HttpProblem.builder()
                .withTitle("%s Not Found".formatted(resourceType))
                .withStatus(Status.NOT_FOUND)
                .withDetail("%s not found: %s".formatted(resourceType, resourceId))
                .build();
    }

    public static HttpProblem featureDisabled(String feature) {
        return HttpProblem.builder()
                .withTitle("Feature Disabled")
                .withStatus(Status.NOT_FOUND)
                .withDetail("%s is disabled".formatted(feature))
                .build();
    }

    // ========== Bad Request Errors ==========

    public static HttpProblem badRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem validationError(String detail) {
        return HttpProblem.builder()
                .withTitle("Validation Error")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    // ========== Server Errors ==========

    /**
     * Create a 503 problem for an unreachable backing store.
     *
     * @param detail            the error detail message
     * @param retryAfterSeconds seconds until the caller may retry
     * @return store unavailable problem
     */
    public static HttpProblem storeUnavailable(String detail, long retryAfterSeconds) {
        return HttpProblem.builder()
                .withTitle("Store Unavailable")
                .withStatus(Status.SERVICE_UNAVAILABLE)
                .withDetail(detail)
                .withHeader("Retry-After", retryAfterSeconds)
                .with("retryAfter", retryAfterSeconds)
                .build();
    }
}
