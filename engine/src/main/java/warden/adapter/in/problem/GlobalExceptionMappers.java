package warden.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import warden.core.config.RateLimitStoreConfig;
import warden.spi.StorageProviderException;

/**
 * Global exception mappers for converting exceptions to RFC 7807 Problem Details.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    private final RateLimitStoreConfig storeConfig;

    public GlobalExceptionMappers(RateLimitStoreConfig storeConfig) {
        this.storeConfig = storeConfig;
    }

    @ServerExceptionMapper
    public Response mapStorageProviderException(StorageProviderException e) {
        LOG.warnv("Storage unavailable: {0}", e.getMessage());
        return toResponse(WardenProblem.storeUnavailable(
                "Backing store unavailable", storeConfig.failClosedRetryAfter().toSeconds()));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(WardenProblem.validationError(e.getMessage()));
    }

    private Response toResponse(HttpProblem problem) {
        final var response = Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem);
        problem.getHeaders().forEach(response::header);
        return response.build();
    }
}
