package warden.adapter.in.rest;

import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.quarkus.security.identity.SecurityIdentity;
import org.jboss.logging.Logger;

import warden.adapter.in.problem.WardenProblem;
import warden.core.config.LoginRateLimitConfig;
import warden.core.config.PasswordResetConfig;
import warden.core.model.ratelimit.RateLimitStatus;
import warden.core.model.ratelimit.ScopeStatus;
import warden.core.service.ratelimit.LoginRateLimitService;
import warden.core.service.ratelimit.PasswordResetRateLimiter;

/**
 * REST resource for rate limit administration.
 *
 * <p>
 * Provides endpoints for:
 * <ul>
 * <li>Checking login attempt status for an identifier</li>
 * <li>Unlocking a login identifier</li>
 * <li>Checking password reset status for an email or IP</li>
 * <li>Clearing all password reset limits</li>
 * </ul>
 */
@Path("/admin/rate-limits")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@RolesAllowed(AdminRoles.ADMIN)
public class RateLimitResource {

    private static final Logger LOG = Logger.getLogger(RateLimitResource.class);

    private final LoginRateLimitService loginRateLimits;
    private final PasswordResetRateLimiter resetRateLimits;
    private final LoginRateLimitConfig loginConfig;
    private final PasswordResetConfig resetConfig;
    private final SecurityIdentity identity;

    @Inject
    public RateLimitResource(
            LoginRateLimitService loginRateLimits,
            PasswordResetRateLimiter resetRateLimits,
            LoginRateLimitConfig loginConfig,
            PasswordResetConfig resetConfig,
            SecurityIdentity identity) {
        this.loginRateLimits = loginRateLimits;
        this.resetRateLimits = resetRateLimits;
        this.loginConfig = loginConfig;
        this.resetConfig = resetConfig;
        this.identity = identity;
    }

    @GET
    @Path("/login/{identifier}")
    public Response getLoginStatus(@PathParam("identifier") String identifier) {
        if (!loginConfig.enabled()) {
            throw WardenProblem.featureDisabled("Login rate limiting");
        }
        final RateLimitStatus status = loginRateLimits.getRateLimitStatus(identifier);
        final var response = new LinkedHashMap<String, Object>();
        response.put("identifier", identifier);
        response.put("attempts", status.attempts());
        response.put("remainingAttempts", status.remainingAttempts());
        response.put("maxAttempts", loginConfig.maxAttempts());
        if (status.lockedUntil() != null) {
            response.put("lockedUntil", status.lockedUntil().toString());
        }
        if (status.nextAttemptAllowed() != null) {
            response.put("nextAttemptAllowed", status.nextAttemptAllowed().toString());
        }
        return Response.ok(response).build();
    }

    /**
     * Unlock a login identifier.
     *
     * @param identifier email, username or IP
     * @return 204 No Content
     */
    @DELETE
    @Path("/login/{identifier}")
    public Response clearLoginRateLimit(@PathParam("identifier") String identifier) {
        if (!loginConfig.enabled()) {
            throw WardenProblem.featureDisabled("Login rate limiting");
        }
        final var operator = identity.getPrincipal().getName();
        LOG.infof("Clearing login rate limit: identifier=%s, operator=%s", identifier, operator);
        loginRateLimits.clearRateLimit(identifier, operator);
        return Response.noContent().build();
    }

    @GET
    @Path("/reset/emails/{email}")
    public Response getEmailStatus(@PathParam("email") String email) {
        if (!resetConfig.enabled()) {
            throw WardenProblem.featureDisabled("Password reset rate limiting");
        }
        final var status = resetRateLimits.getEmailStatus(email);
        return Response.ok(format("email", email, status, resetConfig.maxRequestsPerEmail()))
                .build();
    }

    @GET
    @Path("/reset/ips/{ip}")
    public Response getIpStatus(@PathParam("ip") String ip) {
        if (!resetConfig.enabled()) {
            throw WardenProblem.featureDisabled("Password reset rate limiting");
        }
        return Response.ok(format("ip", ip, resetRateLimits.getIpStatus(ip), resetConfig.maxRequestsPerIp()))
                .build();
    }

    /**
     * Clear every password reset counter and suspicious marker (emergency use only).
     *
     * @param request request body with force flag
     * @return 204 No Content
     */
    @POST
    @Path("/reset:clear")
    @Consumes(MediaType.APPLICATION_JSON)
    public Response clearResetRateLimits(ClearAllRequest request) {
        if (request == null || !request.force()) {
            throw WardenProblem.badRequest("Must set force=true to clear all password reset limits");
        }
        LOG.warnf(
                "Clearing ALL password reset limits: operator=%s, reason=%s",
                identity.getPrincipal().getName(), request.reason());
        resetRateLimits.reset();
        return Response.noContent().build();
    }

    private static Map<String, Object> format(String type, String value, ScopeStatus status, int limit) {
        final var response = new LinkedHashMap<String, Object>();
        response.put("type", type);
        response.put("value", value);
        response.put("attempts", status.attempts());
        response.put("limit", limit);
        response.put("waitSeconds", status.waitTime().toSeconds());
        response.put("suspicious", status.suspicious());
        return response;
    }

    /**
     * Request body for clearing all password reset limits.
     */
    public record ClearAllRequest(boolean force, String reason) {}
}
