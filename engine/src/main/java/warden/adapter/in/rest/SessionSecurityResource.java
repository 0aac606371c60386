package warden.adapter.in.rest;

import java.util.List;
import java.util.Map;

import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import org.jboss.logging.Logger;

import warden.adapter.in.problem.WardenProblem;
import warden.core.model.analysis.ComplexityAnalysis;
import warden.core.model.analysis.ComplexityMetrics;
import warden.core.model.device.DeviceFingerprint;
import warden.core.model.device.DeviceStats;
import warden.core.model.session.SessionObservation;
import warden.core.model.session.SessionSecurityInfo;
import warden.core.model.session.SessionSecuritySummary;
import warden.core.service.analysis.SessionComplexityAnalyzer;
import warden.core.service.device.DeviceFingerprintRegistry;
import warden.core.service.session.SessionSecurityValidator;

/**
 * REST resource for session security administration.
 *
 * <p>
 * Exposes the validator's summary and per-user state, the complexity analysis and the
 * device registry. Device routes take the device identifier (email, or user id when the
 * session carries no email).
 */
@Path("/admin/sessions")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@RolesAllowed(AdminRoles.ADMIN)
public class SessionSecurityResource {

    private static final Logger LOG = Logger.getLogger(SessionSecurityResource.class);

    private final SessionSecurityValidator validator;
    private final SessionComplexityAnalyzer analyzer;
    private final DeviceFingerprintRegistry devices;

    @Inject
    public SessionSecurityResource(
            SessionSecurityValidator validator, SessionComplexityAnalyzer analyzer, DeviceFingerprintRegistry devices) {
        this.validator = validator;
        this.analyzer = analyzer;
        this.devices = devices;
    }

    @GET
    @Path("/summary")
    public SessionSecuritySummary getSummary() {
        return validator.getSecuritySummary();
    }

    @GET
    @Path("/complexity")
    public ComplexityAnalysis getGlobalComplexity() {
        return analyzer.analyzeSessionComplexity(null);
    }

    @GET
    @Path("/metrics")
    public ComplexityMetrics getGlobalMetrics() {
        return analyzer.getComplexityMetrics(null);
    }

    @GET
    @Path("/devices/stats")
    public DeviceStats getDeviceStats() {
        return devices.getStats();
    }

    @GET
    @Path("/{userId}")
    public SessionSecurityInfo getSessionInfo(@PathParam("userId") String userId) {
        return validator
                .getSessionSecurityInfo(userId)
                .orElseThrow(() -> WardenProblem.resourceNotFound("Session security info", userId));
    }

    @GET
    @Path("/{userId}/history")
    public List<SessionObservation> getHistory(@PathParam("userId") String userId) {
        return validator.getSessionHistory(userId);
    }

    @GET
    @Path("/{userId}/complexity")
    public ComplexityAnalysis getComplexity(@PathParam("userId") String userId) {
        return analyzer.analyzeSessionComplexity(userId);
    }

    @GET
    @Path("/{userId}/metrics")
    public ComplexityMetrics getMetrics(@PathParam("userId") String userId) {
        return analyzer.getComplexityMetrics(userId);
    }

    /**
     * Force re-authentication on the user's next validation.
     *
     * @param userId the user
     * @return 204 No Content
     */
    @POST
    @Path("/{userId}/reauth")
    public Response requireReauth(@PathParam("userId") String userId) {
        LOG.infof("Re-authentication required for %s by admin request", userId);
        validator.markReauthRequired(userId);
        return Response.noContent().build();
    }

    @GET
    @Path("/{identifier}/devices")
    public List<DeviceFingerprint> getDevices(@PathParam("identifier") String identifier) {
        return devices.getDevices(identifier);
    }

    @DELETE
    @Path("/{identifier}/devices/{hash}")
    public Response removeDevice(@PathParam("identifier") String identifier, @PathParam("hash") String hash) {
        if (!devices.removeDevice(identifier, hash)) {
            throw WardenProblem.resourceNotFound("Device", hash);
        }
        return Response.noContent().build();
    }

    @DELETE
    @Path("/{identifier}/devices")
    public Response clearDevices(@PathParam("identifier") String identifier) {
        final var removed = devices.clearDevices(identifier);
        return Response.ok(Map.of("identifier", identifier, "removed", removed)).build();
    }
}
