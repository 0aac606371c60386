package warden.adapter.in.rest;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.quarkus.security.identity.SecurityIdentity;
import io.smallrye.mutiny.Uni;

import warden.adapter.in.problem.WardenProblem;
import warden.core.model.RiskLevel;
import warden.core.model.audit.AuditEventType;
import warden.core.model.audit.AuditLogEntry;
import warden.core.model.audit.AuditQuery;
import warden.core.model.audit.AuditResult;
import warden.core.model.audit.AuditSinkHealth;
import warden.core.model.audit.AuditStats;
import warden.core.model.audit.AuditTimeframe;
import warden.core.service.audit.AuditLogger;

/**
 * REST resource for the audit trail.
 *
 * <p>
 * Query, statistics and review of audit entries, plus the state of the audit sink.
 */
@Path("/admin/audit")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@RolesAllowed(AdminRoles.ADMIN)
public class AuditResource {

    private final AuditLogger auditLogger;
    private final SecurityIdentity identity;

    @Inject
    public AuditResource(AuditLogger auditLogger, SecurityIdentity identity) {
        this.auditLogger = auditLogger;
        this.identity = identity;
    }

    @GET
    public Uni<List<AuditLogEntry>> queryLogs(
            @QueryParam("userId") String userId,
            @QueryParam("eventType") String eventType,
            @QueryParam("result") String result,
            @QueryParam("riskLevel") String riskLevel,
            @QueryParam("from") String from,
            @QueryParam("to") String to,
            @QueryParam("requiresReview") Boolean requiresReview,
            @QueryParam("organizationId") String organizationId,
            @QueryParam("resourceType") String resourceType,
            @QueryParam("limit") @DefaultValue("50") int limit,
            @QueryParam("offset") @DefaultValue("0") int offset) {
        final var query = new AuditQuery(
                userId,
                parseEnum(AuditEventType.class, "eventType", eventType),
                parseEnum(AuditResult.class, "result", result),
                parseEnum(RiskLevel.class, "riskLevel", riskLevel),
                parseInstant("from", from),
                parseInstant("to", to),
                requiresReview,
                organizationId,
                resourceType,
                limit,
                offset);
        return auditLogger.queryLogs(query);
    }

    @GET
    @Path("/stats")
    public Uni<AuditStats> getStats(@QueryParam("timeframe") String timeframe) {
        return auditLogger.getAuditStats(AuditTimeframe.parse(timeframe));
    }

    /**
     * Mark an entry as reviewed by the calling operator.
     *
     * @param id      audit entry id
     * @param request optional body with review notes
     * @return 204 when updated, 404 when the entry does not exist
     */
    @POST
    @Path("/{id}/review")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> markReviewed(@PathParam("id") String id, ReviewRequest request) {
        final var reviewer = identity.getPrincipal().getName();
        final var notes = request != null ? request.notes() : null;
        return auditLogger.markAsReviewed(id, reviewer, notes).map(updated -> {
            if (!updated) {
                throw WardenProblem.resourceNotFound("Audit entry", id);
            }
            return Response.noContent().build();
        });
    }

    @GET
    @Path("/health")
    public Response getSinkHealth() {
        final AuditSinkHealth health = auditLogger.health();
        return Response.status(health.degraded() ? Response.Status.SERVICE_UNAVAILABLE : Response.Status.OK)
                .entity(Map.of(
                        "status", health.degraded() ? "DEGRADED" : "UP",
                        "fallbackWrites", health.fallbackWrites(),
                        "pendingWrites", health.pendingWrites(),
                        "lastFailureAt", health.lastFailureAt() != null ? health.lastFailureAt().toString() : "",
                        "lastFailureReason", health.lastFailureReason() != null ? health.lastFailureReason() : ""))
                .build();
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String name, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw WardenProblem.validationError("Unknown %s: %s".formatted(name, value));
        }
    }

    private static Instant parseInstant(String name, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw WardenProblem.validationError("%s must be an ISO-8601 instant".formatted(name));
        }
    }

    /**
     * Request body for reviewing an audit entry.
     */
    public record ReviewRequest(String notes) {}
}
