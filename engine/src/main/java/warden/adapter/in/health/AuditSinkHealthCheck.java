package warden.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import warden.core.service.audit.AuditLogger;

/**
 * Readiness of the audit trail.
 *
 * <p>Reports DOWN while audit entries are going to the fallback log instead of the
 * repository. The first successful write after a failure brings it back UP.
 */
@Readiness
@ApplicationScoped
public class AuditSinkHealthCheck implements HealthCheck {

    private final AuditLogger auditLogger;

    @Inject
    public AuditSinkHealthCheck(AuditLogger auditLogger) {
        this.auditLogger = auditLogger;
    }

    @Override
    public HealthCheckResponse call() {
        final var health = auditLogger.health();
        HealthCheckResponseBuilder builder = HealthCheckResponse.builder().name("audit-sink");
        builder.withData("warden.audit.fallback.writes", health.fallbackWrites());
        builder.withData("warden.audit.pending.writes", health.pendingWrites());
        if (health.lastFailureAt() != null) {
            builder.withData("lastFailureAt", health.lastFailureAt().toString());
        }
        if (health.lastFailureReason() != null) {
            builder.withData("lastFailureReason", health.lastFailureReason());
        }
        return health.degraded() ? builder.down().build() : builder.up().build();
    }
}
