package warden.adapter.in.scheduling;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.service.audit.AuditLogger;
import warden.core.service.ratelimit.LoginRateLimitService;
import warden.core.service.ratelimit.PasswordResetRateLimiter;
import warden.spi.StorageProviderException;

/**
 * Periodic housekeeping.
 *
 * <p>Rate limit records and suspicious markers are also expired lazily on read, so a
 * skipped sweep only delays reclaiming memory.
 */
@ApplicationScoped
public class MaintenanceJobs {

    private static final Logger LOG = Logger.getLogger(MaintenanceJobs.class);

    private final LoginRateLimitService loginRateLimits;
    private final PasswordResetRateLimiter resetRateLimits;
    private final AuditLogger auditLogger;

    @Inject
    public MaintenanceJobs(
            LoginRateLimitService loginRateLimits, PasswordResetRateLimiter resetRateLimits, AuditLogger auditLogger) {
        this.loginRateLimits = loginRateLimits;
        this.resetRateLimits = resetRateLimits;
        this.auditLogger = auditLogger;
    }

    /**
     * Remove stale rate limit records and lapsed suspicious markers.
     */
    @Scheduled(
            every = "${warden.rate-limit.sweep-interval:10m}",
            delayed = "1m",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void sweepRateLimits() {
        sweep();
    }

    /**
     * @return number of removed entries, or -1 when the store was unavailable
     */
    int sweep() {
        try {
            final var removed = loginRateLimits.sweepExpired() + resetRateLimits.sweepExpired();
            if (removed > 0) {
                LOG.debugf("Rate limit sweep removed %d entries", removed);
            }
            return removed;
        } catch (StorageProviderException e) {
            LOG.warnf("Rate limit sweep skipped: %s", e.getMessage());
            return -1;
        }
    }

    /**
     * Archive audit entries past their retention.
     */
    @Scheduled(
            every = "${warden.audit.archive-interval:6h}",
            delayed = "5m",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    Uni<Void> archiveAuditEntries() {
        return auditLogger.archiveExpired().replaceWithVoid();
    }
}
