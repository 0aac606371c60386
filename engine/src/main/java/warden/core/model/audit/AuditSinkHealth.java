package warden.core.model.audit;

import java.time.Instant;

/**
 * Availability of the audit sink.
 *
 * <p>The sink is degraded while the most recent persistence attempt failed and entries are
 * going to the fallback log.
 *
 * @param degraded          whether writes are currently falling back
 * @param fallbackWrites    entries written to the fallback log since startup
 * @param lastFailureAt     time of the most recent persistence failure
 * @param lastFailureReason message of the most recent persistence failure
 * @param pendingWrites     entries queued but not yet persisted
 */
public record AuditSinkHealth(
        boolean degraded, long fallbackWrites, Instant lastFailureAt, String lastFailureReason, int pendingWrites) {

    public static AuditSinkHealth healthy() {
        return new AuditSinkHealth(false, 0, null, null, 0);
    }
}
