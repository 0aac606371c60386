package warden.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import warden.core.model.audit.AuditLogEntry;
import warden.core.model.audit.AuditQuery;

/**
 * Inbound port for the append-only audit trail.
 *
 * <p>Logging never fails the caller: persistence happens off the caller's thread, and a
 * failed write lands in the fallback log instead of being dropped.
 */
public interface AuditTrail {

    /**
     * Record a security-relevant event.
     *
     * <p>Missing identity, retention and classification fields (risk level, confidence,
     * review flag) are filled in before the entry is queued for persistence.
     *
     * @param entry the event to record
     * @return the enriched entry as it will be persisted
     */
    AuditLogEntry logEvent(AuditLogEntry entry);

    /**
     * Query the trail, newest first.
     *
     * @param query filters and paging
     * @return matching entries, empty when the repository is unavailable
     */
    Uni<List<AuditLogEntry>> queryLogs(AuditQuery query);

    /**
     * Record a human review of an entry. Last write wins.
     *
     * @param id       entry id
     * @param reviewer who reviewed the entry
     * @param notes    optional notes
     * @return true if the entry exists and was updated
     */
    Uni<Boolean> markAsReviewed(String id, String reviewer, String notes);
}
