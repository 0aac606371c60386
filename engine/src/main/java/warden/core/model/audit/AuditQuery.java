package warden.core.model.audit;

import java.time.Instant;

import warden.core.model.RiskLevel;

/**
 * Filters for {@code queryLogs}. Null fields do not filter.
 *
 * @param userId          matches actor or affected user
 * @param eventType       event type
 * @param result          outcome
 * @param riskLevel       exact risk level
 * @param from            inclusive lower bound on createdAt
 * @param to              exclusive upper bound on createdAt
 * @param requiresReview  review flag
 * @param organizationId  tenant
 * @param resourceType    resource kind
 * @param limit           page size, defaults to {@value #DEFAULT_LIMIT}
 * @param offset          entries to skip
 */
public record AuditQuery(
        String userId,
        AuditEventType eventType,
        AuditResult result,
        RiskLevel riskLevel,
        Instant from,
        Instant to,
        Boolean requiresReview,
        String organizationId,
        String resourceType,
        int limit,
        int offset) {

    public static final int DEFAULT_LIMIT = 50;

    public AuditQuery {
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
        if (offset < 0) {
            offset = 0;
        }
    }

    public static AuditQuery all() {
        return new AuditQuery(null, null, null, null, null, null, null, null, null, DEFAULT_LIMIT, 0);
    }

    public static AuditQuery forUser(String userId) {
        return new AuditQuery(userId, null, null, null, null, null, null, null, null, DEFAULT_LIMIT, 0);
    }

    public static AuditQuery pendingReview() {
        return new AuditQuery(null, null, null, null, null, null, true, null, null, DEFAULT_LIMIT, 0);
    }

    public AuditQuery since(Instant newFrom) {
        return new AuditQuery(
                userId, eventType, result, riskLevel, newFrom, to, requiresReview, organizationId, resourceType, limit,
                offset);
    }

    public AuditQuery page(int newLimit, int newOffset) {
        return new AuditQuery(
                userId, eventType, result, riskLevel, from, to, requiresReview, organizationId, resourceType, newLimit,
                newOffset);
    }

    /**
     * Whether an entry passes every non-null filter. Paging is not applied here.
     */
    public boolean matches(AuditLogEntry entry) {
        if (userId != null && !userId.equals(entry.userId()) && !userId.equals(entry.targetUserId())) {
            return false;
        }
        if (eventType != null && eventType != entry.eventType()) {
            return false;
        }
        if (result != null && result != entry.result()) {
            return false;
        }
        if (riskLevel != null && riskLevel != entry.riskLevel()) {
            return false;
        }
        if (from != null && (entry.createdAt() == null || entry.createdAt().isBefore(from))) {
            return false;
        }
        if (to != null && (entry.createdAt() == null || !entry.createdAt().isBefore(to))) {
            return false;
        }
        if (requiresReview != null && !requiresReview.equals(entry.requiresReview())) {
            return false;
        }
        if (organizationId != null && !organizationId.equals(entry.organizationId())) {
            return false;
        }
        return resourceType == null || resourceType.equals(entry.resourceType());
    }
}
