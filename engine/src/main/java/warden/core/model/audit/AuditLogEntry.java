package warden.core.model.audit;

import java.time.Instant;

import warden.core.model.RiskLevel;

/**
 * One immutable row of the audit trail.
 *
 * <p>Core fields are fixed when the entry is logged. Risk level, confidence and the review
 * flag are derived once at that point unless the caller supplied them. Review fields change
 * only through {@link #withReview}; entries are never deleted, only archived.
 *
 * @param id                unique id, assigned when logged
 * @param eventType         what happened
 * @param result            outcome of the action
 * @param userId            actor
 * @param targetUserId      affected user, when different from the actor
 * @param organizationId    tenant the event belongs to
 * @param resourceType      kind of resource acted upon
 * @param resourceId        resource acted upon
 * @param action            free-form action name
 * @param reason            human-readable reason
 * @param metadata          event-specific details (may be null)
 * @param ipAddress         client address
 * @param userAgent         client user agent
 * @param sessionId         session the event happened in
 * @param deviceFingerprint device hash of the client
 * @param requestPath       request path that triggered the event
 * @param riskLevel         derived or supplied risk
 * @param confidenceScore   0.0-1.0, how much context backs the entry
 * @param requiresReview    whether a human should triage the entry
 * @param reviewedBy        reviewer, once reviewed
 * @param reviewedAt        review time, once reviewed
 * @param reviewNotes       reviewer notes
 * @param createdAt         when the entry was logged
 * @param expiresAt         end of retention; archived afterwards
 * @param archived          whether retention archival has run for the entry
 */
public record AuditLogEntry(
        String id,
        AuditEventType eventType,
        AuditResult result,
        String userId,
        String targetUserId,
        String organizationId,
        String resourceType,
        String resourceId,
        String action,
        String reason,
        AuditMetadata metadata,
        String ipAddress,
        String userAgent,
        String sessionId,
        String deviceFingerprint,
        String requestPath,
        RiskLevel riskLevel,
        Double confidenceScore,
        Boolean requiresReview,
        String reviewedBy,
        Instant reviewedAt,
        String reviewNotes,
        Instant createdAt,
        Instant expiresAt,
        boolean archived) {

    public AuditLogEntry {
        if (eventType == null) {
            throw new IllegalArgumentException("Audit event type cannot be null");
        }
        if (result == null) {
            result = AuditResult.SUCCESS;
        }
    }

    public static Builder builder(AuditEventType eventType) {
        return new Builder(eventType);
    }

    /**
     * Copy with identity, retention and derived classification filled in.
     */
    public AuditLogEntry enrich(
            String newId,
            Instant newCreatedAt,
            Instant newExpiresAt,
            RiskLevel newRiskLevel,
            double newConfidence,
            boolean newRequiresReview) {
        return new AuditLogEntry(
                newId,
                eventType,
                result,
                userId,
                targetUserId,
                organizationId,
                resourceType,
                resourceId,
                action,
                reason,
                metadata,
                ipAddress,
                userAgent,
                sessionId,
                deviceFingerprint,
                requestPath,
                newRiskLevel,
                newConfidence,
                newRequiresReview,
                reviewedBy,
                reviewedAt,
                reviewNotes,
                newCreatedAt,
                newExpiresAt,
                archived);
    }

    /**
     * Copy with review fields set and the review flag cleared.
     */
    public AuditLogEntry withReview(String reviewer, String notes, Instant at) {
        return new AuditLogEntry(
                id,
                eventType,
                result,
                userId,
                targetUserId,
                organizationId,
                resourceType,
                resourceId,
                action,
                reason,
                metadata,
                ipAddress,
                userAgent,
                sessionId,
                deviceFingerprint,
                requestPath,
                riskLevel,
                confidenceScore,
                false,
                reviewer,
                at,
                notes,
                createdAt,
                expiresAt,
                archived);
    }

    public AuditLogEntry asArchived() {
        return new AuditLogEntry(
                id,
                eventType,
                result,
                userId,
                targetUserId,
                organizationId,
                resourceType,
                resourceId,
                action,
                reason,
                metadata,
                ipAddress,
                userAgent,
                sessionId,
                deviceFingerprint,
                requestPath,
                riskLevel,
                confidenceScore,
                requiresReview,
                reviewedBy,
                reviewedAt,
                reviewNotes,
                createdAt,
                expiresAt,
                true);
    }

    public boolean isReviewed() {
        return reviewedBy != null;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public static class Builder {
        private final AuditEventType eventType;
        private AuditResult result = AuditResult.SUCCESS;
        private String userId;
        private String targetUserId;
        private String organizationId;
        private String resourceType;
        private String resourceId;
        private String action;
        private String reason;
        private AuditMetadata metadata;
        private String ipAddress;
        private String userAgent;
        private String sessionId;
        private String deviceFingerprint;
        private String requestPath;
        private RiskLevel riskLevel;
        private Double confidenceScore;
        private Boolean requiresReview;

        private Builder(AuditEventType eventType) {
            this.eventType = eventType;
        }

        public Builder result(AuditResult result) {
            this.result = result;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder targetUserId(String targetUserId) {
            this.targetUserId = targetUserId;
            return this;
        }

        public Builder organizationId(String organizationId) {
            this.organizationId = organizationId;
            return this;
        }

        public Builder resource(String resourceType, String resourceId) {
            this.resourceType = resourceType;
            this.resourceId = resourceId;
            return this;
        }

        public Builder action(String action) {
            this.action = action;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder metadata(AuditMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder ipAddress(String ipAddress) {
            this.ipAddress = ipAddress;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder deviceFingerprint(String deviceFingerprint) {
            this.deviceFingerprint = deviceFingerprint;
            return this;
        }

        public Builder requestPath(String requestPath) {
            this.requestPath = requestPath;
            return this;
        }

        public Builder riskLevel(RiskLevel riskLevel) {
            this.riskLevel = riskLevel;
            return this;
        }

        public Builder confidenceScore(Double confidenceScore) {
            this.confidenceScore = confidenceScore;
            return this;
        }

        public Builder requiresReview(Boolean requiresReview) {
            this.requiresReview = requiresReview;
            return this;
        }

        public AuditLogEntry build() {
            return new AuditLogEntry(
                    null,
                    eventType,
                    result,
                    userId,
                    targetUserId,
                    organizationId,
                    resourceType,
                    resourceId,
                    action,
                    reason,
                    metadata,
                    ipAddress,
                    userAgent,
                    sessionId,
                    deviceFingerprint,
                    requestPath,
                    riskLevel,
                    confidenceScore,
                    requiresReview,
                    null,
                    null,
                    null,
                    null,
                    null,
                    false);
        }
    }
}
