package warden.core.service.audit;

import java.util.Set;

import warden.core.model.RiskLevel;
import warden.core.model.audit.AuditLogEntry;
import warden.core.model.audit.AuditMetadata;

/**
 * Derives risk level, confidence and the review flag of audit entries.
 *
 * <p>Risk score = event class weight (1-3) + result penalty (0-2) + 2 when a role change
 * grants {@code admin} or {@code super_admin}. Scores map to levels at 6 (CRITICAL),
 * 4 (HIGH) and 2 (MEDIUM).
 */
public final class AuditRiskClassifier {

    private static final Set<String> ELEVATED_ROLES = Set.of("admin", "super_admin");

    private static final double BASE_CONFIDENCE = 0.5;
    private static final double CONTEXT_CONFIDENCE = 0.1;

    private AuditRiskClassifier() {}

    public static int riskScore(AuditLogEntry entry) {
        var score = entry.eventType().riskWeight() + entry.result().riskPenalty();
        if (entry.metadata() instanceof AuditMetadata.RoleChange roleChange
                && roleChange.roleTo() != null
                && ELEVATED_ROLES.contains(roleChange.roleTo())) {
            score += 2;
        }
        return score;
    }

    public static RiskLevel riskLevel(AuditLogEntry entry) {
        final var score = riskScore(entry);
        if (score >= 6) {
            return RiskLevel.CRITICAL;
        }
        if (score >= 4) {
            return RiskLevel.HIGH;
        }
        if (score >= 2) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    /**
     * 0.5 plus 0.1 per context field present, capped at 1.0.
     */
    public static double confidence(AuditLogEntry entry) {
        var confidence = BASE_CONFIDENCE;
        if (present(entry.userId())) {
            confidence += CONTEXT_CONFIDENCE;
        }
        if (present(entry.ipAddress())) {
            confidence += CONTEXT_CONFIDENCE;
        }
        if (present(entry.sessionId())) {
            confidence += CONTEXT_CONFIDENCE;
        }
        if (present(entry.deviceFingerprint())) {
            confidence += CONTEXT_CONFIDENCE;
        }
        if (present(entry.requestPath())) {
            confidence += CONTEXT_CONFIDENCE;
        }
        if (entry.metadata() != null && !entry.metadata().isEmpty()) {
            confidence += CONTEXT_CONFIDENCE;
        }
        // Rounded to one decimal so accumulated steps compare exactly.
        return Math.min(1.0, Math.round(confidence * 10) / 10.0);
    }

    public static boolean requiresReview(AuditLogEntry entry, RiskLevel riskLevel) {
        return riskLevel.isElevated() || entry.eventType().isRoleChange() || entry.result().isFailure();
    }

    private static boolean present(String value) {
        return value != null && !value.isBlank();
    }
}
