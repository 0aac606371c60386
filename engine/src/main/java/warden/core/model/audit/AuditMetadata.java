package warden.core.model.audit;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import warden.core.model.RiskLevel;

/**
 * Event-specific details attached to an audit entry.
 *
 * <p>Each variant carries the fields its event family knows about; {@link Generic} keeps
 * the trail open for callers with their own event details.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = AuditMetadata.PasswordReset.class, name = "password_reset"),
    @JsonSubTypes.Type(value = AuditMetadata.SessionValidation.class, name = "session_validation"),
    @JsonSubTypes.Type(value = AuditMetadata.RoleChange.class, name = "role_change"),
    @JsonSubTypes.Type(value = AuditMetadata.PermissionCheck.class, name = "permission_check"),
    @JsonSubTypes.Type(value = AuditMetadata.Access.class, name = "access"),
    @JsonSubTypes.Type(value = AuditMetadata.RateLimit.class, name = "rate_limit"),
    @JsonSubTypes.Type(value = AuditMetadata.Analysis.class, name = "analysis"),
    @JsonSubTypes.Type(value = AuditMetadata.Generic.class, name = "generic")
})
public sealed interface AuditMetadata {

    /**
     * Whether the variant carries any information. Counts towards confidence when false.
     */
    @JsonIgnore
    default boolean isEmpty() {
        return false;
    }

    record PasswordReset(
            String email,
            String reason,
            double emailAttempts,
            double ipAttempts,
            double globalAttempts,
            boolean suspicious,
            boolean needsCaptcha)
            implements AuditMetadata {}

    record SessionValidation(
            List<String> violations, RiskLevel sessionRisk, List<String> actions, int securityScore)
            implements AuditMetadata {}

    record RoleChange(String roleFrom, String roleTo, String grantedBy) implements AuditMetadata {}

    record PermissionCheck(String permission, boolean granted, String reason) implements AuditMetadata {}

    record Access(String method, String path, int statusCode) implements AuditMetadata {}

    record RateLimit(String scope, double attempts, long waitTimeSeconds, boolean locked) implements AuditMetadata {}

    record Analysis(int complexityScore, int dependencies, int vulnerabilities, int criticalPaths)
            implements AuditMetadata {}

    record Generic(Map<String, Object> values) implements AuditMetadata {

        public Generic {
            values = values == null ? Map.of() : Map.copyOf(values);
        }

        @Override
        @JsonIgnore
        public boolean isEmpty() {
            return values.isEmpty();
        }
    }
}
