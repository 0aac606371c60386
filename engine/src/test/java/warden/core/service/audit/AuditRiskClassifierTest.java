package warden.core.service.audit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import warden.core.model.RiskLevel;
import warden.core.model.audit.AuditEventType;
import warden.core.model.audit.AuditLogEntry;
import warden.core.model.audit.AuditMetadata;
import warden.core.model.audit.AuditResult;

@DisplayName("AuditRiskClassifier")
class AuditRiskClassifierTest {

    @Nested
    @DisplayName("riskLevel()")
    class RiskLevelTests {

        @Test
        @DisplayName("should rate an admin role grant HIGH and require review")
        void shouldRateAdminGrantHigh() {
            final var entry = AuditLogEntry.builder(AuditEventType.ROLE_ASSIGNED)
                    .result(AuditResult.SUCCESS)
                    .userId("ops-1")
                    .targetUserId("user-7")
                    .metadata(new AuditMetadata.RoleChange("member", "admin", "ops-1"))
                    .build();

            assertEquals(5, AuditRiskClassifier.riskScore(entry));
            assertEquals(RiskLevel.HIGH, AuditRiskClassifier.riskLevel(entry));
            assertTrue(AuditRiskClassifier.requiresReview(entry, RiskLevel.HIGH));
        }

        @Test
        @DisplayName("should not add the elevation bonus for ordinary roles")
        void shouldNotBoostOrdinaryRoles() {
            final var entry = AuditLogEntry.builder(AuditEventType.ROLE_ASSIGNED)
                    .metadata(new AuditMetadata.RoleChange("member", "editor", "ops-1"))
                    .build();

            assertEquals(3, AuditRiskClassifier.riskScore(entry));
            assertEquals(RiskLevel.MEDIUM, AuditRiskClassifier.riskLevel(entry));
        }

        @Test
        @DisplayName("should rate a failed admin grant CRITICAL")
        void shouldRateFailedAdminGrantCritical() {
            final var entry = AuditLogEntry.builder(AuditEventType.ROLE_ASSIGNED)
                    .result(AuditResult.FAILURE)
                    .metadata(new AuditMetadata.RoleChange(null, "super_admin", "ops-1"))
                    .build();

            assertEquals(7, AuditRiskClassifier.riskScore(entry));
            assertEquals(RiskLevel.CRITICAL, AuditRiskClassifier.riskLevel(entry));
        }

        @Test
        @DisplayName("should rate a successful login LOW without review")
        void shouldRateLoginLow() {
            final var entry = AuditLogEntry.builder(AuditEventType.LOGIN_SUCCESS).build();

            assertEquals(RiskLevel.LOW, AuditRiskClassifier.riskLevel(entry));
            assertFalse(AuditRiskClassifier.requiresReview(entry, RiskLevel.LOW));
        }

        @Test
        @DisplayName("should rate a failed login HIGH and require review")
        void shouldRateFailedLoginHigh() {
            final var entry = AuditLogEntry.builder(AuditEventType.LOGIN_FAILURE)
                    .result(AuditResult.FAILURE)
                    .build();

            assertEquals(RiskLevel.HIGH, AuditRiskClassifier.riskLevel(entry));
            assertTrue(AuditRiskClassifier.requiresReview(entry, RiskLevel.HIGH));
        }

        @ParameterizedTest
        @EnumSource(AuditEventType.class)
        @DisplayName("should classify every event type")
        void shouldClassifyEveryType(AuditEventType type) {
            for (final var result : AuditResult.values()) {
                final var entry = AuditLogEntry.builder(type).result(result).build();

                final var level = AuditRiskClassifier.riskLevel(entry);
                final var confidence = AuditRiskClassifier.confidence(entry);

                assertNotNull(level);
                assertTrue(confidence >= 0.0 && confidence <= 1.0);
            }
        }
    }

    @Nested
    @DisplayName("confidence()")
    class ConfidenceTests {

        @Test
        @DisplayName("should start at 0.5 without context")
        void shouldStartAtBase() {
            assertEquals(0.5, AuditRiskClassifier.confidence(AuditLogEntry.builder(AuditEventType.LOGOUT).build()));
        }

        @Test
        @DisplayName("should add 0.1 per context field and cap at 1.0")
        void shouldAddPerFieldAndCap() {
            final var entry = AuditLogEntry.builder(AuditEventType.ACCESS_DENIED)
                    .userId("user-1")
                    .ipAddress("192.0.2.1")
                    .sessionId("s-1")
                    .deviceFingerprint("48c2fcac")
                    .requestPath("/admin")
                    .metadata(new AuditMetadata.Generic(Map.of("k", "v")))
                    .build();

            assertEquals(1.0, AuditRiskClassifier.confidence(entry));
        }

        @Test
        @DisplayName("should ignore empty metadata")
        void shouldIgnoreEmptyMetadata() {
            final var entry = AuditLogEntry.builder(AuditEventType.ACCESS_DENIED)
                    .userId("user-1")
                    .metadata(new AuditMetadata.Generic(Map.of()))
                    .build();

            assertEquals(0.6, AuditRiskClassifier.confidence(entry));
        }
    }
}
