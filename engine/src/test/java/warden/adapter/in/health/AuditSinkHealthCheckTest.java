package warden.adapter.in.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Instant;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.model.audit.AuditSinkHealth;
import warden.core.service.audit.AuditLogger;

@DisplayName("AuditSinkHealthCheck")
class AuditSinkHealthCheckTest {

    private AuditLogger auditLogger;
    private AuditSinkHealthCheck healthCheck;

    @BeforeEach
    void setUp() {
        auditLogger = mock(AuditLogger.class);
        when(auditLogger.health()).thenReturn(AuditSinkHealth.healthy());

        healthCheck = new AuditSinkHealthCheck(auditLogger);
    }

    @Test
    @DisplayName("should return UP status while writes succeed")
    void shouldReturnUpStatus() {
        HealthCheckResponse response = healthCheck.call();

        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
    }

    @Test
    @DisplayName("should have correct health check name")
    void shouldHaveCorrectName() {
        HealthCheckResponse response = healthCheck.call();

        assertEquals("audit-sink", response.getName());
    }

    @Test
    @DisplayName("should include write counters without failure details when healthy")
    void shouldIncludeCounters() {
        HealthCheckResponse response = healthCheck.call();

        assertTrue(response.getData().isPresent());
        var data = response.getData().get();

        assertEquals(0L, data.get("warden.audit.fallback.writes"));
        assertEquals(0L, data.get("warden.audit.pending.writes"));
        assertFalse(data.containsKey("lastFailureAt"));
        assertFalse(data.containsKey("lastFailureReason"));
    }

    @Test
    @DisplayName("should return DOWN with failure details while degraded")
    void shouldReturnDownWhenDegraded() {
        final var failedAt = Instant.parse("2024-03-01T10:00:00Z");
        when(auditLogger.health()).thenReturn(new AuditSinkHealth(true, 12, failedAt, "connection refused", 3));

        HealthCheckResponse response = healthCheck.call();

        assertEquals(HealthCheckResponse.Status.DOWN, response.getStatus());
        var data = response.getData().get();
        assertEquals(12L, data.get("warden.audit.fallback.writes"));
        assertEquals(3L, data.get("warden.audit.pending.writes"));
        assertEquals("2024-03-01T10:00:00Z", data.get("lastFailureAt"));
        assertEquals("connection refused", data.get("lastFailureReason"));
    }
}
