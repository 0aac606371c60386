package warden.adapter.out.audit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.smallrye.mutiny.TimeoutException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.model.RiskLevel;
import warden.core.model.audit.AuditEventType;
import warden.core.model.audit.AuditLogEntry;
import warden.core.model.audit.AuditMetadata;
import warden.core.model.audit.AuditResult;

@DisplayName("LoggingAuditFallbackSink")
class LoggingAuditFallbackSinkTest {

    private static AuditLogEntry entry() {
        return AuditLogEntry.builder(AuditEventType.ROLE_ASSIGNED)
                .result(AuditResult.SUCCESS)
                .userId("ops-1")
                .metadata(new AuditMetadata.RoleChange("member", "admin", "ops-1"))
                .riskLevel(RiskLevel.HIGH)
                .build()
                .enrich("id-1", Instant.parse("2024-03-01T10:00:00Z"), null, RiskLevel.HIGH, 0.7, true);
    }

    @Test
    @DisplayName("should count writes and increment the fallback counter")
    void shouldCountWrites() {
        final var registry = new SimpleMeterRegistry();
        final var sink = new LoggingAuditFallbackSink(registry);

        sink.write(entry(), new IllegalStateException("down"));
        sink.write(entry(), null);

        assertEquals(2, sink.writeCount());
        assertEquals(2.0, registry.get("warden.audit.fallback.writes").counter().count());
    }

    @Test
    @DisplayName("should work without a meter registry")
    void shouldWorkWithoutRegistry() {
        final var sink = new LoggingAuditFallbackSink(null);

        sink.write(entry(), new IllegalStateException("down"));

        assertEquals(1, sink.writeCount());
    }

    @Test
    @DisplayName("should serialize entries as one JSON line with ISO timestamps and typed metadata")
    void shouldSerializeAsJson() {
        final var json = LoggingAuditFallbackSink.toJson(entry());

        assertTrue(json.startsWith("{"));
        assertTrue(json.contains("\"id\":\"id-1\""));
        assertTrue(json.contains("\"eventType\":\"ROLE_ASSIGNED\""));
        assertTrue(json.contains("\"createdAt\":\"2024-03-01T10:00:00Z\""));
        assertTrue(json.contains("\"kind\":\"role_change\""));
        assertFalse(json.contains("\n"));
    }

    @Test
    @DisplayName("should flag timed-out writes as possibly persisted")
    void shouldFlagTimedOutWrites() {
        final var timedOut = LoggingAuditFallbackSink.formatLine(entry(), new TimeoutException());
        final var failed = LoggingAuditFallbackSink.formatLine(entry(), new IllegalStateException("down"));

        assertTrue(timedOut.endsWith("maybePersisted=true"));
        assertTrue(timedOut.startsWith(LoggingAuditFallbackSink.toJson(entry())));
        assertTrue(failed.endsWith("cause=\"down\" maybePersisted=false"));
    }
}
