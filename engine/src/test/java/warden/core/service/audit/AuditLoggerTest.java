package warden.core.service.audit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import warden.adapter.out.storage.memory.InMemoryAuditLogRepository;
import warden.core.config.AuditConfig;
import warden.core.model.RiskLevel;
import warden.core.model.audit.AuditEventType;
import warden.core.model.audit.AuditLogEntry;
import warden.core.model.audit.AuditMetadata;
import warden.core.model.audit.AuditQuery;
import warden.core.model.audit.AuditResult;
import warden.core.model.audit.AuditTimeframe;
import warden.core.port.out.AuditFallbackSink;
import warden.core.port.out.SecurityAlerting;
import warden.mock.MutableClock;
import warden.spi.AuditLogRepository;
import warden.spi.SecurityEvent;

@DisplayName("AuditLogger")
@ExtendWith(MockitoExtension.class)
class AuditLoggerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    @Mock
    private AuditConfig config;

    @Mock
    private AuditFallbackSink fallbackSink;

    @Mock
    private SecurityAlerting alerting;

    private MutableClock clock;
    private InMemoryAuditLogRepository repository;
    private AuditLogger logger;

    @BeforeEach
    void setUp() {
        lenient().when(config.retention()).thenReturn(Duration.ofDays(365));
        lenient().when(config.writeTimeout()).thenReturn(Duration.ofMillis(200));
        lenient().when(config.alertOnHighRisk()).thenReturn(true);

        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        repository = new InMemoryAuditLogRepository();
        logger = newLogger(repository, Runnable::run);
    }

    private AuditLogger newLogger(AuditLogRepository repo, Executor writer) {
        return new AuditLogger(config, repo, fallbackSink, alerting, clock, writer);
    }

    private static AuditLogEntry login(String userId) {
        return AuditLogEntry.builder(AuditEventType.LOGIN_SUCCESS)
                .userId(userId)
                .build();
    }

    @Nested
    @DisplayName("logEvent()")
    class LogEventTests {

        @Test
        @DisplayName("should assign id, timestamps and classification")
        void shouldEnrichEntry() {
            final var logged = logger.logEvent(login("user-1"));

            assertNotNull(logged.id());
            assertEquals(clock.instant(), logged.createdAt());
            assertEquals(clock.instant().plus(Duration.ofDays(365)), logged.expiresAt());
            assertEquals(RiskLevel.LOW, logged.riskLevel());
            assertEquals(0.6, logged.confidenceScore());
            assertFalse(logged.requiresReview());
        }

        @Test
        @DisplayName("should persist the enriched entry")
        void shouldPersist() {
            final var logged = logger.logEvent(login("user-1"));

            final var stored = repository.findById(logged.id()).await().atMost(TIMEOUT);

            assertTrue(stored.isPresent());
            assertEquals(logged, stored.get());
        }

        @Test
        @DisplayName("should keep a caller-supplied classification and clamp confidence")
        void shouldKeepSuppliedClassification() {
            final var logged = logger.logEvent(AuditLogEntry.builder(AuditEventType.LOGIN_FAILURE)
                    .result(AuditResult.FAILURE)
                    .riskLevel(RiskLevel.LOW)
                    .confidenceScore(3.0)
                    .requiresReview(false)
                    .build());

            assertEquals(RiskLevel.LOW, logged.riskLevel());
            assertEquals(1.0, logged.confidenceScore());
            assertFalse(logged.requiresReview());
        }

        @Test
        @DisplayName("should record a caller-reported device change with generic details")
        void shouldRecordDeviceChange() {
            final var logged = logger.logEvent(AuditLogEntry.builder(AuditEventType.DEVICE_CHANGE)
                    .userId("user-1")
                    .deviceFingerprint("5f3a9c1")
                    .metadata(new AuditMetadata.Generic(Map.of("previousDevices", 2)))
                    .build());

            assertEquals(RiskLevel.LOW, logged.riskLevel());
            assertEquals(0.8, logged.confidenceScore());
            assertFalse(logged.requiresReview());
            final var stored = repository.findById(logged.id()).await().atMost(TIMEOUT).orElseThrow();
            assertEquals(AuditEventType.DEVICE_CHANGE, stored.eventType());
            assertEquals(Map.of("previousDevices", 2), ((AuditMetadata.Generic) stored.metadata()).values());
        }

        @Test
        @DisplayName("should classify an admin role grant HIGH and alert")
        void shouldAlertOnAdminGrant() {
            final var logged = logger.logRoleAssignment("ops-1", "user-7", "member", "admin", "org-1");

            assertEquals(AuditEventType.ROLE_ASSIGNED, logged.eventType());
            assertEquals(RiskLevel.HIGH, logged.riskLevel());
            assertTrue(logged.requiresReview());

            final var captor = ArgumentCaptor.forClass(SecurityEvent.class);
            verify(alerting).publish(captor.capture());
            final var event = (SecurityEvent.HighRiskAuditEvent) captor.getValue();
            assertEquals(logged.id(), event.auditId());
            assertEquals("HIGH", event.riskLevel());
        }

        @Test
        @DisplayName("should not alert when high-risk alerts are disabled")
        void shouldNotAlertWhenDisabled() {
            when(config.alertOnHighRisk()).thenReturn(false);

            logger.logRoleAssignment("ops-1", "user-7", "member", "admin", "org-1");

            verify(alerting, never()).publish(any());
        }

        @Test
        @DisplayName("should log a role removal with a null target role")
        void shouldLogRoleRemoval() {
            final var logged = logger.logRoleAssignment("ops-1", "user-7", "admin", null, "org-1");

            assertEquals(AuditEventType.ROLE_REMOVED, logged.eventType());
            assertEquals("admin", logged.resourceId());
            assertTrue(logged.requiresReview());
        }

        @Test
        @DisplayName("should record denied permission checks")
        void shouldRecordDeniedPermissionCheck() {
            final var logged = logger.logPermissionCheck("user-1", "billing:write", false, "missing_role", "org-1");

            assertEquals(AuditResult.DENIED, logged.result());
            assertEquals(RiskLevel.MEDIUM, logged.riskLevel());
        }

        @Test
        @DisplayName("should record access decisions with request path")
        void shouldRecordAccessEvent() {
            final var logged = logger.logAccessEvent("user-1", false, "report", "r-1", "GET", "/reports/r-1", 403);

            assertEquals(AuditEventType.ACCESS_DENIED, logged.eventType());
            assertEquals("/reports/r-1", logged.requestPath());
        }
    }

    @Nested
    @DisplayName("fallback")
    class FallbackTests {

        @Test
        @DisplayName("should write to the fallback sink when the repository fails")
        void shouldFallBackOnFailure() {
            final var failing = mock(AuditLogRepository.class);
            when(failing.insert(any())).thenReturn(Uni.createFrom().failure(new IllegalStateException("disk full")));
            final var failingLogger = newLogger(failing, Runnable::run);

            final var logged = failingLogger.logEvent(login("user-1"));

            verify(fallbackSink).write(eq(logged), any(IllegalStateException.class));
            final var health = failingLogger.health();
            assertTrue(health.degraded());
            assertEquals("disk full", health.lastFailureReason());
            assertEquals(clock.instant(), health.lastFailureAt());
            assertEquals(0, health.pendingWrites());
        }

        @Test
        @DisplayName("should fall back when a write exceeds the timeout")
        void shouldFallBackOnTimeout() {
            final var hanging = mock(AuditLogRepository.class);
            when(hanging.insert(any())).thenReturn(Uni.createFrom().nothing());
            when(config.writeTimeout()).thenReturn(Duration.ofMillis(20));

            final var logged = newLogger(hanging, Runnable::run).logEvent(login("user-1"));

            verify(fallbackSink).write(eq(logged), any(Throwable.class));
        }

        @Test
        @DisplayName("should publish one degraded event per outage and recover on success")
        void shouldPublishDegradedOnceAndRecover() {
            final var flaky = mock(AuditLogRepository.class);
            when(flaky.insert(any()))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("down")))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("down")))
                    .thenReturn(Uni.createFrom().voidItem());
            final var flakyLogger = newLogger(flaky, Runnable::run);

            flakyLogger.logEvent(login("user-1"));
            flakyLogger.logEvent(login("user-2"));
            assertTrue(flakyLogger.health().degraded());

            flakyLogger.logEvent(login("user-3"));

            assertFalse(flakyLogger.health().degraded());
            verify(fallbackSink, times(2)).write(any(), any());
            verify(alerting, times(1)).publish(any(SecurityEvent.AuditSinkDegraded.class));
        }

        @Test
        @DisplayName("should fall back when the writer rejects the entry")
        void shouldFallBackOnRejection() {
            final Executor rejecting = r -> {
                throw new RejectedExecutionException("writer stopped");
            };

            final var logged = newLogger(repository, rejecting).logEvent(login("user-1"));

            verify(fallbackSink).write(eq(logged), any(RejectedExecutionException.class));
            assertEquals(0, repository.size());
        }

        @Test
        @DisplayName("should report fallback writes in health")
        void shouldReportFallbackWrites() {
            when(fallbackSink.writeCount()).thenReturn(3L);

            final var health = logger.health();

            assertFalse(health.degraded());
            assertEquals(3L, health.fallbackWrites());
        }
    }

    @Nested
    @DisplayName("queryLogs()")
    class QueryLogsTests {

        @Test
        @DisplayName("should return entries of a user newest first")
        void shouldQueryByUser() {
            logger.logEvent(login("user-1"));
            clock.advance(Duration.ofMinutes(1));
            final var newer = logger.logEvent(login("user-1"));
            logger.logEvent(login("user-2"));

            final var result = logger.queryLogs(AuditQuery.forUser("user-1")).await().atMost(TIMEOUT);

            assertEquals(2, result.size());
            assertEquals(newer.id(), result.get(0).id());
        }

        @Test
        @DisplayName("should return an empty list when the repository fails")
        void shouldRecoverFromFailure() {
            final var failing = mock(AuditLogRepository.class);
            when(failing.query(any())).thenReturn(Uni.createFrom().failure(new IllegalStateException("down")));

            final var result = newLogger(failing, Runnable::run).queryLogs(null).await().atMost(TIMEOUT);

            assertTrue(result.isEmpty());
        }
    }

    @Nested
    @DisplayName("markAsReviewed()")
    class MarkAsReviewedTests {

        @Test
        @DisplayName("should record reviewer and notes")
        void shouldRecordReview() {
            final var logged = logger.logRoleAssignment("ops-1", "user-7", "member", "admin", "org-1");
            clock.advance(Duration.ofHours(1));

            final var updated = logger.markAsReviewed(logged.id(), "auditor", "expected").await().atMost(TIMEOUT);

            assertTrue(updated);
            final var stored = repository.findById(logged.id()).await().atMost(TIMEOUT).orElseThrow();
            assertEquals("auditor", stored.reviewedBy());
            assertEquals("expected", stored.reviewNotes());
            assertEquals(clock.instant(), stored.reviewedAt());
        }

        @Test
        @DisplayName("should return false for unknown entries")
        void shouldReturnFalseForUnknown() {
            assertFalse(logger.markAsReviewed("missing", "auditor", null).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should reject a blank reviewer")
        void shouldRejectBlankReviewer() {
            final var review = logger.markAsReviewed("any", " ", null);

            assertThrows(IllegalArgumentException.class, () -> review.await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("getAuditStats()")
    class StatsTests {

        @Test
        @DisplayName("should count entries within the timeframe")
        void shouldCountWithinTimeframe() {
            logger.logEvent(login("user-1"));
            clock.advance(Duration.ofDays(2));
            logger.logEvent(login("user-1"));
            logger.logEvent(AuditLogEntry.builder(AuditEventType.LOGIN_FAILURE)
                    .result(AuditResult.FAILURE)
                    .userId("user-2")
                    .build());
            logger.logRoleAssignment("ops-1", "user-7", "member", "admin", "org-1");

            final var stats = logger.getAuditStats(AuditTimeframe.DAY).await().atMost(TIMEOUT);

            assertEquals(3, stats.totalEvents());
            assertEquals(1, stats.eventsByType().get(AuditEventType.LOGIN_SUCCESS));
            assertEquals(1, stats.failedEvents());
            assertEquals(2, stats.highRiskEvents());
            assertEquals(2, stats.pendingReview());
        }
    }

    @Nested
    @DisplayName("archiveExpired()")
    class ArchiveTests {

        @Test
        @DisplayName("should archive entries past retention")
        void shouldArchiveExpired() {
            final var old = logger.logEvent(login("user-1"));
            clock.advance(Duration.ofDays(200));
            logger.logEvent(login("user-2"));
            clock.advance(Duration.ofDays(200));

            final var archived = logger.archiveExpired().await().atMost(TIMEOUT);

            assertEquals(1, archived);
            assertTrue(repository.findById(old.id()).await().atMost(TIMEOUT).orElseThrow().archived());
            assertEquals(2, repository.size());
        }

        @Test
        @DisplayName("should report zero when the repository fails")
        void shouldRecoverFromFailure() {
            final var failing = mock(AuditLogRepository.class);
            when(failing.archiveExpired(any(Instant.class)))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("down")));

            assertEquals(0, newLogger(failing, Runnable::run).archiveExpired().await().atMost(TIMEOUT));
        }
    }
}
