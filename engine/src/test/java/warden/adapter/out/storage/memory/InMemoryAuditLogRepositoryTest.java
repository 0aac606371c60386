package warden.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.model.RiskLevel;
import warden.core.model.audit.AuditEventType;
import warden.core.model.audit.AuditLogEntry;
import warden.core.model.audit.AuditQuery;
import warden.core.model.audit.AuditResult;

@DisplayName("InMemoryAuditLogRepository")
class InMemoryAuditLogRepositoryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private InMemoryAuditLogRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryAuditLogRepository();
    }

    private static AuditLogEntry entry(String id, String userId, int minutes, boolean review) {
        final var createdAt = T0.plus(Duration.ofMinutes(minutes));
        return AuditLogEntry.builder(AuditEventType.LOGIN_FAILURE)
                .result(AuditResult.FAILURE)
                .userId(userId)
                .build()
                .enrich(id, createdAt, createdAt.plus(Duration.ofDays(1)), RiskLevel.HIGH, 0.6, review);
    }

    private void insert(AuditLogEntry entry) {
        repository.insert(entry).await().atMost(TIMEOUT);
    }

    private List<String> ids(AuditQuery query) {
        return repository.query(query).await().atMost(TIMEOUT).stream()
                .map(AuditLogEntry::id)
                .toList();
    }

    @Test
    @DisplayName("should return matching entries newest first with paging")
    void shouldQueryNewestFirst() {
        insert(entry("a", "alice", 0, true));
        insert(entry("b", "alice", 1, false));
        insert(entry("c", "bob", 2, true));
        insert(entry("d", "alice", 3, true));

        assertEquals(List.of("d", "b", "a"), ids(AuditQuery.forUser("alice")));
        assertEquals(List.of("b"), ids(AuditQuery.forUser("alice").page(1, 1)));
        assertEquals(List.of("d", "c", "a"), ids(AuditQuery.pendingReview()));
        assertEquals(List.of("d", "c"), ids(AuditQuery.all().since(T0.plus(Duration.ofMinutes(2)))));
    }

    @Test
    @DisplayName("should keep the first entry on a duplicate id")
    void shouldIgnoreDuplicates() {
        insert(entry("a", "alice", 0, true));
        insert(entry("a", "mallory", 5, false));

        assertEquals(1, repository.size());
        assertEquals("alice", repository.findById("a").await().atMost(TIMEOUT).orElseThrow().userId());
    }

    @Test
    @DisplayName("should update review fields only for existing entries")
    void shouldUpdateReview() {
        insert(entry("a", "alice", 0, true));

        assertTrue(repository.updateReview("a", "auditor", "ok", T0).await().atMost(TIMEOUT));
        assertFalse(repository.updateReview("missing", "auditor", "ok", T0).await().atMost(TIMEOUT));
        assertTrue(repository.findById("a").await().atMost(TIMEOUT).orElseThrow().isReviewed());
    }

    @Test
    @DisplayName("should archive each expired entry once and keep it")
    void shouldArchiveOnce() {
        insert(entry("a", "alice", 0, true));
        insert(entry("b", "alice", 60 * 24, true));
        final var now = T0.plus(Duration.ofDays(1)).plusSeconds(1);

        assertEquals(1, repository.archiveExpired(now).await().atMost(TIMEOUT));
        assertEquals(0, repository.archiveExpired(now).await().atMost(TIMEOUT));
        assertEquals(2, repository.size());
    }
}
