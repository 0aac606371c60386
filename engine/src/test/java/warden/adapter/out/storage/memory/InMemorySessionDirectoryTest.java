package warden.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.model.session.SessionSnapshot;
import warden.mock.MutableClock;

@DisplayName("InMemorySessionDirectory")
class InMemorySessionDirectoryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private MutableClock clock;
    private InMemorySessionDirectory directory;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        directory = new InMemorySessionDirectory(clock);
    }

    private static SessionSnapshot session(String id, String userId, Instant createdAt, Duration lifetime) {
        return new SessionSnapshot(id, userId, null, createdAt, createdAt.plus(lifetime), "192.0.2.1", "agent");
    }

    @Test
    @DisplayName("should find the most recently created session of a user")
    void shouldFindLatest() {
        directory.put(session("s-1", "alice", clock.instant(), Duration.ofHours(1)));
        directory.put(session("s-2", "alice", clock.instant().plusSeconds(60), Duration.ofHours(1)));
        directory.put(session("s-3", "bob", clock.instant().plusSeconds(120), Duration.ofHours(1)));

        assertEquals("s-2", directory.findLatestForUser("alice").await().atMost(TIMEOUT).orElseThrow().sessionId());
        assertTrue(directory.findLatestForUser("carol").await().atMost(TIMEOUT).isEmpty());
    }

    @Test
    @DisplayName("should count only unexpired sessions")
    void shouldCountActive() {
        directory.put(session("s-1", "alice", clock.instant(), Duration.ofMinutes(10)));
        directory.put(session("s-2", "alice", clock.instant(), Duration.ofHours(1)));
        clock.advance(Duration.ofMinutes(30));

        assertEquals(1, directory.countActiveSessions("alice").await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("should remove single sessions and all sessions of a user")
    void shouldRemove() {
        directory.put(session("s-1", "alice", clock.instant(), Duration.ofHours(1)));
        directory.put(session("s-2", "alice", clock.instant(), Duration.ofHours(1)));

        directory.remove("s-1");
        assertTrue(directory.findSession("s-1").await().atMost(TIMEOUT).isEmpty());

        directory.removeUser("alice");
        assertEquals(0, directory.countActiveSessions("alice").await().atMost(TIMEOUT));
    }
}
