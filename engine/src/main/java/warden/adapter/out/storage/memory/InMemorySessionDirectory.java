package warden.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;

import warden.core.model.session.SessionSnapshot;
import warden.core.port.out.SessionDirectory;

/**
 * In-memory implementation of SessionDirectory.
 *
 * <p>
 * Stands in for the authentication provider's session store during development and
 * tests. Sessions are registered with {@link #put} and never expire on their own.
 */
public class InMemorySessionDirectory implements SessionDirectory {

    private final ConcurrentMap<String, SessionSnapshot> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySessionDirectory(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Uni<Optional<SessionSnapshot>> findSession(String sessionId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(sessions.get(sessionId)));
    }

    @Override
    public Uni<Optional<SessionSnapshot>> findLatestForUser(String userId) {
        return Uni.createFrom().item(() -> sessions.values().stream()
                .filter(s -> userId.equals(s.userId()))
                .max(Comparator.comparing(
                        SessionSnapshot::createdAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))));
    }

    @Override
    public Uni<Integer> countActiveSessions(String userId) {
        return Uni.createFrom().item(() -> {
            final var now = clock.instant();
            return (int) sessions.values().stream()
                    .filter(s -> userId.equals(s.userId()))
                    .filter(s -> !s.isExpired(now))
                    .count();
        });
    }

    public void put(SessionSnapshot session) {
        sessions.put(session.sessionId(), session);
    }

    public void remove(String sessionId) {
        sessions.remove(sessionId);
    }

    /**
     * Remove every session of a user.
     */
    public void removeUser(String userId) {
        sessions.values().removeIf(s -> userId.equals(s.userId()));
    }
}
