package warden.core.service.session;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import warden.core.model.session.SessionObservation;

/**
 * Bounded per-user log of validated sessions, oldest first.
 */
public class SessionHistory {

    private final int capacity;
    private final ConcurrentHashMap<String, ArrayDeque<SessionObservation>> observations = new ConcurrentHashMap<>();

    public SessionHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("History capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
    }

    public void record(SessionObservation observation) {
        observations.compute(observation.userId(), (userId, deque) -> {
            final var updated = deque != null ? deque : new ArrayDeque<SessionObservation>();
            updated.addLast(observation);
            while (updated.size() > capacity) {
                updated.removeFirst();
            }
            return updated;
        });
    }

    /**
     * Snapshot of one user's observations.
     */
    public List<SessionObservation> forUser(String userId) {
        final var snapshot = new AtomicReference<List<SessionObservation>>(List.of());
        observations.computeIfPresent(userId, (id, deque) -> {
            snapshot.set(List.copyOf(deque));
            return deque;
        });
        return snapshot.get();
    }

    /**
     * Snapshot of every user's observations, ordered by observation time.
     */
    public List<SessionObservation> all() {
        return observations.keySet().stream()
                .flatMap(userId -> forUser(userId).stream())
                .sorted(Comparator.comparing(SessionObservation::observedAt))
                .toList();
    }

    public void clear(String userId) {
        observations.remove(userId);
    }
}
