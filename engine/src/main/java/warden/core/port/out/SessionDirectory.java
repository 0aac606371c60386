package warden.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.session.SessionSnapshot;

/**
 * Outbound port to the authentication provider's session store.
 *
 * <p>The engine never creates sessions; it only reads what the provider established.
 */
public interface SessionDirectory {

    /**
     * Retrieve a session by ID.
     *
     * @param sessionId session identifier
     * @return the session, or empty if unknown
     */
    Uni<Optional<SessionSnapshot>> findSession(String sessionId);

    /**
     * Retrieve the most recently created session of a user.
     *
     * @param userId user identifier
     * @return the session, or empty if the user has none
     */
    Uni<Optional<SessionSnapshot>> findLatestForUser(String userId);

    /**
     * Count the user's unexpired sessions.
     *
     * @param userId user identifier
     * @return number of active sessions
     */
    Uni<Integer> countActiveSessions(String userId);
}
