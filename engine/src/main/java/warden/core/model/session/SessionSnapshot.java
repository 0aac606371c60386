package warden.core.model.session;

import java.time.Instant;

/**
 * The session directory's view of an authenticated session.
 *
 * @param sessionId session identifier
 * @param userId    owner of the session
 * @param email     owner's email, used as the device identifier when present
 * @param createdAt when the session was established
 * @param expiresAt when the session token expires
 * @param ipAddress address the session was established from
 * @param userAgent user agent the session was established from
 */
public record SessionSnapshot(
        String sessionId,
        String userId,
        String email,
        Instant createdAt,
        Instant expiresAt,
        String ipAddress,
        String userAgent) {

    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    /**
     * Identifier devices are registered under: the email when known, the user id otherwise.
     */
    public String deviceIdentifier() {
        return email != null && !email.isBlank() ? email : userId;
    }
}
