package warden.core.model.session;

import java.time.Instant;

/**
 * Latest known security state of a user's session.
 */
public record SessionSecurityInfo(
        String userId,
        String sessionId,
        String deviceFingerprint,
        String ipAddress,
        Instant lastValidatedAt,
        Instant lastReauthAt,
        boolean reauthRequired,
        SessionVerdict lastVerdict) {}
