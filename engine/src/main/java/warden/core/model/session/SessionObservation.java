package warden.core.model.session;

import java.time.Instant;

import warden.core.model.RiskLevel;

/**
 * One validated session as remembered for later analysis.
 *
 * @param userId            owner of the session
 * @param sessionId         session identifier
 * @param deviceFingerprint device hash presented during validation
 * @param ipAddress         client address during validation
 * @param securityScore     score of the verdict
 * @param riskLevel         risk of the verdict
 * @param activeSessions    active sessions of the user at validation time
 * @param sessionCreatedAt  when the session was established
 * @param observedAt        when the validation ran
 */
public record SessionObservation(
        String userId,
        String sessionId,
        String deviceFingerprint,
        String ipAddress,
        int securityScore,
        RiskLevel riskLevel,
        int activeSessions,
        Instant sessionCreatedAt,
        Instant observedAt) {}
