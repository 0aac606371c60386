package warden.core.service.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.cache.CaffeineLocalCache;
import warden.core.cache.LocalCache;
import warden.core.config.SessionSecurityConfig;
import warden.core.model.ClientContext;
import warden.core.model.RiskLevel;
import warden.core.model.audit.AuditEventType;
import warden.core.model.audit.AuditLogEntry;
import warden.core.model.audit.AuditMetadata;
import warden.core.model.audit.AuditResult;
import warden.core.model.session.ActionKind;
import warden.core.model.session.SessionObservation;
import warden.core.model.session.SessionSecurityInfo;
import warden.core.model.session.SessionSecuritySummary;
import warden.core.model.session.SessionSnapshot;
import warden.core.model.session.SessionVerdict;
import warden.core.model.session.ViolationKind;
import warden.core.port.in.AuditTrail;
import warden.core.port.out.SessionDirectory;
import warden.core.service.device.DeviceFingerprintRegistry;

/**
 * Validates a user's session against device binding, concurrency and re-authentication
 * policy.
 *
 * <p>
 * Checks run in a fixed order, each adding a violation and a remediation action:
 * <ol>
 *   <li>no session or no user: terminal, HIGH, {@code REQUIRE_LOGIN}</li>
 *   <li>session expired: {@code REFRESH_TOKEN}, at least MEDIUM</li>
 *   <li>too many concurrent sessions: {@code TERMINATE_OLDEST_SESSIONS}, at least HIGH</li>
 *   <li>unknown device: {@code REQUIRE_DEVICE_VERIFICATION}, at least MEDIUM</li>
 *   <li>re-authentication overdue: {@code REQUIRE_REAUTH}, at least MEDIUM</li>
 * </ol>
 *
 * <p>
 * The risk level only ever rises within one validation. Only terminal violations and an
 * expired session make the verdict invalid. Every call produces one audit entry (clean
 * validations only when {@link SessionSecurityConfig#logAllSessionEvents()} is set).
 */
@ApplicationScoped
public class SessionSecurityValidator {

    private static final Logger LOG = Logger.getLogger(SessionSecurityValidator.class);

    private final SessionSecurityConfig config;
    private final SessionDirectory directory;
    private final DeviceFingerprintRegistry deviceRegistry;
    private final AuditTrail auditTrail;
    private final Clock clock;
    private final SessionHistory history;
    private final LocalCache<String, SessionSecurityInfo> securityInfo;
    private final ConcurrentHashMap<String, Instant> lastReauth = new ConcurrentHashMap<>();
    private final Set<String> reauthRequired = ConcurrentHashMap.newKeySet();

    public SessionSecurityValidator(
            SessionSecurityConfig config,
            SessionDirectory directory,
            DeviceFingerprintRegistry deviceRegistry,
            AuditTrail auditTrail,
            Clock clock) {
        if (config.maxConcurrentSessions() <= 0) {
            throw new IllegalArgumentException(
                    "maxConcurrentSessions must be positive, got " + config.maxConcurrentSessions());
        }
        this.config = config;
        this.directory = directory;
        this.deviceRegistry = deviceRegistry;
        this.auditTrail = auditTrail;
        this.clock = clock;
        this.history = new SessionHistory(config.historySize());
        this.securityInfo = new CaffeineLocalCache<>(config.infoCacheTtl(), config.infoCacheMaxSize(), clock);
    }

    /**
     * Validate the session of a user.
     *
     * <p>
     * The session is looked up by the context's session id when present, otherwise as the
     * user's latest session. A directory failure yields a CRITICAL {@code VALIDATION_ERROR}
     * verdict instead of a failed Uni.
     *
     * @param userId  user to validate (may be null to use the session's owner)
     * @param context client presenting the session
     * @return the verdict
     */
    public Uni<SessionVerdict> validateSessionWithSecurity(String userId, ClientContext context) {
        final var client = context != null ? context : ClientContext.server();
        return lookup(userId, client)
                .flatMap(session -> {
                    final var now = clock.instant();
                    if (session.isEmpty()) {
                        return Uni.createFrom()
                                .item(SessionVerdict.terminal(
                                        ViolationKind.NO_ACTIVE_SESSION, RiskLevel.HIGH, userId, now));
                    }
                    final var snapshot = session.get();
                    final var sessionUserId = userId != null ? userId : snapshot.userId();
                    if (sessionUserId == null
                            || sessionUserId.isBlank()
                            || (snapshot.userId() != null && !snapshot.userId().equals(sessionUserId))) {
                        return Uni.createFrom()
                                .item(SessionVerdict.terminal(ViolationKind.INVALID_USER, RiskLevel.HIGH, userId, now));
                    }
                    return directory
                            .countActiveSessions(sessionUserId)
                            .map(active -> evaluate(sessionUserId, snapshot, active, client));
                })
                .onFailure()
                .recoverWithItem(e -> {
                    LOG.errorf(e, "Session validation failed for %s", userId);
                    return SessionVerdict.terminal(
                            ViolationKind.VALIDATION_ERROR, RiskLevel.CRITICAL, userId, clock.instant());
                })
                .invoke(verdict -> audit(verdict, client));
    }

    private Uni<Optional<SessionSnapshot>> lookup(String userId, ClientContext context) {
        if (context.sessionId() != null) {
            return directory.findSession(context.sessionId());
        }
        if (userId != null) {
            return directory.findLatestForUser(userId);
        }
        return Uni.createFrom().item(Optional.empty());
    }

    private SessionVerdict evaluate(String userId, SessionSnapshot session, int activeSessions, ClientContext context) {
        final var now = clock.instant();
        final var violations = EnumSet.noneOf(ViolationKind.class);
        final var actions = EnumSet.noneOf(ActionKind.class);
        var risk = RiskLevel.LOW;

        if (session.isExpired(now)) {
            violations.add(ViolationKind.SESSION_EXPIRED);
            actions.add(ActionKind.REFRESH_TOKEN);
            risk = risk.max(RiskLevel.MEDIUM);
        }

        if (activeSessions > config.maxConcurrentSessions()) {
            violations.add(ViolationKind.CONCURRENT_SESSION_LIMIT);
            actions.add(ActionKind.TERMINATE_OLDEST_SESSIONS);
            risk = risk.max(RiskLevel.HIGH);
        }

        final String fingerprint;
        if (config.bindToDevice()) {
            final var change = deviceRegistry.checkDeviceChange(session.deviceIdentifier(), context);
            fingerprint = change.fingerprint().hash();
            if (change.newDevice()) {
                violations.add(ViolationKind.DEVICE_FINGERPRINT_CHANGE);
                actions.add(ActionKind.REQUIRE_DEVICE_VERIFICATION);
                risk = risk.max(RiskLevel.MEDIUM);
            }
        } else {
            fingerprint = deviceRegistry.generate(context.device()).hash();
        }

        final var lastAuthenticated = lastReauth.getOrDefault(userId, session.createdAt());
        if (config.requirePeriodicReauth() && reauthDue(userId, lastAuthenticated, now)) {
            violations.add(ViolationKind.REAUTH_REQUIRED);
            actions.add(ActionKind.REQUIRE_REAUTH);
            risk = risk.max(RiskLevel.MEDIUM);
        }

        final var score = SessionVerdict.securityScore(violations.size(), risk);
        final var verdict = new SessionVerdict(
                !violations.contains(ViolationKind.SESSION_EXPIRED), violations, risk, actions, score, userId, now);

        final var ipAddress = context.ipAddress() != null ? context.ipAddress() : session.ipAddress();
        history.record(new SessionObservation(
                userId,
                session.sessionId(),
                fingerprint,
                ipAddress,
                score,
                risk,
                activeSessions,
                session.createdAt(),
                now));
        securityInfo.put(
                userId,
                new SessionSecurityInfo(
                        userId,
                        session.sessionId(),
                        fingerprint,
                        ipAddress,
                        now,
                        lastAuthenticated,
                        violations.contains(ViolationKind.REAUTH_REQUIRED),
                        verdict));

        if (verdict.hasViolations()) {
            LOG.debugf("Session of %s has violations %s (risk %s)", userId, violations, risk);
        }
        return verdict;
    }

    private boolean reauthDue(String userId, Instant lastAuthenticated, Instant now) {
        if (reauthRequired.contains(userId)) {
            return true;
        }
        return lastAuthenticated == null
                || Duration.between(lastAuthenticated, now).compareTo(config.reauthInterval()) > 0;
    }

    private void audit(SessionVerdict verdict, ClientContext context) {
        if (!verdict.hasViolations() && !config.logAllSessionEvents()) {
            return;
        }
        final var violationNames =
                verdict.violations().stream().map(Enum::name).toList();
        auditTrail.logEvent(AuditLogEntry.builder(
                        verdict.hasViolations() ? AuditEventType.SUSPICIOUS_ACTIVITY : AuditEventType.LOGIN_SUCCESS)
                .result(verdict.hasViolations() ? AuditResult.FAILURE : AuditResult.SUCCESS)
                .userId(verdict.userId())
                .ipAddress(context.ipAddress())
                .userAgent(context.userAgent())
                .sessionId(context.sessionId())
                .reason(verdict.hasViolations() ? String.join(", ", violationNames) : "Session validation passed")
                .metadata(new AuditMetadata.SessionValidation(
                        violationNames,
                        verdict.riskLevel(),
                        verdict.actions().stream().map(Enum::name).toList(),
                        verdict.securityScore()))
                .build());
    }

    /**
     * Record a successful re-authentication.
     */
    public void markReauthCompleted(String userId) {
        lastReauth.put(userId, clock.instant());
        reauthRequired.remove(userId);
        LOG.debugf("Re-authentication completed for %s", userId);
    }

    /**
     * Force a re-authentication on the user's next validation.
     */
    public void markReauthRequired(String userId) {
        reauthRequired.add(userId);
        lastReauth.remove(userId);
    }

    /**
     * Forget all per-user security state after a logout and audit it.
     *
     * @param userId user logging out
     * @param reason logout reason (e.g. {@code USER_LOGOUT}, {@code FORCED})
     */
    public void recordLogout(String userId, String reason) {
        securityInfo.invalidate(userId);
        lastReauth.remove(userId);
        reauthRequired.remove(userId);
        history.clear(userId);
        auditTrail.logEvent(AuditLogEntry.builder(AuditEventType.LOGOUT)
                .result(AuditResult.SUCCESS)
                .userId(userId)
                .reason(reason != null ? reason : "USER_LOGOUT")
                .build());
        LOG.infof("Session state cleared for %s (%s)", userId, reason);
    }

    /**
     * Latest cached security state of a user.
     */
    public Optional<SessionSecurityInfo> getSessionSecurityInfo(String userId) {
        return securityInfo.get(userId);
    }

    /**
     * Validation history of one user, or of all users when {@code userId} is null.
     */
    public List<SessionObservation> getSessionHistory(String userId) {
        return userId != null ? history.forUser(userId) : history.all();
    }

    /**
     * Aggregate view over the cached verdicts of all users.
     */
    public SessionSecuritySummary getSecuritySummary() {
        final var infos = securityInfo.snapshot().values();
        final var riskDistribution = new EnumMap<RiskLevel, Integer>(RiskLevel.class);
        for (final var level : RiskLevel.values()) {
            riskDistribution.put(level, 0);
        }
        final var violations = new EnumMap<ViolationKind, Integer>(ViolationKind.class);
        var totalScore = 0;
        for (final var info : infos) {
            final var verdict = info.lastVerdict();
            riskDistribution.merge(verdict.riskLevel(), 1, Integer::sum);
            verdict.violations().forEach(v -> violations.merge(v, 1, Integer::sum));
            totalScore += verdict.securityScore();
        }
        final var total = infos.size();
        final var average = total > 0 ? (double) totalScore / total : 100.0;

        final var recommendations = new ArrayList<String>();
        if (riskDistribution.get(RiskLevel.CRITICAL) > 0) {
            recommendations.add("Immediately review critical risk sessions and consider forced logout");
        }
        if (riskDistribution.get(RiskLevel.HIGH) > total * 0.3) {
            recommendations.add("High number of high-risk sessions detected - review security policies");
        }
        if (average < 70) {
            recommendations.add("Average security score is low - consider implementing stricter session controls");
        }
        return new SessionSecuritySummary(total, riskDistribution, violations, average, recommendations);
    }
}
