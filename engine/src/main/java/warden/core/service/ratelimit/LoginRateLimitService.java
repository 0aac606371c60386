package warden.core.service.ratelimit;

import java.time.Clock;
import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import warden.core.config.LoginRateLimitConfig;
import warden.core.config.RateLimitStoreConfig;
import warden.core.model.audit.AuditEventType;
import warden.core.model.audit.AuditLogEntry;
import warden.core.model.audit.AuditMetadata;
import warden.core.model.audit.AuditResult;
import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.model.ratelimit.RateLimitPolicy;
import warden.core.model.ratelimit.RateLimitRecord;
import warden.core.model.ratelimit.RateLimitStatus;
import warden.core.port.in.AuditTrail;
import warden.core.port.out.SecurityAlerting;
import warden.spi.RateLimitRecordStore;
import warden.spi.SecurityEvent;

/**
 * Service for login rate limiting (brute force protection).
 *
 * <p>
 * Failed logins are counted per identifier (email, username or IP). Each failure grows a
 * mandatory delay before the next attempt, a CAPTCHA is requested from
 * {@link LoginRateLimitConfig#captchaThreshold()} failures, and the identifier is locked
 * once {@link LoginRateLimitConfig#maxAttempts()} is reached. A successful login clears
 * everything.
 *
 * <p>
 * Denials, failures, lockouts and successes are written to the audit trail.
 */
@ApplicationScoped
public class LoginRateLimitService {

    private static final Logger LOG = Logger.getLogger(LoginRateLimitService.class);

    static final String SCOPE = "login";

    private final LoginRateLimitConfig config;
    private final RateLimitStore limiter;
    private final AuditTrail auditTrail;
    private final SecurityAlerting alerting;
    private final Clock clock;

    public LoginRateLimitService(
            LoginRateLimitConfig config,
            RateLimitStoreConfig storeConfig,
            RateLimitRecordStore store,
            AuditTrail auditTrail,
            SecurityAlerting alerting,
            Clock clock) {
        this.config = config;
        this.auditTrail = auditTrail;
        this.alerting = alerting;
        this.clock = clock;
        this.limiter = new RateLimitStore(
                SCOPE,
                policy(config),
                store,
                clock,
                storeConfig.failClosed(),
                storeConfig.failClosedRetryAfter());
    }

    static RateLimitPolicy policy(LoginRateLimitConfig config) {
        return new RateLimitPolicy(
                config.maxAttempts(),
                config.lockoutDuration(),
                config.lockoutDuration(),
                config.progressiveDelay(),
                config.delayBase(),
                config.delayMultiplier(),
                config.maxDelay(),
                true,
                config.captchaThreshold());
    }

    /**
     * Check whether a login attempt for the identifier may proceed.
     *
     * @param identifier email, username or IP
     * @return the decision; denials carry a wait time
     */
    public RateLimitDecision checkRateLimit(String identifier) {
        if (!config.enabled()) {
            return RateLimitDecision.allow();
        }

        final var decision = limiter.check(identifier);
        if (!decision.allowed()) {
            LOG.debugf("Login blocked for %s: wait %s", identifier, decision.waitTime());
            auditTrail.logEvent(AuditLogEntry.builder(AuditEventType.RATE_LIMIT_EXCEEDED)
                    .result(AuditResult.DENIED)
                    .userId(identifier)
                    .reason(decision.storeUnavailable() ? "store_unavailable" : "login_rate_limit")
                    .metadata(new AuditMetadata.RateLimit(
                            SCOPE, decision.attempts(), decision.waitTime().toSeconds(), decision.needsCaptcha()))
                    .build());
            if (!decision.storeUnavailable()) {
                alerting.publish(new SecurityEvent.RateLimitExceeded(
                        clock.instant(), identifier, SCOPE, decision.attempts(), config.maxAttempts()));
            }
        }
        return decision;
    }

    /**
     * Record a failed login. Locks the identifier once the limit is reached.
     *
     * @param identifier email, username or IP
     * @return the updated status
     */
    public RateLimitStatus recordFailedAttempt(String identifier) {
        if (!config.enabled()) {
            return RateLimitStatus.clean(config.maxAttempts());
        }

        final var before = limiter.find(identifier);
        final var now = clock.instant();
        final var record = limiter.recordFailure(identifier, 1.0);

        auditTrail.logEvent(AuditLogEntry.builder(AuditEventType.LOGIN_FAILURE)
                .result(AuditResult.FAILURE)
                .userId(identifier)
                .reason("invalid_credentials")
                .metadata(new AuditMetadata.RateLimit(
                        SCOPE, record.attempts(), record.progressiveDelay().toSeconds(), record.isLocked(now)))
                .build());

        if (record.isLocked(now) && (before == null || !before.isLocked(now))) {
            onLocked(identifier, record);
        }
        return limiter.status(identifier);
    }

    /**
     * Record a successful login, clearing all attempts of the identifier.
     *
     * @param identifier email, username or IP
     * @param userId     authenticated user (may be null)
     */
    public void recordSuccessfulAttempt(String identifier, String userId) {
        limiter.recordSuccess(identifier);
        auditTrail.logEvent(AuditLogEntry.builder(AuditEventType.LOGIN_SUCCESS)
                .result(AuditResult.SUCCESS)
                .userId(userId != null ? userId : identifier)
                .reason("login_succeeded")
                .build());
    }

    public RateLimitStatus getRateLimitStatus(String identifier) {
        return limiter.status(identifier);
    }

    /**
     * Administrative unlock of an identifier.
     *
     * @param identifier email, username or IP
     * @param clearedBy  operator performing the unlock
     */
    public void clearRateLimit(String identifier, String clearedBy) {
        limiter.clear(identifier);
        LOG.infof("Login rate limit cleared for %s by %s", identifier, clearedBy);
        auditTrail.logEvent(AuditLogEntry.builder(AuditEventType.ACCOUNT_UNLOCKED)
                .result(AuditResult.SUCCESS)
                .userId(clearedBy)
                .targetUserId(identifier)
                .action("clear_rate_limit")
                .build());
    }

    /**
     * Remove records whose window passed.
     *
     * @return number of removed records
     */
    public int sweepExpired() {
        return limiter.sweepExpired(clock.instant());
    }

    private void onLocked(String identifier, RateLimitRecord record) {
        LOG.warnf("Login identifier %s locked until %s", identifier, record.lockedUntil());
        auditTrail.logEvent(AuditLogEntry.builder(AuditEventType.ACCOUNT_LOCKED)
                .result(AuditResult.DENIED)
                .userId(identifier)
                .reason("too_many_failed_attempts")
                .metadata(new AuditMetadata.RateLimit(
                        SCOPE,
                        record.attempts(),
                        Duration.between(clock.instant(), record.lockedUntil()).toSeconds(),
                        true))
                .build());
        alerting.publish(
                new SecurityEvent.AccountLocked(clock.instant(), identifier, record.attempts(), record.lockedUntil()));
    }
}
