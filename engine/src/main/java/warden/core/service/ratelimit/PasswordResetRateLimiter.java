package warden.core.service.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import warden.core.config.PasswordResetConfig;
import warden.core.config.RateLimitStoreConfig;
import warden.core.model.audit.AuditEventType;
import warden.core.model.audit.AuditLogEntry;
import warden.core.model.audit.AuditMetadata;
import warden.core.model.audit.AuditResult;
import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.model.ratelimit.RateLimitPolicy;
import warden.core.model.ratelimit.RateLimitRecord;
import warden.core.model.ratelimit.ResetCheckResult;
import warden.core.model.ratelimit.ResetDenialReason;
import warden.core.model.ratelimit.ScopeStatus;
import warden.core.model.ratelimit.SuspiciousMarker;
import warden.core.port.in.AuditTrail;
import warden.core.port.out.SecurityAlerting;
import warden.spi.RateLimitRecordStore;
import warden.spi.SecurityEvent;
import warden.spi.StorageProviderException;

/**
 * Layered limiter for password reset requests.
 *
 * <p>
 * A check evaluates four scopes in order and stops at the first denial:
 * <ol>
 *   <li>email ({@code email_rate_limit})</li>
 *   <li>IP address ({@code ip_rate_limit})</li>
 *   <li>global ({@code global_rate_limit})</li>
 *   <li>suspicious activity ({@code suspicious_activity})</li>
 * </ol>
 *
 * <p>
 * Checks never change rate state. Callers record a dispatched reset with
 * {@link #recordResetRequest} or a request against an unknown email with
 * {@link #recordFailedReset}, which only adds a partial attempt.
 *
 * <p>
 * An email or IP reaching {@link PasswordResetConfig#suspiciousRequestThreshold()} attempts is
 * marked suspicious and denied for {@link PasswordResetConfig#suspiciousActivityCooldown()},
 * whatever its own counter says. Markers lapse when read after their expiry; the background
 * sweep reclaims them.
 */
@ApplicationScoped
public class PasswordResetRateLimiter {

    private static final Logger LOG = Logger.getLogger(PasswordResetRateLimiter.class);

    static final String EMAIL_SCOPE = "reset-email";
    static final String IP_SCOPE = "reset-ip";
    static final String GLOBAL_SCOPE = "reset-global";
    static final String SUSPICIOUS_PREFIX = "reset-suspicious:";
    static final String GLOBAL_KEY = "global";

    private final PasswordResetConfig config;
    private final RateLimitStoreConfig storeConfig;
    private final RateLimitRecordStore store;
    private final RateLimitStore emailLimiter;
    private final RateLimitStore ipLimiter;
    private final RateLimitStore globalLimiter;
    private final AuditTrail auditTrail;
    private final SecurityAlerting alerting;
    private final Clock clock;

    public PasswordResetRateLimiter(
            PasswordResetConfig config,
            RateLimitStoreConfig storeConfig,
            RateLimitRecordStore store,
            AuditTrail auditTrail,
            SecurityAlerting alerting,
            Clock clock) {
        if (config.failedResetPenalty() <= 0) {
            throw new IllegalArgumentException(
                    "failedResetPenalty must be positive, got " + config.failedResetPenalty());
        }
        if (config.suspiciousRequestThreshold() <= 0) {
            throw new IllegalArgumentException(
                    "suspiciousRequestThreshold must be positive, got " + config.suspiciousRequestThreshold());
        }
        this.config = config;
        this.storeConfig = storeConfig;
        this.store = store;
        this.auditTrail = auditTrail;
        this.alerting = alerting;
        this.clock = clock;

        final var failClosed = storeConfig.failClosed();
        final var retryAfter = storeConfig.failClosedRetryAfter();
        this.emailLimiter = new RateLimitStore(
                EMAIL_SCOPE,
                scopePolicy(config.maxRequestsPerEmail(), config.emailWindow(), config.progressiveDelay()),
                store,
                clock,
                failClosed,
                retryAfter);
        this.ipLimiter = new RateLimitStore(
                IP_SCOPE,
                scopePolicy(config.maxRequestsPerIp(), config.ipWindow(), false),
                store,
                clock,
                failClosed,
                retryAfter);
        this.globalLimiter = new RateLimitStore(
                GLOBAL_SCOPE,
                scopePolicy(config.maxGlobalRequests(), config.globalWindow(), false),
                store,
                clock,
                failClosed,
                retryAfter);
    }

    private RateLimitPolicy scopePolicy(int maxAttempts, Duration window, boolean progressiveDelays) {
        return new RateLimitPolicy(
                maxAttempts,
                window,
                null,
                progressiveDelays,
                config.delayBase(),
                config.delayMultiplier(),
                config.maxDelay(),
                false,
                config.captchaThreshold());
    }

    /**
     * Decide whether a reset email may be sent. Does not change rate state.
     *
     * @param email     target email
     * @param ipAddress client address (may be null)
     * @param userAgent client user agent (may be null)
     * @return the decision with the counters observed
     */
    public ResetCheckResult checkResetRequest(String email, String ipAddress, String userAgent) {
        if (!config.enabled()) {
            return ResetCheckResult.allow(false, Duration.ZERO, ResetCheckResult.Metadata.empty());
        }

        final var normalizedEmail = normalize(email);
        final var result = evaluate(normalizedEmail, ipAddress);

        auditTrail.logEvent(AuditLogEntry.builder(AuditEventType.PASSWORD_RESET)
                .result(result.allowed() ? AuditResult.SUCCESS : AuditResult.DENIED)
                .ipAddress(ipAddress)
                .userAgent(userAgent)
                .action("check_reset_request")
                .reason(result.allowed() ? "allowed" : result.reasonCode())
                .metadata(resetMetadata(normalizedEmail, result.reasonCode(), result))
                .build());

        if (!result.allowed()) {
            LOG.debugf("Password reset denied for %s from %s: %s", normalizedEmail, ipAddress, result.reasonCode());
        }
        return result;
    }

    private ResetCheckResult evaluate(String email, String ipAddress) {
        final var emailDecision = emailLimiter.peek(email);
        var metadata = new ResetCheckResult.Metadata(emailDecision.attempts(), 0, 0, false);
        if (!emailDecision.allowed()) {
            return denied(ResetDenialReason.EMAIL_RATE_LIMIT, email, emailDecision, metadata, emailLimiter);
        }

        final var ipDecision = ipAddress != null ? ipLimiter.peek(ipAddress) : RateLimitDecision.allow();
        metadata = new ResetCheckResult.Metadata(emailDecision.attempts(), ipDecision.attempts(), 0, false);
        if (!ipDecision.allowed()) {
            return denied(ResetDenialReason.IP_RATE_LIMIT, ipAddress, ipDecision, metadata, ipLimiter);
        }

        final var globalDecision = globalLimiter.peek(GLOBAL_KEY);
        metadata = new ResetCheckResult.Metadata(
                emailDecision.attempts(), ipDecision.attempts(), globalDecision.attempts(), false);
        if (!globalDecision.allowed()) {
            return denied(ResetDenialReason.GLOBAL_RATE_LIMIT, GLOBAL_KEY, globalDecision, metadata, globalLimiter);
        }

        final Optional<Duration> suspiciousWait;
        try {
            suspiciousWait = suspiciousWait(email, ipAddress);
        } catch (StorageProviderException e) {
            LOG.warnf("Suspicious marker lookup failed: %s", e.getMessage());
            if (storeConfig.failClosed()) {
                return ResetCheckResult.deny(
                        ResetDenialReason.STORE_UNAVAILABLE, storeConfig.failClosedRetryAfter(), metadata);
            }
            return allowed(emailDecision, ipDecision, metadata);
        }
        if (suspiciousWait.isPresent()) {
            return ResetCheckResult.deny(
                    ResetDenialReason.SUSPICIOUS_ACTIVITY,
                    suspiciousWait.get(),
                    new ResetCheckResult.Metadata(
                            metadata.emailAttempts(), metadata.ipAttempts(), metadata.globalAttempts(), true));
        }

        return allowed(emailDecision, ipDecision, metadata);
    }

    private ResetCheckResult allowed(
            RateLimitDecision emailDecision, RateLimitDecision ipDecision, ResetCheckResult.Metadata metadata) {
        return ResetCheckResult.allow(
                emailDecision.needsCaptcha() || ipDecision.needsCaptcha(), emailDecision.progressiveDelay(), metadata);
    }

    private ResetCheckResult denied(
            ResetDenialReason reason,
            String subject,
            RateLimitDecision decision,
            ResetCheckResult.Metadata metadata,
            RateLimitStore limiter) {
        if (decision.storeUnavailable()) {
            return ResetCheckResult.deny(ResetDenialReason.STORE_UNAVAILABLE, decision.waitTime(), metadata);
        }
        alerting.publish(new SecurityEvent.RateLimitExceeded(
                clock.instant(),
                subject,
                limiter.scope(),
                decision.attempts(),
                limiter.policy().maxAttempts()));
        return ResetCheckResult.deny(reason, decision.waitTime(), metadata);
    }

    private Optional<Duration> suspiciousWait(String email, String ipAddress) {
        final var now = clock.instant();
        var wait = Optional.<Duration>empty();
        for (final var key : new String[] {markerKey(EMAIL_SCOPE, email), markerKey(IP_SCOPE, ipAddress)}) {
            if (key == null) {
                continue;
            }
            final var marker = store.findMarker(key).filter(m -> m.isActive(now));
            if (marker.isPresent()) {
                final var remaining = marker.get().remaining(now);
                if (wait.isEmpty() || remaining.compareTo(wait.get()) > 0) {
                    wait = Optional.of(remaining);
                }
            }
        }
        return wait;
    }

    /**
     * Count a dispatched reset against the email, IP and global scopes.
     *
     * @param email     target email
     * @param ipAddress client address (may be null)
     * @param userAgent client user agent (may be null)
     * @throws StorageProviderException if the rate limit store is unavailable
     */
    public void recordResetRequest(String email, String ipAddress, String userAgent) {
        if (!config.enabled()) {
            return;
        }
        final var normalizedEmail = normalize(email);
        final var emailRecord = emailLimiter.recordFailure(normalizedEmail, 1.0);
        markIfSuspicious(EMAIL_SCOPE, normalizedEmail, emailRecord);
        if (ipAddress != null) {
            final var ipRecord = ipLimiter.recordFailure(ipAddress, 1.0);
            markIfSuspicious(IP_SCOPE, ipAddress, ipRecord);
        }
        globalLimiter.recordFailure(GLOBAL_KEY, 1.0);
        LOG.debugf("Recorded password reset request for %s from %s", normalizedEmail, ipAddress);
    }

    /**
     * Count a reset request against an email that does not exist.
     *
     * <p>
     * Adds {@link PasswordResetConfig#failedResetPenalty()} attempts to the email and IP
     * scopes, so probing for valid emails is limited more gently than abuse of a real one.
     * The penalty does not move the start of the current window.
     *
     * @param email     target email
     * @param ipAddress client address (may be null)
     * @param userAgent client user agent (may be null)
     * @param reason    why the reset failed
     * @throws StorageProviderException if the rate limit store is unavailable
     */
    public void recordFailedReset(String email, String ipAddress, String userAgent, String reason) {
        if (!config.enabled()) {
            return;
        }
        final var normalizedEmail = normalize(email);
        final var penalty = config.failedResetPenalty();
        final var emailRecord = emailLimiter.addPenalty(normalizedEmail, penalty);
        markIfSuspicious(EMAIL_SCOPE, normalizedEmail, emailRecord);
        RateLimitRecord ipRecord = null;
        if (ipAddress != null) {
            ipRecord = ipLimiter.addPenalty(ipAddress, penalty);
            markIfSuspicious(IP_SCOPE, ipAddress, ipRecord);
        }

        auditTrail.logEvent(AuditLogEntry.builder(AuditEventType.PASSWORD_RESET)
                .result(AuditResult.FAILURE)
                .ipAddress(ipAddress)
                .userAgent(userAgent)
                .action("failed_reset")
                .reason(reason)
                .metadata(new AuditMetadata.PasswordReset(
                        normalizedEmail,
                        reason,
                        emailRecord.attempts(),
                        ipRecord != null ? ipRecord.attempts() : 0,
                        0,
                        false,
                        false))
                .build());
    }

    private void markIfSuspicious(String scope, String identifier, RateLimitRecord record) {
        if (record.attempts() < config.suspiciousRequestThreshold()) {
            return;
        }
        final var now = clock.instant();
        final var key = markerKey(scope, identifier);
        if (store.findMarker(key).filter(m -> m.isActive(now)).isPresent()) {
            return;
        }
        final var expiresAt = now.plus(config.suspiciousActivityCooldown());
        store.putMarker(new SuspiciousMarker(key, expiresAt));
        LOG.warnf("Marked %s %s as suspicious until %s after %.1f attempts", scope, identifier, expiresAt,
                record.attempts());
        alerting.publish(new SecurityEvent.SuspiciousActivity(now, identifier, scope, record.attempts(), expiresAt));
    }

    public ScopeStatus getEmailStatus(String email) {
        final var normalizedEmail = normalize(email);
        return scopeStatus(emailLimiter, normalizedEmail, markerKey(EMAIL_SCOPE, normalizedEmail));
    }

    public ScopeStatus getIpStatus(String ipAddress) {
        return scopeStatus(ipLimiter, ipAddress, markerKey(IP_SCOPE, ipAddress));
    }

    private ScopeStatus scopeStatus(RateLimitStore limiter, String identifier, String markerKey) {
        final var now = clock.instant();
        final var decision = limiter.peek(identifier);
        final var marker = store.findMarker(markerKey).filter(m -> m.isActive(now));
        final var wait = marker.map(m -> m.remaining(now))
                .filter(remaining -> remaining.compareTo(decision.waitTime()) > 0)
                .orElse(decision.waitTime());
        return new ScopeStatus(limiter.status(identifier).attempts(), wait, marker.isPresent());
    }

    /**
     * Drop all reset counters and suspicious markers.
     */
    public void reset() {
        emailLimiter.clearAll();
        ipLimiter.clearAll();
        globalLimiter.clearAll();
        store.clear(SUSPICIOUS_PREFIX);
        LOG.info("Password reset rate limits cleared");
    }

    /**
     * Remove expired records of every scope and lapsed suspicious markers.
     *
     * @return number of removed records and markers
     */
    public int sweepExpired() {
        final var now = clock.instant();
        return emailLimiter.sweepExpired(now)
                + ipLimiter.sweepExpired(now)
                + globalLimiter.sweepExpired(now)
                + store.removeExpiredMarkers(now);
    }

    private AuditMetadata.PasswordReset resetMetadata(String email, String reason, ResetCheckResult result) {
        final var metadata = result.metadata();
        return new AuditMetadata.PasswordReset(
                email,
                reason,
                metadata.emailAttempts(),
                metadata.ipAttempts(),
                metadata.globalAttempts(),
                metadata.suspicious(),
                result.needsCaptcha());
    }

    private static String markerKey(String scope, String identifier) {
        return identifier != null ? SUSPICIOUS_PREFIX + scope + ":" + identifier : null;
    }

    private static String normalize(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }
}
