package warden.core.model.ratelimit;

import java.time.Duration;

/**
 * Result of a password reset check.
 *
 * @param allowed          whether the reset email may be dispatched
 * @param reason           denial reason (null when allowed)
 * @param waitTime         time until a retry may succeed (zero when allowed)
 * @param needsCaptcha     whether a CAPTCHA must be solved first
 * @param progressiveDelay advisory delay for the email scope
 * @param metadata         per-scope counters observed during the check
 */
public record ResetCheckResult(
        boolean allowed,
        ResetDenialReason reason,
        Duration waitTime,
        boolean needsCaptcha,
        Duration progressiveDelay,
        Metadata metadata) {

    public static ResetCheckResult allow(boolean needsCaptcha, Duration progressiveDelay, Metadata metadata) {
        return new ResetCheckResult(true, null, Duration.ZERO, needsCaptcha, progressiveDelay, metadata);
    }

    public static ResetCheckResult deny(ResetDenialReason reason, Duration waitTime, Metadata metadata) {
        return new ResetCheckResult(false, reason, waitTime, true, Duration.ZERO, metadata);
    }

    public String reasonCode() {
        return reason != null ? reason.code() : null;
    }

    /**
     * Counters observed while evaluating the scopes.
     */
    public record Metadata(double emailAttempts, double ipAttempts, double globalAttempts, boolean suspicious) {

        public static Metadata empty() {
            return new Metadata(0, 0, 0, false);
        }
    }
}
