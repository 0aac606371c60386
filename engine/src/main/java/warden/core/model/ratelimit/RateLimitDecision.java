package warden.core.model.ratelimit;

import java.time.Duration;

/**
 * Outcome of a rate limit check. A denial is a value, not an exception.
 *
 * @param allowed          whether the attempt may proceed
 * @param waitTime         time until the next attempt is allowed (zero when allowed)
 * @param needsCaptcha     whether the caller should present a CAPTCHA
 * @param attempts         attempts counted for the identifier
 * @param progressiveDelay advisory delay the caller may apply (zero if none)
 * @param storeUnavailable true when the decision was made without the backing store
 */
public record RateLimitDecision(
        boolean allowed,
        Duration waitTime,
        boolean needsCaptcha,
        double attempts,
        Duration progressiveDelay,
        boolean storeUnavailable) {

    public static RateLimitDecision allow() {
        return new RateLimitDecision(true, Duration.ZERO, false, 0, Duration.ZERO, false);
    }

    public static RateLimitDecision allow(double attempts, boolean needsCaptcha, Duration progressiveDelay) {
        return new RateLimitDecision(true, Duration.ZERO, needsCaptcha, attempts, progressiveDelay, false);
    }

    public static RateLimitDecision deny(Duration waitTime, boolean needsCaptcha, double attempts) {
        return new RateLimitDecision(
                false, waitTime.isNegative() ? Duration.ZERO : waitTime, needsCaptcha, attempts, Duration.ZERO, false);
    }

    public static RateLimitDecision storeUnavailable(boolean failClosed, Duration retryAfter) {
        return failClosed
                ? new RateLimitDecision(false, retryAfter, true, 0, Duration.ZERO, true)
                : new RateLimitDecision(true, Duration.ZERO, false, 0, Duration.ZERO, true);
    }
}
