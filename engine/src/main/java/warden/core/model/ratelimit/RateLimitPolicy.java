package warden.core.model.ratelimit;

import java.time.Duration;

/**
 * Parameters of one rate limit scope.
 *
 * @param maxAttempts              attempts allowed inside {@code window}
 * @param window                   cooldown window; records idle longer than this reset
 * @param lockoutDuration          lockout applied when the limit is hit (null disables hard locks)
 * @param progressiveDelays        whether a progressive delay is computed at all
 * @param delayBase                delay after the first attempt
 * @param delayMultiplier          growth factor per additional attempt
 * @param maxDelay                 upper bound of the progressive delay
 * @param enforceProgressiveDelay  deny inside the delay (true) or report it as advisory (false)
 * @param captchaThreshold         attempts from which a CAPTCHA is requested
 */
public record RateLimitPolicy(
        int maxAttempts,
        Duration window,
        Duration lockoutDuration,
        boolean progressiveDelays,
        Duration delayBase,
        double delayMultiplier,
        Duration maxDelay,
        boolean enforceProgressiveDelay,
        int captchaThreshold) {

    public RateLimitPolicy {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive, got " + maxAttempts);
        }
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be a positive duration, got " + window);
        }
        if (delayMultiplier < 1.0) {
            throw new IllegalArgumentException("delayMultiplier must be >= 1.0, got " + delayMultiplier);
        }
    }

    /**
     * Progressive delay after {@code attempts} attempts: {@code min(base * multiplier^(attempts-1), max)}.
     *
     * @param attempts the attempt count including the current one
     * @return the delay, zero when delays are disabled or no attempts were made
     */
    public Duration progressiveDelay(double attempts) {
        if (!progressiveDelays || attempts <= 0 || delayBase == null) {
            return Duration.ZERO;
        }
        final var millis = delayBase.toMillis() * Math.pow(delayMultiplier, attempts - 1);
        final var capped = maxDelay != null ? Math.min(millis, maxDelay.toMillis()) : millis;
        return Duration.ofMillis((long) capped);
    }

    public boolean locks() {
        return lockoutDuration != null && !lockoutDuration.isZero();
    }

    public boolean needsCaptcha(double attempts) {
        return attempts >= captchaThreshold;
    }
}
