package warden.core.model.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Per-identifier attempt counter.
 *
 * <p>{@code attempts} is fractional so partial penalties (for example a failed password
 * reset against an unknown email) accumulate exactly.
 *
 * @param identifier       the scoped key (e.g. {@code email:a@x.com})
 * @param attempts         attempts counted in the current window
 * @param lastAttempt      when the last attempt was recorded
 * @param lockedUntil      end of the current lockout, or null when not locked
 * @param progressiveDelay mandatory wait after {@code lastAttempt}
 */
public record RateLimitRecord(
        String identifier, double attempts, Instant lastAttempt, Instant lockedUntil, Duration progressiveDelay) {

    public RateLimitRecord {
        if (progressiveDelay == null) {
            progressiveDelay = Duration.ZERO;
        }
    }

    public static RateLimitRecord first(String identifier, double attempts, Instant now, Duration delay) {
        return new RateLimitRecord(identifier, attempts, now, null, delay);
    }

    public RateLimitRecord withAttempt(double newAttempts, Instant now, Duration delay) {
        return new RateLimitRecord(identifier, newAttempts, now, lockedUntil, delay);
    }

    public RateLimitRecord withAttempts(double newAttempts) {
        return new RateLimitRecord(identifier, newAttempts, lastAttempt, lockedUntil, progressiveDelay);
    }

    public RateLimitRecord lockedUntil(Instant until) {
        return new RateLimitRecord(identifier, attempts, lastAttempt, until, progressiveDelay);
    }

    public boolean isLocked(Instant now) {
        return lockedUntil != null && now.isBefore(lockedUntil);
    }

    public boolean isDelayed(Instant now) {
        return !progressiveDelay.isZero() && now.isBefore(nextAttemptAllowed());
    }

    public Instant nextAttemptAllowed() {
        return lastAttempt.plus(progressiveDelay);
    }

    /**
     * A record is stale once its window has passed since the last attempt and no lock is active.
     */
    public boolean isStale(Instant now, Duration window) {
        return !isLocked(now) && Duration.between(lastAttempt, now).compareTo(window) > 0;
    }
}
