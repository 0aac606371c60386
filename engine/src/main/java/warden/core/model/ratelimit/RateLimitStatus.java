package warden.core.model.ratelimit;

import java.time.Instant;

/**
 * Display-oriented snapshot of an identifier's rate limit state.
 *
 * @param attempts           attempts counted so far
 * @param remainingAttempts  attempts left before the limit is reached
 * @param lockedUntil        end of the active lockout (null if none)
 * @param nextAttemptAllowed end of the progressive delay (null if none)
 */
public record RateLimitStatus(
        double attempts, double remainingAttempts, Instant lockedUntil, Instant nextAttemptAllowed) {

    public static RateLimitStatus clean(int maxAttempts) {
        return new RateLimitStatus(0, maxAttempts, null, null);
    }
}
