package warden.core.model.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Marks an identifier as suspicious until {@code expiresAt}.
 *
 * <p>Expiry is checked lazily on read; the background sweep only reclaims memory.
 */
public record SuspiciousMarker(String identifier, Instant expiresAt) {

    public boolean isActive(Instant now) {
        return !now.isAfter(expiresAt);
    }

    public Duration remaining(Instant now) {
        final var remaining = Duration.between(now, expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
