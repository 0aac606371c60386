package warden.core.model.ratelimit;

import java.time.Duration;

/**
 * Status of a single reset scope identifier, for administrators.
 */
public record ScopeStatus(double attempts, Duration waitTime, boolean suspicious) {

    public static ScopeStatus none() {
        return new ScopeStatus(0, Duration.ZERO, false);
    }
}
