package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for login rate limiting (brute force protection).
 *
 * <p>Configuration prefix: {@code warden.login.rate-limit}
 *
 * <p>Failed login attempts are counted per identifier (email, username or IP). After
 * {@link #maxAttempts()} failures the identifier is locked for {@link #lockoutDuration()}.
 * Between attempts a progressive delay grows exponentially up to {@link #maxDelay()}.
 *
 * @see warden.core.service.ratelimit.LoginRateLimitService
 */
@ConfigMapping(prefix = "warden.login.rate-limit")
public interface LoginRateLimitConfig {

    /**
     * Enable login rate limiting.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Maximum failed attempts before lockout.
     *
     * @return max attempts (default: 5)
     */
    @WithDefault("5")
    int maxAttempts();

    /**
     * Duration of the lockout after max failed attempts.
     *
     * <p>Also the cooldown window: a record idle for longer than this is reset on the next check.
     *
     * @return lockout duration (default: 15 minutes)
     */
    @WithDefault("PT15M")
    Duration lockoutDuration();

    /**
     * Enforce a growing delay between failed attempts.
     *
     * @return true if progressive delays are enabled (default: true)
     */
    @WithDefault("true")
    boolean progressiveDelay();

    /**
     * Delay after the first failed attempt.
     *
     * @return base delay (default: 1 second)
     */
    @WithDefault("PT1S")
    Duration delayBase();

    /**
     * Growth factor of the delay per additional failure.
     *
     * @return multiplier (default: 2.0)
     */
    @WithDefault("2.0")
    double delayMultiplier();

    /**
     * Upper bound of the progressive delay.
     *
     * @return max delay (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration maxDelay();

    /**
     * Failed attempts from which callers should present a CAPTCHA.
     *
     * @return CAPTCHA threshold (default: 3)
     */
    @WithDefault("3")
    int captchaThreshold();
}
