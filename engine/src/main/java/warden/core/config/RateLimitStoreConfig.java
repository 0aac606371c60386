package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Behavior of the rate limit store shared by the login and password reset limiters.
 *
 * <p>Configuration prefix: {@code warden.rate-limit}
 */
@ConfigMapping(prefix = "warden.rate-limit")
public interface RateLimitStoreConfig {

    /**
     * Deny checks while the backing store is unavailable.
     *
     * <p>When false, checks are allowed and a warning is logged.
     *
     * @return true to fail closed (default: true)
     */
    @WithDefault("true")
    boolean failClosed();

    /**
     * Wait time reported with fail-closed denials.
     *
     * @return retry after (default: 1 minute)
     */
    @WithDefault("PT1M")
    Duration failClosedRetryAfter();

    /**
     * Interval of the background sweep purging expired records and suspicious markers.
     *
     * @return sweep interval (default: 10 minutes)
     */
    @WithDefault("PT10M")
    Duration sweepInterval();
}
