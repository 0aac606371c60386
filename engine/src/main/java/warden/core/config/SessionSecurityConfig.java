package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for session security validation.
 *
 * <p>Configuration prefix: {@code warden.session}
 *
 * @see warden.core.service.session.SessionSecurityValidator
 */
@ConfigMapping(prefix = "warden.session")
public interface SessionSecurityConfig {

    /**
     * Active sessions a user may hold before the oldest should be terminated.
     *
     * @return max concurrent sessions (default: 3)
     */
    @WithDefault("3")
    int maxConcurrentSessions();

    /**
     * Flag sessions presented from a device the user never used.
     *
     * @return true if sessions are bound to devices (default: true)
     */
    @WithDefault("true")
    boolean bindToDevice();

    /**
     * Require periodic re-authentication.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean requirePeriodicReauth();

    /**
     * Time after the last re-authentication from which a new one is required.
     *
     * @return re-authentication interval (default: 4 hours)
     */
    @WithDefault("PT4H")
    Duration reauthInterval();

    /**
     * Audit every validation, not only those with violations.
     *
     * @return true to audit clean validations too (default: true)
     */
    @WithDefault("true")
    boolean logAllSessionEvents();

    /**
     * Validations kept per user for analysis.
     *
     * @return history size (default: 50)
     */
    @WithDefault("50")
    int historySize();

    /**
     * How long the latest security info of a user stays cached without new validations.
     *
     * @return TTL (default: 30 minutes)
     */
    @WithDefault("PT30M")
    Duration infoCacheTtl();

    /**
     * @return maximum users with cached security info (default: 10000)
     */
    @WithDefault("10000")
    long infoCacheMaxSize();
}
