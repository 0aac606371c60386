package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for password reset abuse prevention.
 *
 * <p>Configuration prefix: {@code warden.password-reset}
 *
 * <p>Reset requests are limited per email, per IP and globally. Identifiers crossing
 * {@link #suspiciousRequestThreshold()} are denied outright for
 * {@link #suspiciousActivityCooldown()}.
 *
 * @see warden.core.service.ratelimit.PasswordResetRateLimiter
 */
@ConfigMapping(prefix = "warden.password-reset")
public interface PasswordResetConfig {

    /**
     * Enable password reset limiting.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * @return reset requests allowed per email inside {@link #emailWindow()} (default: 3)
     */
    @WithDefault("3")
    int maxRequestsPerEmail();

    /**
     * @return email window (default: 1 hour)
     */
    @WithDefault("PT1H")
    Duration emailWindow();

    /**
     * @return reset requests allowed per IP inside {@link #ipWindow()} (default: 10)
     */
    @WithDefault("10")
    int maxRequestsPerIp();

    /**
     * @return IP window (default: 1 hour)
     */
    @WithDefault("PT1H")
    Duration ipWindow();

    /**
     * @return reset requests allowed across all identifiers inside {@link #globalWindow()} (default: 100)
     */
    @WithDefault("100")
    int maxGlobalRequests();

    /**
     * @return global window (default: 15 minutes)
     */
    @WithDefault("PT15M")
    Duration globalWindow();

    /**
     * Report a progressive delay with allowed email checks.
     *
     * @return true if delays are computed (default: true)
     */
    @WithDefault("true")
    boolean progressiveDelay();

    @WithDefault("PT5S")
    Duration delayBase();

    @WithDefault("2.0")
    double delayMultiplier();

    @WithDefault("PT60S")
    Duration maxDelay();

    /**
     * Attempts on the email or IP scope after which the identifier is marked suspicious.
     *
     * @return threshold (default: 5)
     */
    @WithDefault("5")
    int suspiciousRequestThreshold();

    /**
     * How long a suspicious marker denies requests.
     *
     * @return cooldown (default: 30 minutes)
     */
    @WithDefault("PT30M")
    Duration suspiciousActivityCooldown();

    /**
     * Email or IP attempts from which a CAPTCHA is required.
     *
     * @return threshold (default: 2)
     */
    @WithDefault("2")
    int captchaThreshold();

    /**
     * Attempts added for a reset request against an unknown email.
     *
     * @return penalty (default: 0.5)
     */
    @WithDefault("0.5")
    double failedResetPenalty();
}
