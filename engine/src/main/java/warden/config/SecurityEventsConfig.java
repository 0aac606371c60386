package warden.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for security event dispatch.
 *
 * <p>Example configuration:
 * <pre>
 * warden.security-events.enabled=true
 * </pre>
 */
@ConfigMapping(prefix = "warden.security-events")
public interface SecurityEventsConfig {

    /**
     * Dispatch security events to the registered handlers.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();
}
