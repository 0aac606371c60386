package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the audit trail.
 *
 * <p>Configuration prefix: {@code warden.audit}
 *
 * @see warden.core.service.audit.AuditLogger
 */
@ConfigMapping(prefix = "warden.audit")
public interface AuditConfig {

    /**
     * How long entries stay active before retention archives them.
     *
     * @return retention (default: 365 days)
     */
    @WithDefault("P365D")
    Duration retention();

    /**
     * Maximum time a single repository write may take before the entry falls back.
     *
     * @return write timeout (default: 5 seconds)
     */
    @WithDefault("PT5S")
    Duration writeTimeout();

    /**
     * Interval of the retention archival job.
     *
     * @return archive interval (default: 6 hours)
     */
    @WithDefault("PT6H")
    Duration archiveInterval();

    /**
     * Raise an alert for entries classified HIGH or CRITICAL.
     *
     * @return true if alerts are raised (default: true)
     */
    @WithDefault("true")
    boolean alertOnHighRisk();
}
