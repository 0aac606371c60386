package warden.adapter.out.telemetry;

import java.util.Locale;

import org.jboss.logging.Logger;

import warden.spi.SecurityEvent;
import warden.spi.SecurityEventHandler;

/**
 * Security event handler that logs events using JBoss Logging.
 *
 * <p>This is a built-in handler with priority 0 that always runs.
 * Log levels are based on event severity:
 * <ul>
 *   <li>INFO severity → DEBUG level</li>
 *   <li>WARNING severity → WARN level</li>
 *   <li>CRITICAL severity → ERROR level</li>
 * </ul>
 */
public class LoggingSecurityEventHandler implements SecurityEventHandler {

    private static final Logger LOG = Logger.getLogger("warden.security");

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public void handle(SecurityEvent event) {
        var message = formatEvent(event);

        switch (event.severity()) {
            case INFO -> LOG.debug(message);
            case WARNING -> LOG.warn(message);
            case CRITICAL -> LOG.error(message);
        }
    }

    static String formatEvent(SecurityEvent event) {
        if (event instanceof SecurityEvent.AccountLocked e) {
            return String.format(
                    Locale.ROOT,
                    "ACCOUNT_LOCKED: subject=%s attempts=%.1f until=%s",
                    e.subject(),
                    e.attempts(),
                    e.lockedUntil());
        }
        if (event instanceof SecurityEvent.RateLimitExceeded e) {
            return String.format(
                    Locale.ROOT,
                    "RATE_LIMIT: subject=%s scope=%s attempts=%.1f threshold=%d",
                    e.subject(), e.scope(), e.attempts(), e.threshold());
        }
        if (event instanceof SecurityEvent.SuspiciousActivity e) {
            return String.format(
                    Locale.ROOT,
                    "SUSPICIOUS: subject=%s scope=%s attempts=%.1f until=%s",
                    e.subject(), e.scope(), e.attempts(), e.expiresAt());
        }
        if (event instanceof SecurityEvent.NewDeviceDetected e) {
            return String.format(
                    Locale.ROOT,
                    "NEW_DEVICE: subject=%s fingerprint=%s previous=%d",
                    e.subject(), e.fingerprint(), e.previousDevices());
        }
        if (event instanceof SecurityEvent.HighRiskAuditEvent e) {
            return String.format(
                    Locale.ROOT,
                    "HIGH_RISK_AUDIT: subject=%s audit=%s type=%s risk=%s",
                    e.subject(), e.auditId(), e.eventType(), e.riskLevel());
        }
        if (event instanceof SecurityEvent.AuditSinkDegraded e) {
            return String.format(Locale.ROOT, "AUDIT_SINK_DEGRADED: component=%s reason=%s", e.subject(), e.reason());
        }
        return event.getClass().getSimpleName() + ": subject=" + event.subject();
    }
}
