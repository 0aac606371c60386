package warden.spi;

import java.time.Instant;

/**
 * Sealed interface representing security events raised by the engine.
 *
 * <p>Events are dispatched to registered {@link warden.spi.SecurityEventHandler}
 * implementations for alerting, logging, and metrics recording.
 *
 * <p>Event types:
 * <ul>
 *   <li>{@link AccountLocked} - Login identifier locked after too many failures</li>
 *   <li>{@link RateLimitExceeded} - A rate limit scope denied a request</li>
 *   <li>{@link SuspiciousActivity} - An identifier was marked suspicious</li>
 *   <li>{@link NewDeviceDetected} - An identifier was seen on an unknown device</li>
 *   <li>{@link HighRiskAuditEvent} - An audit entry was classified HIGH or CRITICAL</li>
 *   <li>{@link AuditSinkDegraded} - Audit persistence failed and the fallback log is in use</li>
 * </ul>
 */
public sealed interface SecurityEvent {

    /**
     * Return the timestamp when this event occurred.
     *
     * @return event timestamp
     */
    Instant timestamp();

    /**
     * Return the subject of the event (email, IP, user id or component name).
     *
     * @return subject identifier
     */
    String subject();

    /**
     * Return the severity level of this event.
     *
     * @return severity level
     */
    Severity severity();

    /**
     * Severity levels for security events.
     */
    enum Severity {
        /** Informational events (e.g., a second device for a user). */
        INFO,
        /** Warning events requiring attention (e.g., a lockout). */
        WARNING,
        /** Critical events requiring immediate action. */
        CRITICAL
    }

    /**
     * Login identifier locked out.
     *
     * @param timestamp   when the lock was applied
     * @param subject     locked identifier
     * @param attempts    failed attempts counted
     * @param lockedUntil end of the lockout
     */
    record AccountLocked(Instant timestamp, String subject, double attempts, Instant lockedUntil)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.WARNING;
        }
    }

    /**
     * Rate limit scope denied a request.
     *
     * @param timestamp when the denial happened
     * @param subject   denied identifier
     * @param scope     scope name (e.g., "reset-email", "reset-ip", "reset-global", "login")
     * @param attempts  attempts counted in the window
     * @param threshold limit of the scope
     */
    record RateLimitExceeded(Instant timestamp, String subject, String scope, double attempts, int threshold)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            if (scope != null && scope.endsWith("global")) {
                return Severity.CRITICAL;
            }
            return attempts > threshold * 2.0 ? Severity.WARNING : Severity.INFO;
        }
    }

    /**
     * Identifier marked suspicious.
     *
     * @param timestamp when the marker was set
     * @param subject   marked identifier
     * @param scope     scope the threshold was crossed in
     * @param attempts  attempts that triggered the marker
     * @param expiresAt when the marker lapses
     */
    record SuspiciousActivity(Instant timestamp, String subject, String scope, double attempts, Instant expiresAt)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.WARNING;
        }
    }

    /**
     * Identifier seen on a device it never used before.
     *
     * @param timestamp       when the device was first seen
     * @param subject         email or user id
     * @param fingerprint     hash of the new device
     * @param previousDevices devices known before this one
     */
    record NewDeviceDetected(Instant timestamp, String subject, String fingerprint, int previousDevices)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return previousDevices >= 2 ? Severity.WARNING : Severity.INFO;
        }
    }

    /**
     * Audit entry classified HIGH or CRITICAL.
     *
     * @param timestamp when the entry was logged
     * @param subject   actor of the audited event
     * @param auditId   id of the audit entry
     * @param eventType audit event type name
     * @param riskLevel audit risk level name
     */
    record HighRiskAuditEvent(Instant timestamp, String subject, String auditId, String eventType, String riskLevel)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return "CRITICAL".equals(riskLevel) ? Severity.CRITICAL : Severity.WARNING;
        }
    }

    /**
     * Audit persistence failed; entries are going to the fallback log.
     *
     * @param timestamp when the failure was observed
     * @param subject   component name
     * @param reason    failure message
     */
    record AuditSinkDegraded(Instant timestamp, String subject, String reason) implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.CRITICAL;
        }
    }
}
