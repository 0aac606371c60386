package warden.core.model.analysis;

import warden.core.model.RiskLevel;

/**
 * A derived finding over session history.
 *
 * @param type             machine-readable finding name (e.g. {@code session_hijacking})
 * @param severity         severity of the finding
 * @param description      what was observed
 * @param recommendation   suggested mitigation
 * @param affectedSessions number of sessions the finding applies to
 */
public record Vulnerability(
        String type, RiskLevel severity, String description, String recommendation, int affectedSessions) {}
