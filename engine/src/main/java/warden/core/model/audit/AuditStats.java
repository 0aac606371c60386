package warden.core.model.audit;

import java.util.Map;

import warden.core.model.RiskLevel;

/**
 * Counts over the audit entries of one timeframe.
 */
public record AuditStats(
        AuditTimeframe timeframe,
        int totalEvents,
        Map<AuditEventType, Integer> eventsByType,
        Map<RiskLevel, Integer> eventsByRisk,
        int failedEvents,
        int pendingReview,
        int highRiskEvents) {}
