package warden.core.model.session;

import java.util.List;
import java.util.Map;

import warden.core.model.RiskLevel;

/**
 * Aggregate view over all cached session verdicts.
 *
 * @param totalSessions        users with a cached verdict
 * @param riskDistribution     verdicts per risk level
 * @param commonViolations     occurrences per violation kind
 * @param averageSecurityScore mean score, 100 when nothing is cached
 * @param recommendations      operator-facing remediation hints
 */
public record SessionSecuritySummary(
        int totalSessions,
        Map<RiskLevel, Integer> riskDistribution,
        Map<ViolationKind, Integer> commonViolations,
        double averageSecurityScore,
        List<String> recommendations) {}
