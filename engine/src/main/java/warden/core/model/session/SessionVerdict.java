package warden.core.model.session;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import warden.core.model.RiskLevel;

/**
 * Outcome of one session validation.
 *
 * <p>{@code valid} is false for terminal violations and for an expired session. Other
 * violations leave the session usable but attach remediation actions.
 *
 * @param valid         whether the session may continue to be used
 * @param violations    findings, in detection order
 * @param riskLevel     ordinal max over all escalations
 * @param actions       remediation actions for the caller
 * @param securityScore 0-100 posture summary
 * @param userId        user the verdict applies to (null when unknown)
 * @param validatedAt   when the verdict was computed
 */
public record SessionVerdict(
        boolean valid,
        Set<ViolationKind> violations,
        RiskLevel riskLevel,
        Set<ActionKind> actions,
        int securityScore,
        String userId,
        Instant validatedAt) {

    public SessionVerdict {
        violations = Collections.unmodifiableSet(
                violations.isEmpty() ? EnumSet.noneOf(ViolationKind.class) : EnumSet.copyOf(violations));
        actions = Collections.unmodifiableSet(
                actions.isEmpty() ? EnumSet.noneOf(ActionKind.class) : EnumSet.copyOf(actions));
    }

    /**
     * {@code max(0, 100 - 10 * violations - riskPenalty)}.
     */
    public static int securityScore(int violationCount, RiskLevel riskLevel) {
        return Math.max(0, 100 - 10 * violationCount - riskPenalty(riskLevel));
    }

    static int riskPenalty(RiskLevel riskLevel) {
        return switch (riskLevel) {
            case CRITICAL -> 50;
            case HIGH -> 30;
            case MEDIUM -> 15;
            case LOW -> 5;
        };
    }

    public static SessionVerdict terminal(ViolationKind violation, RiskLevel riskLevel, String userId, Instant now) {
        return new SessionVerdict(
                false,
                EnumSet.of(violation),
                riskLevel,
                EnumSet.of(ActionKind.REQUIRE_LOGIN),
                securityScore(1, riskLevel),
                userId,
                now);
    }

    public boolean hasViolations() {
        return !violations.isEmpty();
    }
}
