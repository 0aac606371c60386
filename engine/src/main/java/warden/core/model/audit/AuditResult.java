package warden.core.model.audit;

/**
 * Outcome recorded with an audit event.
 */
public enum AuditResult {
    SUCCESS(0),
    FAILURE(2),
    DENIED(1),
    ERROR(2),
    WARNING(0);

    private final int riskPenalty;

    AuditResult(int riskPenalty) {
        this.riskPenalty = riskPenalty;
    }

    public int riskPenalty() {
        return riskPenalty;
    }

    public boolean isFailure() {
        return this == FAILURE || this == ERROR;
    }
}
