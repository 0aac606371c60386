package warden.core.model.audit;

/**
 * Security-relevant event types recorded in the audit trail.
 */
public enum AuditEventType {
    LOGIN_ATTEMPT(Weight.LOW),
    LOGIN_SUCCESS(Weight.LOW),
    LOGIN_FAILURE(Weight.MEDIUM),
    ACCOUNT_LOCKED(Weight.HIGH),
    ACCOUNT_UNLOCKED(Weight.HIGH),
    SUSPICIOUS_ACTIVITY(Weight.LOW),
    RATE_LIMIT_EXCEEDED(Weight.LOW),
    DEVICE_CHANGE(Weight.LOW),
    PASSWORD_RESET(Weight.LOW),
    PASSWORD_CHANGE(Weight.LOW),
    MFA_ENABLED(Weight.LOW),
    MFA_DISABLED(Weight.LOW),
    PERMISSION_CHECK(Weight.MEDIUM),
    ROLE_ASSIGNED(Weight.HIGH),
    ROLE_REMOVED(Weight.HIGH),
    ACCESS_GRANTED(Weight.LOW),
    ACCESS_DENIED(Weight.MEDIUM),
    LOGOUT(Weight.LOW),
    SESSION_EXPIRED(Weight.LOW),
    SESSION_ANALYSIS(Weight.LOW);

    private final Weight weight;

    AuditEventType(Weight weight) {
        this.weight = weight;
    }

    /**
     * Base contribution of the event class to the risk score.
     */
    public int riskWeight() {
        return weight.score;
    }

    public boolean isRoleChange() {
        return this == ROLE_ASSIGNED || this == ROLE_REMOVED;
    }

    private enum Weight {
        LOW(1),
        MEDIUM(2),
        HIGH(3);

        private final int score;

        Weight(int score) {
            this.score = score;
        }
    }
}
