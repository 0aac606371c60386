package warden.core.model.session;

/**
 * Named findings of a session validation.
 */
public enum ViolationKind {
    NO_ACTIVE_SESSION(true),
    INVALID_USER(true),
    SESSION_EXPIRED(false),
    CONCURRENT_SESSION_LIMIT(false),
    DEVICE_FINGERPRINT_CHANGE(false),
    REAUTH_REQUIRED(false),
    VALIDATION_ERROR(true);

    private final boolean terminal;

    ViolationKind(boolean terminal) {
        this.terminal = terminal;
    }

    /**
     * Terminal violations end validation immediately and require a fresh login.
     */
    public boolean isTerminal() {
        return terminal;
    }
}
