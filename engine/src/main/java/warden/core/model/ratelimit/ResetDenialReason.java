package warden.core.model.ratelimit;

/**
 * Why a password reset request was denied. Wire values match the reason codes
 * clients already branch on.
 */
public enum ResetDenialReason {
    EMAIL_RATE_LIMIT("email_rate_limit"),
    IP_RATE_LIMIT("ip_rate_limit"),
    GLOBAL_RATE_LIMIT("global_rate_limit"),
    SUSPICIOUS_ACTIVITY("suspicious_activity"),
    STORE_UNAVAILABLE("store_unavailable");

    private final String code;

    ResetDenialReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
