package warden.core.model.session;

/**
 * Remediation the caller is expected to carry out.
 */
public enum ActionKind {
    REQUIRE_LOGIN,
    REFRESH_TOKEN,
    TERMINATE_OLDEST_SESSIONS,
    REQUIRE_DEVICE_VERIFICATION,
    REQUIRE_REAUTH
}
