package warden.adapter.in.rest;

/**
 * Roles checked by the admin endpoints.
 */
public final class AdminRoles {

    /** Operators allowed to inspect and clear security state. */
    public static final String ADMIN = "warden-admin";

    private AdminRoles() {}
}
