package warden.core.model.device;

/**
 * Client attributes a device fingerprint is derived from.
 */
public record DeviceAttributes(
        String userAgent,
        String screenResolution,
        String timezone,
        String language,
        int colorDepth,
        boolean touchSupport) {

    /**
     * Attributes used when fingerprinting runs without a browser (server-side calls).
     */
    public static DeviceAttributes server() {
        return new DeviceAttributes("server", "0x0", "UTC", "en", 24, false);
    }
}
