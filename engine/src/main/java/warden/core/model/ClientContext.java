package warden.core.model;

import warden.core.model.device.DeviceAttributes;

/**
 * Request-scoped client information supplied by the inbound adapter.
 *
 * @param ipAddress client IP address (may be null)
 * @param userAgent client user agent (may be null)
 * @param sessionId session identifier presented by the client (may be null)
 * @param device    device attributes reported by the client
 */
public record ClientContext(String ipAddress, String userAgent, String sessionId, DeviceAttributes device) {

    public ClientContext {
        if (device == null) {
            device = DeviceAttributes.server();
        }
    }

    /**
     * Context for server-initiated operations with no client attached.
     */
    public static ClientContext server() {
        return new ClientContext(null, "server", null, DeviceAttributes.server());
    }
}
