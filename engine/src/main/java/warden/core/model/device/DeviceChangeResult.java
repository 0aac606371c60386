package warden.core.model.device;

/**
 * Result of a device change check.
 *
 * @param newDevice       true when the identifier already had other devices and this one is unknown
 * @param fingerprint     the fingerprint presented by the caller
 * @param previousDevices devices registered for the identifier before this check
 */
public record DeviceChangeResult(boolean newDevice, DeviceFingerprint fingerprint, int previousDevices) {}
