package warden.core.model.device;

import java.time.Instant;

/**
 * A recognized device: its attributes, the derived hash, and when it was first seen.
 *
 * @param attributes the attributes the hash was computed from
 * @param hash       lowercase hex hash, deterministic for identical attributes
 * @param firstSeen  when the device was first registered (null for unregistered fingerprints)
 */
public record DeviceFingerprint(DeviceAttributes attributes, String hash, Instant firstSeen) {

    public DeviceFingerprint registeredAt(Instant when) {
        return new DeviceFingerprint(attributes, hash, when);
    }

    public String userAgent() {
        return attributes.userAgent();
    }
}
