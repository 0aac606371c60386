package warden.core.port.out;

import java.util.List;
import java.util.Map;

import warden.core.model.device.DeviceFingerprint;

/**
 * Outbound port for registered devices, keyed by (identifier, hash).
 */
public interface DeviceFingerprintRepository {

    /**
     * Register a device for an identifier unless the same hash is already registered.
     *
     * <p>The lookup and the registration are atomic per identifier.
     *
     * @param identifier  email or user id
     * @param fingerprint the device presented
     * @return devices registered for the identifier before this call
     */
    List<DeviceFingerprint> register(String identifier, DeviceFingerprint fingerprint);

    /**
     * @param identifier email or user id
     * @return registered devices, oldest first
     */
    List<DeviceFingerprint> findAll(String identifier);

    /**
     * @return true if the device was registered
     */
    boolean remove(String identifier, String hash);

    /**
     * @return number of devices removed
     */
    int clear(String identifier);

    /**
     * @return every identifier with its registered devices
     */
    Map<String, List<DeviceFingerprint>> snapshot();
}
