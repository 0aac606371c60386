package warden.core.service.device;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import warden.core.model.ClientContext;
import warden.core.model.device.DeviceAttributes;
import warden.core.model.device.DeviceChangeResult;
import warden.core.model.device.DeviceFingerprint;
import warden.core.model.device.DeviceStats;
import warden.core.port.out.DeviceFingerprintRepository;
import warden.core.port.out.SecurityAlerting;
import warden.spi.SecurityEvent;

/**
 * Recognizes returning devices and flags unknown ones.
 *
 * <p>
 * A device is new only if the identifier already has at least one other registered
 * device and this hash is not among them. The first device ever seen for an identifier is
 * registered silently.
 */
@ApplicationScoped
public class DeviceFingerprintRegistry {

    private static final Logger LOG = Logger.getLogger(DeviceFingerprintRegistry.class);

    private final DeviceFingerprintRepository repository;
    private final SecurityAlerting alerting;
    private final Clock clock;

    public DeviceFingerprintRegistry(DeviceFingerprintRepository repository, SecurityAlerting alerting, Clock clock) {
        this.repository = repository;
        this.alerting = alerting;
        this.clock = clock;
    }

    /**
     * Compute the fingerprint of a set of attributes. Does not register anything.
     *
     * @param attributes client attributes
     * @return unregistered fingerprint
     */
    public DeviceFingerprint generate(DeviceAttributes attributes) {
        final var effective = attributes != null ? attributes : DeviceAttributes.server();
        return new DeviceFingerprint(effective, DeviceFingerprintHasher.hash(effective), null);
    }

    /**
     * Register the presented device for the identifier and report whether it is new.
     *
     * <p>
     * New devices raise a security event without blocking the caller. Callers that audit
     * the surrounding action record the change themselves.
     *
     * @param identifier email or user id
     * @param context    client the device belongs to
     * @return whether the device is new, with the fingerprint
     */
    public DeviceChangeResult checkDeviceChange(String identifier, ClientContext context) {
        final var now = clock.instant();
        final var fingerprint = generate(context.device()).registeredAt(now);
        final var previous = repository.register(identifier, fingerprint);
        final var known = previous.stream().anyMatch(d -> d.hash().equals(fingerprint.hash()));
        final var newDevice = !known && !previous.isEmpty();

        if (newDevice) {
            onNewDevice(identifier, fingerprint, previous.size(), now);
        } else if (previous.isEmpty()) {
            LOG.debugf("Registered first device %s for %s", fingerprint.hash(), identifier);
        }
        return new DeviceChangeResult(newDevice, fingerprint, previous.size());
    }

    /**
     * Check a device change for attributes without further client context.
     */
    public DeviceChangeResult checkDeviceChange(String identifier, DeviceAttributes attributes) {
        return checkDeviceChange(identifier, new ClientContext(null, attributes.userAgent(), null, attributes));
    }

    private void onNewDevice(String identifier, DeviceFingerprint fingerprint, int previousDevices, Instant now) {
        LOG.infof("New device %s for %s (%d known)", fingerprint.hash(), identifier, previousDevices);
        alerting.publish(new SecurityEvent.NewDeviceDetected(now, identifier, fingerprint.hash(), previousDevices));
    }

    public List<DeviceFingerprint> getDevices(String identifier) {
        return repository.findAll(identifier);
    }

    public boolean removeDevice(String identifier, String hash) {
        final var removed = repository.remove(identifier, hash);
        if (removed) {
            LOG.infof("Removed device %s for %s", hash, identifier);
        }
        return removed;
    }

    public int clearDevices(String identifier) {
        return repository.clear(identifier);
    }

    /**
     * Aggregate counts over all registered devices.
     */
    public DeviceStats getStats() {
        final var all = repository.snapshot();
        final var userAgents = new HashMap<String, Integer>();
        Instant newest = null;
        var total = 0;
        for (final var devices : all.values()) {
            for (final var device : devices) {
                total++;
                userAgents.merge(device.userAgent(), 1, Integer::sum);
                if (device.firstSeen() != null && (newest == null || device.firstSeen().isAfter(newest))) {
                    newest = device.firstSeen();
                }
            }
        }
        return new DeviceStats(total, all.size(), userAgents, newest);
    }
}
