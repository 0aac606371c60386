package warden.core.model.device;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate view over every registered device.
 *
 * @param totalDevices     number of (identifier, hash) registrations
 * @param identifiers      number of identifiers with at least one device
 * @param userAgents       registrations per user agent
 * @param newestFirstSeen  most recent registration (null when empty)
 */
public record DeviceStats(
        int totalDevices, int identifiers, Map<String, Integer> userAgents, Instant newestFirstSeen) {}
