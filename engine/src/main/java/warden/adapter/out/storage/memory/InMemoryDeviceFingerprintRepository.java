package warden.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import warden.core.model.device.DeviceFingerprint;
import warden.core.port.out.DeviceFingerprintRepository;

/**
 * In-memory implementation of DeviceFingerprintRepository.
 *
 * <p>
 * Devices of one identifier live in an immutable list replaced through
 * {@link ConcurrentHashMap#compute}, which makes lookup-and-register atomic per identifier.
 */
public class InMemoryDeviceFingerprintRepository implements DeviceFingerprintRepository {

    private final ConcurrentMap<String, List<DeviceFingerprint>> devices = new ConcurrentHashMap<>();

    @Override
    public List<DeviceFingerprint> register(String identifier, DeviceFingerprint fingerprint) {
        final var previous = new AtomicReference<List<DeviceFingerprint>>(List.of());
        devices.compute(identifier, (id, current) -> {
            final var known = current != null ? current : List.<DeviceFingerprint>of();
            previous.set(known);
            if (known.stream().anyMatch(d -> d.hash().equals(fingerprint.hash()))) {
                return known;
            }
            final var updated = new ArrayList<>(known);
            updated.add(fingerprint);
            return List.copyOf(updated);
        });
        return previous.get();
    }

    @Override
    public List<DeviceFingerprint> findAll(String identifier) {
        return devices.getOrDefault(identifier, List.of());
    }

    @Override
    public boolean remove(String identifier, String hash) {
        final var removed = new AtomicBoolean(false);
        devices.computeIfPresent(identifier, (id, current) -> {
            final var remaining =
                    current.stream().filter(d -> !d.hash().equals(hash)).toList();
            removed.set(remaining.size() < current.size());
            return remaining.isEmpty() ? null : remaining;
        });
        return removed.get();
    }

    @Override
    public int clear(String identifier) {
        final var removed = new AtomicInteger();
        devices.computeIfPresent(identifier, (id, current) -> {
            removed.set(current.size());
            return null;
        });
        return removed.get();
    }

    @Override
    public Map<String, List<DeviceFingerprint>> snapshot() {
        return Map.copyOf(devices);
    }
}
