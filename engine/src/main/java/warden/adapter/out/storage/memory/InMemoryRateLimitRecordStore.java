package warden.adapter.out.storage.memory;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiPredicate;
import java.util.function.UnaryOperator;

import org.jboss.logging.Logger;

import warden.core.model.ratelimit.RateLimitRecord;
import warden.core.model.ratelimit.SuspiciousMarker;
import warden.spi.RateLimitRecordStore;

/**
 * In-memory implementation of RateLimitRecordStore.
 *
 * <p>
 * Per-key atomicity comes from {@link ConcurrentHashMap#compute}. Sweeps iterate the
 * weakly consistent views of the maps, so they never block or tear concurrent lookups.
 *
 * <p>
 * <strong>Warning:</strong> Counters are lost on restart and not shared across instances.
 */
public class InMemoryRateLimitRecordStore implements RateLimitRecordStore {

    private static final Logger LOG = Logger.getLogger(InMemoryRateLimitRecordStore.class);

    private final ConcurrentMap<String, RateLimitRecord> records = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, SuspiciousMarker> markers = new ConcurrentHashMap<>();

    public InMemoryRateLimitRecordStore() {
        LOG.info("Initialized in-memory rate limit store");
    }

    @Override
    public Optional<RateLimitRecord> find(String key) {
        return Optional.ofNullable(records.get(key));
    }

    @Override
    public RateLimitRecord compute(String key, UnaryOperator<RateLimitRecord> remapper) {
        return records.compute(key, (k, current) -> remapper.apply(current));
    }

    @Override
    public void delete(String key) {
        records.remove(key);
    }

    @Override
    public int removeIf(BiPredicate<String, RateLimitRecord> stale) {
        final var removed = new AtomicInteger();
        for (final var key : records.keySet()) {
            records.computeIfPresent(key, (k, record) -> {
                if (stale.test(k, record)) {
                    removed.incrementAndGet();
                    return null;
                }
                return record;
            });
        }
        if (removed.get() > 0) {
            LOG.debugf("Removed %d expired rate limit records", removed.get());
        }
        return removed.get();
    }

    @Override
    public Optional<SuspiciousMarker> findMarker(String key) {
        return Optional.ofNullable(markers.get(key));
    }

    @Override
    public void putMarker(SuspiciousMarker marker) {
        markers.put(marker.identifier(), marker);
    }

    @Override
    public int removeExpiredMarkers(Instant now) {
        final var removed = new AtomicInteger();
        for (final var key : markers.keySet()) {
            markers.computeIfPresent(key, (k, marker) -> {
                if (!marker.isActive(now)) {
                    removed.incrementAndGet();
                    return null;
                }
                return marker;
            });
        }
        return removed.get();
    }

    @Override
    public void clear(String keyPrefix) {
        records.keySet().removeIf(key -> key.startsWith(keyPrefix));
        markers.keySet().removeIf(key -> key.startsWith(keyPrefix));
    }

    /**
     * Number of stored records (for testing).
     */
    public int recordCount() {
        return records.size();
    }

    /**
     * Number of stored markers, expired or not (for testing).
     */
    public int markerCount() {
        return markers.size();
    }
}
