package warden.spi;

import java.time.Instant;
import java.util.Optional;
import java.util.function.BiPredicate;
import java.util.function.UnaryOperator;

import warden.core.model.ratelimit.RateLimitRecord;
import warden.core.model.ratelimit.SuspiciousMarker;

/**
 * SPI for rate limit state.
 *
 * <p>Calls are synchronous: every decision depends on an atomic read-modify-write per key,
 * which implementations provide through {@link #compute}. Implementations throw
 * {@link StorageProviderException} when the store cannot be reached.
 *
 * <p>The default implementation keeps state in memory. Platform teams with several
 * instances can provide a shared store by producing their own bean.
 */
public interface RateLimitRecordStore {

    /**
     * Read the record for a key.
     *
     * @param key scoped identifier
     * @return the record, if one exists
     */
    Optional<RateLimitRecord> find(String key);

    /**
     * Atomically replace the record for a key.
     *
     * <p>The function receives the current record (null when absent) and returns the new one,
     * or null to delete. No other update to the same key interleaves with the call.
     *
     * @param key      scoped identifier
     * @param remapper update function
     * @return the stored record, or null when the key was deleted
     */
    RateLimitRecord compute(String key, UnaryOperator<RateLimitRecord> remapper);

    /**
     * Delete the record for a key. Deleting a missing key is not an error.
     *
     * @param key scoped identifier
     */
    void delete(String key);

    /**
     * Delete every record matching the predicate.
     *
     * @param stale predicate over (key, record)
     * @return number of removed records
     */
    int removeIf(BiPredicate<String, RateLimitRecord> stale);

    /**
     * Read the suspicious marker for a key, expired or not.
     */
    Optional<SuspiciousMarker> findMarker(String key);

    /**
     * Store or replace a suspicious marker.
     */
    void putMarker(SuspiciousMarker marker);

    /**
     * Delete markers that expired before {@code now}.
     *
     * @return number of removed markers
     */
    int removeExpiredMarkers(Instant now);

    /**
     * Delete every record and marker whose key starts with the prefix.
     */
    void clear(String keyPrefix);
}
