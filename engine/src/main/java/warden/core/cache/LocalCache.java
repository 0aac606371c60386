package warden.core.cache;

import java.util.Map;
import java.util.Optional;

/**
 * Local in-memory cache with TTL support.
 *
 * <p>
 * Holds derived state (latest session security info, complexity analyses) that is cheap
 * to recompute and only needs to survive for a bounded time.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public interface LocalCache<K, V> {

    /**
     * Gets a value from the cache.
     *
     * @param key the cache key
     * @return Optional containing the value if present and not expired
     */
    Optional<V> get(K key);

    /**
     * Puts a value into the cache, restarting its TTL.
     *
     * @param key   the cache key
     * @param value the value to cache
     */
    void put(K key, V value);

    /**
     * Invalidates (removes) a specific cache entry.
     *
     * @param key the cache key to invalidate
     */
    void invalidate(K key);

    /**
     * Invalidates all entries in the cache.
     */
    void invalidateAll();

    /**
     * Returns a snapshot of the unexpired entries.
     *
     * @return immutable copy of the cache contents
     */
    Map<K, V> snapshot();

    /**
     * Returns the estimated number of entries in the cache.
     *
     * @return estimated entry count
     */
    long estimatedSize();
}
