package warden.core.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

/**
 * Caffeine-backed local cache whose expiry follows an injected {@link Clock}.
 *
 * <p>
 * Entries expire a fixed TTL after they were last written. Reading the time from the
 * application clock keeps cached verdicts and analyses consistent with the timestamps
 * they carry, and lets tests advance time without sleeping.
 *
 * <p>
 * Maintenance runs on the calling thread, so an expired entry is gone as soon as the
 * clock passes its deadline.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class CaffeineLocalCache<K, V> implements LocalCache<K, V> {

    private final Cache<K, V> cache;

    /**
     * Create a cache on the system clock.
     *
     * @param ttl     time-to-live after the last write
     * @param maxSize the maximum number of entries in the cache
     */
    public CaffeineLocalCache(Duration ttl, long maxSize) {
        this(ttl, maxSize, Clock.systemUTC());
    }

    /**
     * Create a cache on the given clock.
     *
     * @param ttl     time-to-live after the last write
     * @param maxSize the maximum number of entries in the cache
     * @param clock   source of time for expiry
     */
    public CaffeineLocalCache(Duration ttl, long maxSize, Clock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive, got: " + ttl);
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Cache max size must be positive, got: " + maxSize);
        }
        final Ticker ticker = () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxSize)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    @Override
    public Optional<V> get(K key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(K key, V value) {
        cache.put(key, value);
    }

    @Override
    public void invalidate(K key) {
        cache.invalidate(key);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    @Override
    public Map<K, V> snapshot() {
        return Map.copyOf(cache.asMap());
    }

    @Override
    public long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
