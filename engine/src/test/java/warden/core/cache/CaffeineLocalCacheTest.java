package warden.core.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.mock.MutableClock;

@DisplayName("CaffeineLocalCache")
class CaffeineLocalCacheTest {

    @Nested
    @DisplayName("Basic Operations")
    class BasicOperations {

        @Test
        @DisplayName("should put and get a value")
        void shouldPutAndGetValue() {
            var cache = new CaffeineLocalCache<String, String>(Duration.ofMinutes(5), 100);

            cache.put("key1", "value1");

            var result = cache.get("key1");
            assertTrue(result.isPresent());
            assertEquals("value1", result.get());
        }

        @Test
        @DisplayName("should return empty for missing key")
        void shouldReturnEmptyForMissingKey() {
            var cache = new CaffeineLocalCache<String, String>(Duration.ofMinutes(5), 100);

            assertFalse(cache.get("missing").isPresent());
        }

        @Test
        @DisplayName("should invalidate a specific key")
        void shouldInvalidateSpecificKey() {
            var cache = new CaffeineLocalCache<String, String>(Duration.ofMinutes(5), 100);
            cache.put("key1", "value1");
            cache.put("key2", "value2");

            cache.invalidate("key1");

            assertFalse(cache.get("key1").isPresent());
            assertTrue(cache.get("key2").isPresent());
        }

        @Test
        @DisplayName("should invalidate all keys")
        void shouldInvalidateAllKeys() {
            var cache = new CaffeineLocalCache<String, String>(Duration.ofMinutes(5), 100);
            cache.put("key1", "value1");
            cache.put("key2", "value2");

            cache.invalidateAll();

            assertEquals(0, cache.estimatedSize());
        }

        @Test
        @DisplayName("should return an immutable snapshot of all entries")
        void shouldReturnSnapshot() {
            var cache = new CaffeineLocalCache<String, String>(Duration.ofMinutes(5), 100);
            cache.put("key1", "value1");
            cache.put("key2", "value2");

            var snapshot = cache.snapshot();
            cache.put("key3", "value3");

            assertEquals(2, snapshot.size());
            assertEquals("value2", snapshot.get("key2"));
            assertThrows(UnsupportedOperationException.class, () -> snapshot.put("key4", "value4"));
        }
    }

    @Nested
    @DisplayName("TTL Expiration")
    class TtlExpiration {

        @Test
        @DisplayName("should expire entries once the clock passes the TTL")
        void shouldExpireEntriesAfterTtl() {
            var clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
            var cache = new CaffeineLocalCache<String, String>(Duration.ofMinutes(5), 100, clock);
            cache.put("key1", "value1");

            clock.advance(Duration.ofMinutes(4));
            assertTrue(cache.get("key1").isPresent());

            clock.advance(Duration.ofMinutes(2));
            assertFalse(cache.get("key1").isPresent());
        }

        @Test
        @DisplayName("should restart the TTL on re-put")
        void shouldRestartTtlOnReput() {
            var clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
            var cache = new CaffeineLocalCache<String, String>(Duration.ofMinutes(5), 100, clock);
            cache.put("key1", "original");

            clock.advance(Duration.ofMinutes(4));
            cache.put("key1", "updated");
            clock.advance(Duration.ofMinutes(4));

            assertEquals("updated", cache.get("key1").orElseThrow());
        }
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject a non-positive TTL")
        void shouldRejectNonPositiveTtl() {
            assertThrows(
                    IllegalArgumentException.class, () -> new CaffeineLocalCache<String, String>(Duration.ZERO, 10));
        }

        @Test
        @DisplayName("should reject a non-positive max size")
        void shouldRejectNonPositiveMaxSize() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> new CaffeineLocalCache<String, String>(Duration.ofMinutes(1), 0));
        }

        @Test
        @DisplayName("should bound size to the maximum")
        void shouldBoundSize() {
            var cache = new CaffeineLocalCache<String, String>(Duration.ofMinutes(5), 3);

            for (int i = 0; i < 10; i++) {
                cache.put("key" + i, "value" + i);
            }

            assertTrue(cache.estimatedSize() <= 3, "Cache size should be bounded: " + cache.estimatedSize());
        }
    }
}
