package io.github.cyfko.entityql.core.config;

import java.time.Duration;

/**
 * Sizing of the result cache.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxEntries</strong>: maximum cached result sets before LRU eviction (default: 1000)</li>
 *   <li><strong>timeToLive</strong>: age after which an entry is evicted, {@code null} for none (default: none)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * CacheConfig config = CacheConfig.defaults();   // 1000 entries, no expiry
 * CacheConfig config = CacheConfig.relaxed();    // 5000 entries, no expiry
 * CacheConfig config = CacheConfig.shortLived(); // 500 entries, 60 seconds
 * CacheConfig config = new CacheConfig(2000, Duration.ofMinutes(10));
 * }</pre>
 *
 * @param maxEntries maximum number of entries, strictly positive
 * @param timeToLive maximum age of an entry, {@code null} when entries never expire
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CacheConfig(int maxEntries, Duration timeToLive) {

    public CacheConfig {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive, got: " + maxEntries);
        }
        if (timeToLive != null && (timeToLive.isNegative() || timeToLive.isZero())) {
            throw new IllegalArgumentException("timeToLive must be positive, got: " + timeToLive);
        }
    }

    public static CacheConfig defaults() {
        return new CacheConfig(1000, null);
    }

    public static CacheConfig relaxed() {
        return new CacheConfig(5000, null);
    }

    public static CacheConfig shortLived() {
        return new CacheConfig(500, Duration.ofSeconds(60));
    }

    public boolean expires() {
        return timeToLive != null;
    }
}
