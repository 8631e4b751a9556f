package io.github.cyfko.entityql.core.cache;

/**
 * Point-in-time counters of a {@link ResultCache}.
 *
 * @param size      current number of entries
 * @param maxSize   capacity
 * @param hits      lookups answered from the cache
 * @param misses    lookups that found nothing (including expired entries)
 * @param evictions entries dropped for capacity or age
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CacheStats(int size, int maxSize, long hits, long misses, long evictions) {

    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }

    @Override
    public String toString() {
        return String.format("ResultCache[size=%d, maxSize=%d, hits=%d, misses=%d, evictions=%d, hitRate=%.1f%%]",
                size, maxSize, hits, misses, evictions, hitRate() * 100.0);
    }
}
