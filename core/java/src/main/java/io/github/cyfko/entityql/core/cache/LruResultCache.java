package io.github.cyfko.entityql.core.cache;

import io.github.cyfko.entityql.core.config.CacheConfig;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded LRU (Least Recently Used) {@link ResultCache} with optional time-to-live.
 *
 * <h2>Implementation Strategy</h2>
 * <ul>
 *   <li><strong>Access-ordered {@link LinkedHashMap}</strong>: O(1) lookup, eldest entry is the
 *       least recently used one</li>
 *   <li><strong>Single {@link Lock}</strong>: guards the map structure only. A lookup reorders the
 *       map, so reads take the same lock as writes. Entries are immutable and handed out as-is.</li>
 *   <li><strong>Lazy expiry</strong>: an entry older than the configured time-to-live is dropped
 *       when it is looked up, and counted as a miss</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ResultCache cache = new LruResultCache(CacheConfig.defaults());
 * cache.put(new CacheEntry(plan.fingerprint(), plan.entityName(), records, Instant.now()));
 * Optional<CacheEntry> hit = cache.get(plan.fingerprint());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class LruResultCache implements ResultCache {

    private final int maxSize;
    private final Duration timeToLive;
    private final Clock clock;
    private final Map<String, CacheEntry> entries;
    private final Lock lock = new ReentrantLock();

    private long hits;
    private long misses;
    private long evictions;

    /**
     * Creates a cache sized by {@code config}.
     *
     * @param config the sizing
     */
    public LruResultCache(CacheConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * Creates a cache sized by {@code config}, measuring entry age with {@code clock}.
     *
     * @param config the sizing
     * @param clock  the clock used for time-to-live checks
     */
    public LruResultCache(CacheConfig config, Clock clock) {
        Objects.requireNonNull(config, "config");
        this.maxSize = config.maxEntries();
        this.timeToLive = config.timeToLive();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
    }

    /**
     * @return the clock this cache measures entry age with
     */
    public Clock clock() {
        return clock;
    }

    @Override
    public Optional<CacheEntry> get(String fingerprint) {
        Objects.requireNonNull(fingerprint, "fingerprint");
        lock.lock();
        try {
            CacheEntry entry = entries.get(fingerprint);
            if (entry != null && isExpired(entry, clock.instant())) {
                entries.remove(fingerprint);
                evictions++;
                entry = null;
            }
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            hits++;
            return Optional.of(entry);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void put(CacheEntry entry) {
        Objects.requireNonNull(entry, "entry");
        lock.lock();
        try {
            entries.put(entry.fingerprint(), entry);
            Iterator<String> eldest = entries.keySet().iterator();
            while (entries.size() > maxSize && eldest.hasNext()) {
                eldest.next();
                eldest.remove();
                evictions++;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void invalidate(String fingerprint) {
        lock.lock();
        try {
            entries.remove(fingerprint);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void invalidateEntity(String entityName) {
        lock.lock();
        try {
            entries.values().removeIf(entry -> entry.entityName().equals(entityName));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(entries.size(), maxSize, hits, misses, evictions);
        } finally {
            lock.unlock();
        }
    }

    private boolean isExpired(CacheEntry entry, Instant now) {
        return timeToLive != null && entry.storedAt().plus(timeToLive).isBefore(now);
    }

    @Override
    public String toString() {
        return stats().toString();
    }
}
