package io.github.cyfko.entityql.core.cache;

import java.util.Optional;

/**
 * Maps plan fingerprints to previously fetched result sets.
 * <p>
 * Whether a query reads or writes the cache is decided per plan by its
 * {@link io.github.cyfko.entityql.core.config.CachePolicy}; the cache itself holds no policy.
 * </p>
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>An entry is never returned for a fingerprint other than the one it was stored under</li>
 *   <li>{@link #put(CacheEntry)} for an existing fingerprint replaces the previous entry
 *       atomically: a concurrent {@link #get(String)} sees either the old or the new entry</li>
 *   <li>Implementations are safe for concurrent use by the executor's workers</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface ResultCache {

    /**
     * @param fingerprint the plan fingerprint
     * @return the entry stored under that fingerprint, if any
     */
    Optional<CacheEntry> get(String fingerprint);

    /**
     * Stores or replaces the entry for {@code entry.fingerprint()}.
     *
     * @param entry the entry
     */
    void put(CacheEntry entry);

    /**
     * @param fingerprint the plan fingerprint to drop
     */
    void invalidate(String fingerprint);

    /**
     * Drops every entry produced by a query on {@code entityName}, typically after the
     * collection has been written to.
     *
     * @param entityName the collection name
     */
    void invalidateEntity(String entityName);

    void clear();

    int size();

    CacheStats stats();
}
