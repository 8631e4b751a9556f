package io.github.cyfko.entityql.core.config;

/**
 * Per-query rule governing when cached results may be served instead of, or alongside, a live
 * store fetch.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>{@link #NO_CACHE}: the cache is neither read nor written</li>
 *   <li>{@link #CACHE_ELSE_NETWORK}: serve a cached result whatever its age, else fetch and populate</li>
 *   <li>{@link #NETWORK_ELSE_CACHE}: fetch and populate; on store failure fall back to the cache</li>
 *   <li>{@link #CACHE_THEN_NETWORK}: in the background, deliver a cached hit first, then the live
 *       result. A blocking call cannot deliver twice and behaves as {@link #NETWORK_ELSE_CACHE}.</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum CachePolicy {
    NO_CACHE,
    CACHE_ELSE_NETWORK,
    NETWORK_ELSE_CACHE,
    CACHE_THEN_NETWORK;

    /**
     * @return {@code true} unless the policy bypasses the cache entirely
     */
    public boolean usesCache() {
        return this != NO_CACHE;
    }
}
