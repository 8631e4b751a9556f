package io.github.cyfko.entityql.core.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Central configuration of the query engine.
 * <p>
 * Built either programmatically through {@link #builder()} or from {@code entityql.*}
 * properties via {@link #fromProperties(Properties)}. Every knob has a default, so an empty
 * configuration is valid.
 * </p>
 *
 * <h2>Property Keys</h2>
 * <ul>
 *   <li>{@code entityql.cache.policy}: default {@link CachePolicy} of new queries ({@code NO_CACHE})</li>
 *   <li>{@code entityql.cache.max-entries}: result cache capacity (1000)</li>
 *   <li>{@code entityql.cache.ttl-seconds}: result cache time-to-live, absent for none</li>
 *   <li>{@code entityql.executor.threads}: background worker count (available processors)</li>
 *   <li>{@code entityql.id-key}: entity key used by {@code findById} ({@code id})</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class EngineConfig {

    /** Classpath resource read by {@link #fromClasspath()}. */
    public static final String RESOURCE_NAME = "entityql.properties";

    static final String CACHE_POLICY = "entityql.cache.policy";
    static final String CACHE_MAX_ENTRIES = "entityql.cache.max-entries";
    static final String CACHE_TTL_SECONDS = "entityql.cache.ttl-seconds";
    static final String EXECUTOR_THREADS = "entityql.executor.threads";
    static final String ID_KEY = "entityql.id-key";

    private final CachePolicy defaultCachePolicy;
    private final CacheConfig cacheConfig;
    private final int workerThreads;
    private final String idKey;

    private EngineConfig(Builder builder) {
        this.defaultCachePolicy = builder.defaultCachePolicy;
        this.cacheConfig = builder.cacheConfig;
        this.workerThreads = builder.workerThreads;
        this.idKey = builder.idKey;
    }

    public static Builder builder() { return new Builder(); }

    public static EngineConfig defaults() { return builder().build(); }

    public CachePolicy getDefaultCachePolicy() { return defaultCachePolicy; }
    public CacheConfig getCacheConfig() { return cacheConfig; }
    public int getWorkerThreads() { return workerThreads; }
    public String getIdKey() { return idKey; }

    /**
     * Reads a configuration from {@code entityql.*} properties. Missing keys keep their default.
     *
     * @param properties the properties
     * @return the configuration
     * @throws IllegalArgumentException when a value cannot be parsed
     */
    public static EngineConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        Builder builder = builder();

        String policy = properties.getProperty(CACHE_POLICY);
        if (policy != null) {
            builder.defaultCachePolicy(CachePolicy.valueOf(policy.trim().toUpperCase().replace('-', '_')));
        }

        String maxEntries = properties.getProperty(CACHE_MAX_ENTRIES);
        String ttlSeconds = properties.getProperty(CACHE_TTL_SECONDS);
        if (maxEntries != null || ttlSeconds != null) {
            int entries = maxEntries == null ? CacheConfig.defaults().maxEntries() : parseInt(CACHE_MAX_ENTRIES, maxEntries);
            Duration ttl = ttlSeconds == null ? null : Duration.ofSeconds(parseInt(CACHE_TTL_SECONDS, ttlSeconds));
            builder.cacheConfig(new CacheConfig(entries, ttl));
        }

        String threads = properties.getProperty(EXECUTOR_THREADS);
        if (threads != null) {
            builder.workerThreads(parseInt(EXECUTOR_THREADS, threads));
        }

        String idKey = properties.getProperty(ID_KEY);
        if (idKey != null) {
            builder.idKey(idKey.trim());
        }
        return builder.build();
    }

    /**
     * Reads {@value #RESOURCE_NAME} from the context class loader, falling back to the defaults
     * when the resource is absent.
     *
     * @return the configuration
     * @throws UncheckedIOException when the resource exists but cannot be read
     */
    public static EngineConfig fromClasspath() {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = EngineConfig.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(RESOURCE_NAME)) {
            if (in == null) {
                return defaults();
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE_NAME, e);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " must be an integer, got: " + value, e);
        }
    }

    @Override
    public String toString() {
        return "EngineConfig[defaultCachePolicy=" + defaultCachePolicy + ", cacheConfig=" + cacheConfig
                + ", workerThreads=" + workerThreads + ", idKey=" + idKey + "]";
    }

    /**
     * Builder for {@link EngineConfig}.
     */
    public static final class Builder {
        private CachePolicy defaultCachePolicy = CachePolicy.NO_CACHE;
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private int workerThreads = Runtime.getRuntime().availableProcessors();
        private String idKey = "id";

        public Builder defaultCachePolicy(CachePolicy policy) {
            this.defaultCachePolicy = Objects.requireNonNull(policy, "defaultCachePolicy");
            return this;
        }

        public Builder cacheConfig(CacheConfig config) {
            this.cacheConfig = Objects.requireNonNull(config, "cacheConfig");
            return this;
        }

        public Builder workerThreads(int threads) {
            if (threads <= 0) {
                throw new IllegalArgumentException("workerThreads must be positive, got: " + threads);
            }
            this.workerThreads = threads;
            return this;
        }

        public Builder idKey(String idKey) {
            Objects.requireNonNull(idKey, "idKey");
            if (idKey.isBlank()) {
                throw new IllegalArgumentException("idKey cannot be blank");
            }
            this.idKey = idKey;
            return this;
        }

        public EngineConfig build() { return new EngineConfig(this); }
    }
}
