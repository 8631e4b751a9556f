package io.github.cyfko.entityql.core;

import io.github.cyfko.entityql.core.cache.LruResultCache;
import io.github.cyfko.entityql.core.cache.ResultCache;
import io.github.cyfko.entityql.core.config.EngineConfig;
import io.github.cyfko.entityql.core.impl.DefaultQueryExecutor;
import io.github.cyfko.entityql.core.spi.EntityStore;
import io.github.cyfko.entityql.core.spi.QueryExecutor;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Entry point wiring an {@link EntityStore}, a {@link ResultCache} and an
 * {@link EngineConfig} into a {@link QueryExecutor}, and creating queries bound to it.
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * try (EntityQueryFactory factory = EntityQueryFactory.of(store, EngineConfig.defaults())) {
 *     EntityQuery query = factory.query("users");
 *     query.whereKeyEqualTo("status", "ACTIVE");
 *     List<EntityRecord> active = query.findAll();
 * }
 * }</pre>
 *
 * <p>
 * A factory is thread-safe and meant to be shared; the queries it creates are not. Closing the
 * factory shuts the worker pool down.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class EntityQueryFactory implements AutoCloseable {

    private static final Logger log = Logger.getLogger(EntityQueryFactory.class.getName());

    private final EngineConfig config;
    private final ResultCache cache;
    private final QueryExecutor executor;

    private EntityQueryFactory(EngineConfig config, ResultCache cache, QueryExecutor executor) {
        this.config = config;
        this.cache = cache;
        this.executor = executor;
    }

    /**
     * Creates a factory with an LRU cache sized by {@code config}.
     *
     * @param store  the store queries run against
     * @param config the configuration
     * @return the factory
     */
    public static EntityQueryFactory of(EntityStore store, EngineConfig config) {
        Objects.requireNonNull(config, "Engine configuration cannot be null");
        return of(store, new LruResultCache(config.getCacheConfig()), config);
    }

    /**
     * Creates a factory using the given cache.
     *
     * @param store  the store queries run against
     * @param cache  the result cache
     * @param config the configuration
     * @return the factory
     */
    public static EntityQueryFactory of(EntityStore store, ResultCache cache, EngineConfig config) {
        Objects.requireNonNull(store, "Entity store cannot be null");
        Objects.requireNonNull(cache, "Result cache cannot be null");
        Objects.requireNonNull(config, "Engine configuration cannot be null");
        log.fine(() -> "Creating EntityQL factory with " + config);
        return new EntityQueryFactory(config, cache, new DefaultQueryExecutor(store, cache, config));
    }

    /**
     * Creates a factory configured from {@value EngineConfig#RESOURCE_NAME} on the classpath,
     * or with defaults when the resource is absent.
     *
     * @param store the store queries run against
     * @return the factory
     */
    public static EntityQueryFactory fromClasspath(EntityStore store) {
        return of(store, EngineConfig.fromClasspath());
    }

    /**
     * Creates a new query on {@code entityName} using the configured default cache policy.
     *
     * @param entityName the entity name
     * @return a fresh query
     */
    public EntityQuery query(String entityName) {
        return new EntityQuery(entityName, executor, config.getDefaultCachePolicy());
    }

    public EngineConfig getConfig() {
        return config;
    }

    public ResultCache getCache() {
        return cache;
    }

    public QueryExecutor getExecutor() {
        return executor;
    }

    @Override
    public void close() {
        executor.close();
    }
}
