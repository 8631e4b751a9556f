package io.github.cyfko.entityql.core.spi;

import io.github.cyfko.entityql.core.config.CachePolicy;
import io.github.cyfko.entityql.core.exception.StoreException;
import io.github.cyfko.entityql.core.exception.UnsupportedQueryException;
import io.github.cyfko.entityql.core.model.EntityRecord;
import io.github.cyfko.entityql.core.model.QueryPlan;

import java.util.List;
import java.util.Optional;

/**
 * <h2>QueryExecutor</h2>
 *
 * <p>
 * Runs compiled {@link QueryPlan}s against an {@link EntityStore}, honoring each plan's
 * {@link CachePolicy}. Every operation exists in a blocking form and in a background form
 * delivering to a {@link ResultCallback}.
 * </p>
 *
 * <h3>Background Delivery Guarantees</h3>
 * <ul>
 *   <li>One task per call is scheduled on a shared worker pool; there is no cancellation</li>
 *   <li>The callback of scheduled work never runs on the caller's stack</li>
 *   <li>The callback is invoked exactly once per call, failures included; the only exception
 *       is {@link CachePolicy#CACHE_THEN_NETWORK} with a cache hit, which delivers the cached
 *       result and then the live outcome</li>
 *   <li>Plan-shape errors ({@link UnsupportedQueryException}) are delivered before anything is
 *       scheduled, and the store is never contacted</li>
 * </ul>
 *
 * <h3>Usage Examples:</h3>
 * <pre>{@code
 * QueryPlan plan = query.compile();
 * List<EntityRecord> all = executor.findAll(plan);
 * Optional<EntityRecord> first = executor.findOne(plan);
 * long total = executor.countAll(plan);
 *
 * executor.findAllInBackground(plan, (records, error) -> {
 *     if (error != null) { ... } else { ... }
 * });
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface QueryExecutor extends AutoCloseable {

    /**
     * Finds all records matching the plan, or the aggregation output when the plan carries a
     * map-reduce stage.
     *
     * @param plan the plan
     * @return the records, ordered and paged as declared
     * @throws StoreException when the store fails and no cached fallback applies
     */
    List<EntityRecord> findAll(QueryPlan plan);

    /**
     * Finds the first record matching the plan.
     *
     * @param plan the plan
     * @return the record, or empty when nothing matches
     * @throws UnsupportedQueryException if the plan carries a map-reduce stage
     * @throws StoreException            when the store fails and no cached fallback applies
     */
    Optional<EntityRecord> findOne(QueryPlan plan);

    /**
     * Finds a record by its id key, bypassing any builder.
     *
     * @param entityName  the collection
     * @param id          the id value
     * @param cachePolicy the cache policy of the implicit plan
     * @return the record, or empty when no record has that id
     * @throws StoreException when the store fails and no cached fallback applies
     */
    Optional<EntityRecord> findById(String entityName, Object id, CachePolicy cachePolicy);

    /**
     * Counts the records matching the plan's predicate. Order, limit and skip are ignored.
     *
     * @param plan the plan
     * @return the count
     * @throws UnsupportedQueryException if the plan carries a map-reduce stage
     * @throws StoreException            when the store fails
     */
    long countAll(QueryPlan plan);

    void findAllInBackground(QueryPlan plan, ResultCallback<List<EntityRecord>> callback);

    void findOneInBackground(QueryPlan plan, ResultCallback<Optional<EntityRecord>> callback);

    void findByIdInBackground(String entityName, Object id, CachePolicy cachePolicy,
                              ResultCallback<Optional<EntityRecord>> callback);

    void countAllInBackground(QueryPlan plan, ResultCallback<Long> callback);

    /**
     * @return the entity key used by {@link #findById}
     */
    String idKey();

    /**
     * Releases the worker pool when it is owned by this executor.
     */
    @Override
    void close();
}
