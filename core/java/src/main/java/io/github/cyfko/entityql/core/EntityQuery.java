package io.github.cyfko.entityql.core;

import io.github.cyfko.entityql.core.api.Condition;
import io.github.cyfko.entityql.core.api.GroupHandle;
import io.github.cyfko.entityql.core.api.QueryConditions;
import io.github.cyfko.entityql.core.api.QueryTree;
import io.github.cyfko.entityql.core.config.CachePolicy;
import io.github.cyfko.entityql.core.exception.InvalidQueryException;
import io.github.cyfko.entityql.core.model.EntityRecord;
import io.github.cyfko.entityql.core.model.MapReduce;
import io.github.cyfko.entityql.core.model.QueryPlan;
import io.github.cyfko.entityql.core.model.SortBy;
import io.github.cyfko.entityql.core.spi.QueryExecutor;
import io.github.cyfko.entityql.core.spi.ResultCallback;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable query over the records of one entity.
 * <p>
 * A query accumulates conditions, ordering, pagination, an optional map-reduce aggregation and
 * a cache policy. Nothing is validated against the store while the query is being built: on
 * every execution the current state is compiled into an immutable {@link QueryPlan}, so
 * mutating the query afterwards never affects a plan already handed to the executor.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * EntityQuery query = factory.query("players");
 * query.whereKeyGreaterThanOrEqualTo("score", 5);
 * query.or().whereKeyEqualTo("team", "red");
 * query.or().whereKeyEqualTo("team", "blue");
 * query.orderDescendingByKey("score");
 * query.setLimit(10);
 *
 * List<EntityRecord> top = query.findAll();
 * query.countAllInBackground((count, error) -> ...);
 * }</pre>
 *
 * <p>
 * Not thread-safe: a query must not be mutated while another thread executes it.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class EntityQuery implements QueryConditions {

    private final String entityName;
    private final QueryExecutor executor;
    private final CachePolicy defaultCachePolicy;
    private final QueryTree tree = new QueryTree();

    private GroupHandle root;
    private SortBy order;
    private int limit;
    private int skip;
    private MapReduce mapReduce;
    private CachePolicy cachePolicy;

    /**
     * Creates a query that can be compiled but not executed.
     *
     * @param entityName the entity name
     */
    public EntityQuery(String entityName) {
        this(entityName, null, CachePolicy.NO_CACHE);
    }

    /**
     * @param entityName the entity name
     * @param executor   the executor running this query
     */
    public EntityQuery(String entityName, QueryExecutor executor) {
        this(entityName, executor, CachePolicy.NO_CACHE);
    }

    /**
     * @param entityName         the entity name
     * @param executor           the executor running this query, {@code null} for compile-only use
     * @param defaultCachePolicy the policy in effect until {@link #setCachePolicy} is called, and
     *                           again after {@link #reset()}
     */
    public EntityQuery(String entityName, QueryExecutor executor, CachePolicy defaultCachePolicy) {
        this.entityName = entityName;
        this.executor = executor;
        this.defaultCachePolicy = Objects.requireNonNull(defaultCachePolicy, "Default cache policy cannot be null");
        this.root = tree.root();
        this.cachePolicy = defaultCachePolicy;
    }

    public String getEntityName() {
        return entityName;
    }

    @Override
    public void where(Condition condition) {
        root.where(condition);
    }

    @Override
    public GroupHandle or() {
        return root.or();
    }

    @Override
    public GroupHandle and() {
        return root.and();
    }

    public void orderAscendingByKey(String key) {
        this.order = SortBy.ascending(key);
    }

    public void orderDescendingByKey(String key) {
        this.order = SortBy.descending(key);
    }

    /**
     * @param limit maximum number of records returned, 0 for unbounded
     * @throws IllegalArgumentException if {@code limit} is negative
     */
    public void setLimit(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("Limit cannot be negative: " + limit);
        }
        this.limit = limit;
    }

    /**
     * @param skip number of leading records skipped; ignored when an aggregation is set
     * @throws IllegalArgumentException if {@code skip} is negative
     */
    public void setSkip(int skip) {
        if (skip < 0) {
            throw new IllegalArgumentException("Skip cannot be negative: " + skip);
        }
        this.skip = skip;
    }

    /**
     * Turns {@link #findAll()} into a map-reduce aggregation. {@code null} clears it.
     */
    public void setMapReduce(MapReduce mapReduce) {
        this.mapReduce = mapReduce;
    }

    public void setCachePolicy(CachePolicy cachePolicy) {
        this.cachePolicy = Objects.requireNonNull(cachePolicy, "Cache policy cannot be null");
    }

    public SortBy getOrder() {
        return order;
    }

    public int getLimit() {
        return limit;
    }

    public int getSkip() {
        return skip;
    }

    public MapReduce getMapReduce() {
        return mapReduce;
    }

    public CachePolicy getCachePolicy() {
        return cachePolicy;
    }

    /**
     * Restores the state this query had right after construction. The entity name is kept;
     * group handles obtained earlier become unusable.
     */
    public void reset() {
        tree.clear();
        root = tree.root();
        order = null;
        limit = 0;
        skip = 0;
        mapReduce = null;
        cachePolicy = defaultCachePolicy;
    }

    /**
     * Compiles the current state into an immutable plan.
     *
     * @return the plan
     * @throws InvalidQueryException if the entity name is missing
     */
    public QueryPlan compile() {
        if (entityName == null || entityName.isBlank()) {
            throw new InvalidQueryException("Entity name cannot be null or blank");
        }
        return new QueryPlan(entityName, tree.compose(), order, limit, skip, mapReduce, cachePolicy);
    }

    // ---------------------------------------------------------------- execution

    /**
     * @return the matching records, or the aggregation output when a map-reduce is set
     */
    public List<EntityRecord> findAll() {
        return executor().findAll(compile());
    }

    /**
     * @return the first matching record, empty when none matches
     * @throws io.github.cyfko.entityql.core.exception.UnsupportedQueryException if a map-reduce is set
     */
    public Optional<EntityRecord> findOne() {
        return executor().findOne(compile());
    }

    /**
     * Looks a record up by id, ignoring the conditions of this query. The cache policy of this
     * query applies.
     *
     * @param id the id
     * @return the record, empty when none has this id
     */
    public Optional<EntityRecord> findById(Object id) {
        return executor().findById(entityName, id, cachePolicy);
    }

    /**
     * @return the number of matching records; ordering and pagination are ignored
     */
    public long countAll() {
        return executor().countAll(compile());
    }

    public void findAllInBackground(ResultCallback<List<EntityRecord>> callback) {
        QueryExecutor executor = executor();
        QueryPlan plan = compileFor(callback);
        if (plan != null) {
            executor.findAllInBackground(plan, callback);
        }
    }

    public void findOneInBackground(ResultCallback<Optional<EntityRecord>> callback) {
        QueryExecutor executor = executor();
        QueryPlan plan = compileFor(callback);
        if (plan != null) {
            executor.findOneInBackground(plan, callback);
        }
    }

    public void findByIdInBackground(Object id, ResultCallback<Optional<EntityRecord>> callback) {
        executor().findByIdInBackground(entityName, id, cachePolicy, callback);
    }

    public void countAllInBackground(ResultCallback<Long> callback) {
        QueryExecutor executor = executor();
        QueryPlan plan = compileFor(callback);
        if (plan != null) {
            executor.countAllInBackground(plan, callback);
        }
    }

    private <T> QueryPlan compileFor(ResultCallback<T> callback) {
        Objects.requireNonNull(callback, "Callback cannot be null");
        try {
            return compile();
        } catch (InvalidQueryException e) {
            callback.onResult(null, e);
            return null;
        }
    }

    private QueryExecutor executor() {
        if (executor == null) {
            throw new IllegalStateException("Query on '" + entityName + "' has no executor; create it through EntityQueryFactory");
        }
        return executor;
    }

    @Override
    public String toString() {
        return "EntityQuery[entity=" + entityName + ", predicate=" + tree.compose() + ", order=" + order
                + ", limit=" + limit + ", skip=" + skip + ", cachePolicy=" + cachePolicy + "]";
    }
}
