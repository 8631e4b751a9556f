package io.github.cyfko.entityql.core.impl;

import io.github.cyfko.entityql.core.api.Condition;
import io.github.cyfko.entityql.core.api.ConditionGroup;
import io.github.cyfko.entityql.core.api.Op;
import io.github.cyfko.entityql.core.cache.CacheEntry;
import io.github.cyfko.entityql.core.cache.ResultCache;
import io.github.cyfko.entityql.core.config.CachePolicy;
import io.github.cyfko.entityql.core.config.EngineConfig;
import io.github.cyfko.entityql.core.exception.InvalidQueryException;
import io.github.cyfko.entityql.core.exception.StoreException;
import io.github.cyfko.entityql.core.exception.UnsupportedQueryException;
import io.github.cyfko.entityql.core.model.EntityRecord;
import io.github.cyfko.entityql.core.model.QueryOperation;
import io.github.cyfko.entityql.core.model.QueryPlan;
import io.github.cyfko.entityql.core.spi.EntityStore;
import io.github.cyfko.entityql.core.spi.QueryExecutor;
import io.github.cyfko.entityql.core.spi.ResultCallback;
import io.github.cyfko.entityql.core.utils.RecordComparators;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link QueryExecutor}: resolves the cache policy of a plan, runs it against an
 * {@link EntityStore} and hands background results to a worker pool.
 *
 * <h2>Cache Policies</h2>
 * <ul>
 *   <li>{@link CachePolicy#NO_CACHE}: store only; the cache is neither read nor written</li>
 *   <li>{@link CachePolicy#CACHE_ELSE_NETWORK}: a cached result short-circuits the store;
 *       on a miss the store result is cached</li>
 *   <li>{@link CachePolicy#NETWORK_ELSE_CACHE}: the store result is cached; when the store fails,
 *       a cached result is served instead of the error</li>
 *   <li>{@link CachePolicy#CACHE_THEN_NETWORK}: in background, a cached result is delivered first
 *       and the store result second. A blocking call can only return once, so it behaves like
 *       {@code NETWORK_ELSE_CACHE}.</li>
 * </ul>
 * <p>
 * Counts are never cached. A cache failure is logged and treated as a miss.
 * </p>
 *
 * <h2>Ordering and Pagination</h2>
 * <p>
 * Ordering is pushed to the store when it supports it, otherwise the store result is stably
 * sorted here. Skip and limit are pushed only when the store paginates <em>and</em> the
 * ordering was pushed too; a page taken before sorting would be the wrong page.
 * </p>
 *
 * <h2>Background Delivery</h2>
 * <p>
 * Callbacks run on a worker thread, never on the calling thread, exactly once, or twice for a
 * {@code CACHE_THEN_NETWORK} cache hit. Errors detected while compiling the request
 * ({@link InvalidQueryException}, {@link UnsupportedQueryException}) and a rejected submission
 * are the exceptions: they are delivered before the call returns. A callback that throws is
 * logged and is not invoked again.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class DefaultQueryExecutor implements QueryExecutor {

    private static final Logger log = Logger.getLogger(DefaultQueryExecutor.class.getName());

    private final EntityStore store;
    private final ResultCache cache;
    private final ExecutorService workers;
    private final boolean ownsWorkers;
    private final String idKey;
    private final Clock clock;

    /**
     * Creates an executor owning a fixed pool of {@link EngineConfig#getWorkerThreads()} daemon
     * threads, shut down by {@link #close()}.
     *
     * @param store  the store
     * @param cache  the result cache
     * @param config the engine configuration
     */
    public DefaultQueryExecutor(EntityStore store, ResultCache cache, EngineConfig config) {
        this(store, cache, Executors.newFixedThreadPool(config.getWorkerThreads(), new WorkerThreadFactory()),
                true, config.getIdKey(), Clock.systemUTC());
    }

    /**
     * Creates an executor running background work on {@code workers}. The pool belongs to the
     * caller and is left running by {@link #close()}.
     *
     * @param store   the store
     * @param cache   the result cache
     * @param workers the pool background queries run on
     * @param idKey   the key {@code findById} matches against
     */
    public DefaultQueryExecutor(EntityStore store, ResultCache cache, ExecutorService workers, String idKey) {
        this(store, cache, workers, false, idKey, Clock.systemUTC());
    }

    private DefaultQueryExecutor(EntityStore store, ResultCache cache, ExecutorService workers,
                                 boolean ownsWorkers, String idKey, Clock clock) {
        this.store = Objects.requireNonNull(store, "Entity store cannot be null");
        this.cache = Objects.requireNonNull(cache, "Result cache cannot be null");
        this.workers = Objects.requireNonNull(workers, "Worker pool cannot be null");
        this.ownsWorkers = ownsWorkers;
        this.idKey = Objects.requireNonNull(idKey, "Id key cannot be null");
        this.clock = clock;
    }

    @Override
    public String idKey() {
        return idKey;
    }

    /**
     * @return the cache this executor reads and writes
     */
    public ResultCache cache() {
        return cache;
    }

    // ---------------------------------------------------------------- blocking

    @Override
    public List<EntityRecord> findAll(QueryPlan plan) {
        Objects.requireNonNull(plan, "Query plan cannot be null");
        return timed(QueryOperation.FIND_ALL, plan, () -> processed(plan, resolve(plan, QueryOperation.FIND_ALL)));
    }

    @Override
    public Optional<EntityRecord> findOne(QueryPlan plan) {
        Objects.requireNonNull(plan, "Query plan cannot be null");
        rejectAggregation(plan, QueryOperation.FIND_ONE);
        QueryPlan single = plan.withLimit(1);
        return timed(QueryOperation.FIND_ONE, single, () -> first(resolve(single, QueryOperation.FIND_ONE)));
    }

    @Override
    public Optional<EntityRecord> findById(String entityName, Object id, CachePolicy cachePolicy) {
        QueryPlan plan = idPlan(entityName, id, cachePolicy);
        return timed(QueryOperation.FIND_BY_ID, plan, () -> first(resolve(plan, QueryOperation.FIND_BY_ID)));
    }

    @Override
    public long countAll(QueryPlan plan) {
        Objects.requireNonNull(plan, "Query plan cannot be null");
        rejectAggregation(plan, QueryOperation.COUNT_ALL);
        return timed(QueryOperation.COUNT_ALL, plan, () -> count(plan));
    }

    // -------------------------------------------------------------- background

    @Override
    public void findAllInBackground(QueryPlan plan, ResultCallback<List<EntityRecord>> callback) {
        Objects.requireNonNull(plan, "Query plan cannot be null");
        Objects.requireNonNull(callback, "Callback cannot be null");
        submitRecords(QueryOperation.FIND_ALL, plan, callback, Function.identity());
    }

    @Override
    public void findOneInBackground(QueryPlan plan, ResultCallback<Optional<EntityRecord>> callback) {
        Objects.requireNonNull(plan, "Query plan cannot be null");
        Objects.requireNonNull(callback, "Callback cannot be null");
        try {
            rejectAggregation(plan, QueryOperation.FIND_ONE);
        } catch (UnsupportedQueryException e) {
            callback.onResult(null, e);
            return;
        }
        submitRecords(QueryOperation.FIND_ONE, plan.withLimit(1), callback, DefaultQueryExecutor::first);
    }

    @Override
    public void findByIdInBackground(String entityName, Object id, CachePolicy cachePolicy,
                                     ResultCallback<Optional<EntityRecord>> callback) {
        Objects.requireNonNull(callback, "Callback cannot be null");
        QueryPlan plan;
        try {
            plan = idPlan(entityName, id, cachePolicy);
        } catch (InvalidQueryException e) {
            callback.onResult(null, e);
            return;
        }
        submitRecords(QueryOperation.FIND_BY_ID, plan, callback, DefaultQueryExecutor::first);
    }

    @Override
    public void countAllInBackground(QueryPlan plan, ResultCallback<Long> callback) {
        Objects.requireNonNull(plan, "Query plan cannot be null");
        Objects.requireNonNull(callback, "Callback cannot be null");
        try {
            rejectAggregation(plan, QueryOperation.COUNT_ALL);
        } catch (UnsupportedQueryException e) {
            callback.onResult(null, e);
            return;
        }
        Delivery<Long> delivery = new Delivery<>(QueryOperation.COUNT_ALL, callback, 1);
        execute(delivery, () -> delivery.success(timed(QueryOperation.COUNT_ALL, plan, () -> count(plan))));
    }

    /**
     * Shuts down the worker pool when this executor created it. Queries already submitted
     * still complete and deliver.
     */
    @Override
    public void close() {
        if (ownsWorkers) {
            log.fine("Shutting down EntityQL worker pool");
            workers.shutdown();
        }
    }

    private <T> void submitRecords(QueryOperation operation, QueryPlan plan, ResultCallback<T> callback,
                                   Function<List<EntityRecord>, T> shape) {
        if (plan.cachePolicy() != CachePolicy.CACHE_THEN_NETWORK) {
            Delivery<T> delivery = new Delivery<>(operation, callback, 1);
            execute(delivery, () -> delivery.success(shape.apply(
                    timed(operation, plan, () -> processed(plan, resolve(plan, operation))))));
            return;
        }

        Delivery<T> delivery = new Delivery<>(operation, callback, 2);
        execute(delivery, () -> {
            lookup(plan).ifPresent(cached -> {
                log.fine(() -> String.format("%s %s: delivering cached result before refresh", operation, plan.entityName()));
                delivery.success(shape.apply(processed(plan, cached)));
            });
            List<EntityRecord> live = timed(operation, plan, () -> fetch(plan, operation));
            remember(plan, live);
            delivery.success(shape.apply(processed(plan, live)));
        });
    }

    private void execute(Delivery<?> delivery, Runnable work) {
        try {
            workers.execute(() -> {
                try {
                    work.run();
                } catch (RuntimeException e) {
                    delivery.failure(e);
                } catch (Error e) {
                    delivery.failure(e);
                    throw e;
                }
            });
        } catch (RejectedExecutionException e) {
            log.warning(() -> String.format("%s rejected by the worker pool: %s", delivery.operation, e.getMessage()));
            delivery.failure(e);
        }
    }

    // ------------------------------------------------------------ resolution

    private List<EntityRecord> resolve(QueryPlan plan, QueryOperation operation) {
        switch (plan.cachePolicy()) {
            case NO_CACHE:
                return fetch(plan, operation);
            case CACHE_ELSE_NETWORK: {
                Optional<List<EntityRecord>> cached = lookup(plan);
                if (cached.isPresent()) {
                    log.fine(() -> String.format("%s %s: served from cache", operation, plan.entityName()));
                    return cached.get();
                }
                List<EntityRecord> live = fetch(plan, operation);
                remember(plan, live);
                return live;
            }
            default:
                try {
                    List<EntityRecord> live = fetch(plan, operation);
                    remember(plan, live);
                    return live;
                } catch (StoreException e) {
                    Optional<List<EntityRecord>> cached = lookup(plan);
                    if (cached.isPresent()) {
                        log.warning(() -> String.format("%s %s: store failed (%s), serving cached result",
                                operation, plan.entityName(), e.getMessage()));
                        return cached.get();
                    }
                    throw e;
                }
        }
    }

    private List<EntityRecord> fetch(QueryPlan plan, QueryOperation operation) {
        try {
            if (plan.hasAggregation()) {
                return immutable(store.evaluateAggregation(plan.entityName(), plan.predicate(), plan.mapReduce()));
            }

            boolean pushOrder = plan.order() == null || store.supportsOrdering();
            boolean pushPaging = pushOrder && store.supportsPagination();
            List<EntityRecord> records = store.evaluate(
                    plan.entityName(),
                    plan.predicate(),
                    pushOrder ? plan.order() : null,
                    pushPaging ? plan.skip() : 0,
                    pushPaging ? plan.limit() : 0);

            if (!pushOrder) {
                records = RecordComparators.sort(records, plan.order());
            }
            if (!pushPaging) {
                return RecordComparators.page(records, plan.skip(), plan.limit());
            }
            return immutable(records);
        } catch (StoreException e) {
            throw e.taggedWith(operation);
        }
    }

    // the cache holds raw aggregation output; the client-side processor runs on every delivery
    private static List<EntityRecord> processed(QueryPlan plan, List<EntityRecord> records) {
        if (!plan.hasAggregation() || plan.mapReduce().resultProcessor() == null) {
            return records;
        }
        return immutable(plan.mapReduce().process(records));
    }

    private long count(QueryPlan plan) {
        try {
            return store.count(plan.entityName(), plan.predicate());
        } catch (StoreException e) {
            throw e.taggedWith(QueryOperation.COUNT_ALL);
        }
    }

    private Optional<List<EntityRecord>> lookup(QueryPlan plan) {
        try {
            return cache.get(plan.fingerprint()).map(CacheEntry::records);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Result cache lookup failed, treating as a miss", e);
            return Optional.empty();
        }
    }

    private void remember(QueryPlan plan, List<EntityRecord> records) {
        if (!plan.cachePolicy().usesCache()) {
            return;
        }
        try {
            cache.put(new CacheEntry(plan.fingerprint(), plan.entityName(), records, clock.instant()));
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Result cache store failed, result not cached", e);
        }
    }

    private QueryPlan idPlan(String entityName, Object id, CachePolicy cachePolicy) {
        if (entityName == null || entityName.isBlank()) {
            throw new InvalidQueryException("Entity name cannot be null or blank");
        }
        Objects.requireNonNull(id, "Id cannot be null");
        Objects.requireNonNull(cachePolicy, "Cache policy cannot be null");
        ConditionGroup predicate = ConditionGroup.and(List.of(Condition.of(idKey, Op.EQ, id)));
        return new QueryPlan(entityName, predicate, null, 1, 0, null, cachePolicy);
    }

    private static void rejectAggregation(QueryPlan plan, QueryOperation operation) {
        if (plan.hasAggregation()) {
            throw new UnsupportedQueryException(operation,
                    operation + " cannot run a map-reduce aggregation; use FIND_ALL");
        }
    }

    private static Optional<EntityRecord> first(List<EntityRecord> records) {
        return records.isEmpty() ? Optional.empty() : Optional.ofNullable(records.get(0));
    }

    private static List<EntityRecord> immutable(List<EntityRecord> records) {
        return records == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(records));
    }

    private static <T> T timed(QueryOperation operation, QueryPlan plan, Supplier<T> work) {
        log.fine(() -> String.format(
                "Executing %s: entity=%s, cachePolicy=%s, fingerprint=%s",
                operation,
                plan.entityName(),
                plan.cachePolicy(),
                plan.fingerprint()
        ));

        long start = System.nanoTime();
        T result = work.get();
        long durationMs = (System.nanoTime() - start) / 1_000_000;

        log.info(() -> String.format("EntityQL %s on %s executed successfully in %d ms",
                operation, plan.entityName(), durationMs));
        return result;
    }

    /**
     * Guards a callback so that it is invoked at most {@code permits} times, and never again
     * after it delivered an error or threw.
     */
    private static final class Delivery<T> {
        private final QueryOperation operation;
        private final ResultCallback<T> callback;
        private final AtomicInteger remaining;

        Delivery(QueryOperation operation, ResultCallback<T> callback, int permits) {
            this.operation = operation;
            this.callback = callback;
            this.remaining = new AtomicInteger(permits);
        }

        void success(T result) {
            if (remaining.getAndDecrement() > 0) {
                invoke(result, null);
            }
        }

        void failure(Throwable error) {
            if (remaining.getAndSet(0) > 0) {
                invoke(null, error);
            } else {
                log.log(Level.WARNING, operation + " failed after its result was delivered", error);
            }
        }

        private void invoke(T result, Throwable error) {
            try {
                callback.onResult(result, error);
            } catch (RuntimeException e) {
                remaining.set(0);
                log.log(Level.WARNING, "Result callback for " + operation + " threw", e);
            }
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "entityql-worker-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
