package io.github.cyfko.entityql.core.spi;

import io.github.cyfko.entityql.core.api.ConditionGroup;
import io.github.cyfko.entityql.core.exception.StoreException;
import io.github.cyfko.entityql.core.model.EntityRecord;
import io.github.cyfko.entityql.core.model.MapReduce;
import io.github.cyfko.entityql.core.model.SortBy;

import java.util.List;

/**
 * <h2>EntityStore</h2>
 *
 * <p>
 * Backing store of entity collections, as seen by the query executor. The engine defines no
 * transport, authentication or wire format: those belong to implementations (a remote document
 * database client, a JPA adapter, an in-memory map, ...).
 * </p>
 *
 * <h3>Capabilities</h3>
 * <p>
 * A store that cannot sort or page reports it through {@link #supportsOrdering()} and
 * {@link #supportsPagination()}. The executor then passes no order and no pagination to
 * {@link #evaluate} and applies them client-side.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Background queries call the store from the executor's worker threads, concurrently.
 * Implementations must be thread-safe.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface EntityStore {

    /**
     * Returns the records of {@code entityName} matching {@code predicate}.
     *
     * @param entityName the collection
     * @param predicate  the predicate tree
     * @param order      the ordering, {@code null} for store order
     * @param skip       number of matching records to skip
     * @param limit      maximum number of records, 0 for unbounded
     * @return the matching records, in order
     * @throws StoreException when the store fails
     */
    List<EntityRecord> evaluate(String entityName, ConditionGroup predicate, SortBy order, int skip, int limit);

    /**
     * Runs a map-reduce job over the records of {@code entityName} matching {@code predicate}.
     *
     * @param entityName the collection
     * @param predicate  the predicate selecting the job input
     * @param mapReduce  the job definition
     * @return the raw output rows of the job
     * @throws StoreException when the store fails or cannot run the job
     */
    List<EntityRecord> evaluateAggregation(String entityName, ConditionGroup predicate, MapReduce mapReduce);

    /**
     * Counts the records of {@code entityName} matching {@code predicate}, without fetching them.
     *
     * @param entityName the collection
     * @param predicate  the predicate
     * @return the number of matching records
     * @throws StoreException when the store fails
     */
    long count(String entityName, ConditionGroup predicate);

    /**
     * @return {@code true} when {@link #evaluate} honors its {@code order} argument
     */
    default boolean supportsOrdering() {
        return true;
    }

    /**
     * @return {@code true} when {@link #evaluate} honors its {@code skip} and {@code limit} arguments
     */
    default boolean supportsPagination() {
        return true;
    }
}
