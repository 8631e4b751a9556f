package io.github.cyfko.entityql.core.impl;

import io.github.cyfko.entityql.core.api.ConditionGroup;
import io.github.cyfko.entityql.core.exception.StoreException;
import io.github.cyfko.entityql.core.model.EntityRecord;
import io.github.cyfko.entityql.core.model.MapReduce;
import io.github.cyfko.entityql.core.model.SortBy;
import io.github.cyfko.entityql.core.spi.EntityStore;
import io.github.cyfko.entityql.core.utils.RecordComparators;
import io.github.cyfko.entityql.core.utils.RecordMatcher;
import io.github.cyfko.entityql.core.utils.ValueComparison;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

/**
 * {@link EntityStore} keeping records in memory, per entity name, in insertion order.
 * <p>
 * Predicates are evaluated with {@link RecordMatcher}. Whether ordering and pagination are
 * advertised is configurable, so that the executor's client-side fallbacks can be exercised
 * against a store that leaves them to the caller. Map-reduce aggregation is not supported.
 * </p>
 * <p>Thread-safe: readers share a read lock, mutations take the write lock.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class InMemoryEntityStore implements EntityStore {

    private static final Logger log = Logger.getLogger(InMemoryEntityStore.class.getName());

    private final Map<String, List<EntityRecord>> entities = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final String idKey;
    private final boolean ordering;
    private final boolean pagination;

    /**
     * Creates a store identifying records by {@code "id"} that orders and paginates itself.
     */
    public InMemoryEntityStore() {
        this("id", true, true);
    }

    /**
     * @param idKey      the key identifying a record, used by {@link #save} and {@link #delete}
     * @param ordering   whether {@link #evaluate} applies the requested ordering
     * @param pagination whether {@link #evaluate} applies skip and limit
     */
    public InMemoryEntityStore(String idKey, boolean ordering, boolean pagination) {
        this.idKey = Objects.requireNonNull(idKey, "Id key cannot be null");
        this.ordering = ordering;
        this.pagination = pagination;
    }

    /**
     * Inserts a record, or replaces the record of the same entity carrying the same id.
     * Records without an id are always appended.
     *
     * @param entityName the entity name
     * @param record     the record
     */
    public void save(String entityName, EntityRecord record) {
        Objects.requireNonNull(entityName, "Entity name cannot be null");
        Objects.requireNonNull(record, "Record cannot be null");
        lock.writeLock().lock();
        try {
            List<EntityRecord> records = entities.computeIfAbsent(entityName, name -> new ArrayList<>());
            int index = indexOf(records, record.get(idKey));
            if (index >= 0) {
                records.set(index, record);
            } else {
                records.add(record);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Convenience overload of {@link #save(String, EntityRecord)}.
     */
    public void save(String entityName, Map<String, ?> attributes) {
        save(entityName, EntityRecord.of(attributes));
    }

    /**
     * @param entityName the entity name
     * @param id         the id of the record to remove
     * @return {@code true} when a record was removed
     */
    public boolean delete(String entityName, Object id) {
        Objects.requireNonNull(id, "Id cannot be null");
        lock.writeLock().lock();
        try {
            List<EntityRecord> records = entities.get(entityName);
            if (records == null) {
                return false;
            }
            int index = indexOf(records, id);
            if (index < 0) {
                return false;
            }
            records.remove(index);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes every record of an entity.
     *
     * @param entityName the entity name
     */
    public void clear(String entityName) {
        lock.writeLock().lock();
        try {
            entities.remove(entityName);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<EntityRecord> evaluate(String entityName, ConditionGroup predicate, SortBy order, int skip, int limit) {
        List<EntityRecord> matching = select(entityName, predicate);
        if (ordering && order != null) {
            matching = RecordComparators.sort(matching, order);
        }
        if (pagination) {
            matching = RecordComparators.page(matching, skip, limit);
        }
        List<EntityRecord> result = matching;
        log.fine(() -> String.format("In-memory evaluation of %s matched %d record(s)", entityName, result.size()));
        return result;
    }

    @Override
    public List<EntityRecord> evaluateAggregation(String entityName, ConditionGroup predicate, MapReduce mapReduce) {
        throw new StoreException("Map-reduce aggregation is not supported by the in-memory store");
    }

    @Override
    public long count(String entityName, ConditionGroup predicate) {
        return select(entityName, predicate).size();
    }

    @Override
    public boolean supportsOrdering() {
        return ordering;
    }

    @Override
    public boolean supportsPagination() {
        return pagination;
    }

    private List<EntityRecord> select(String entityName, ConditionGroup predicate) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        lock.readLock().lock();
        try {
            List<EntityRecord> matching = new ArrayList<>();
            for (EntityRecord record : entities.getOrDefault(entityName, List.of())) {
                if (RecordMatcher.matches(record, predicate)) {
                    matching.add(record);
                }
            }
            return matching;
        } finally {
            lock.readLock().unlock();
        }
    }

    private int indexOf(List<EntityRecord> records, Object id) {
        if (id == null) {
            return -1;
        }
        for (int i = 0; i < records.size(); i++) {
            if (ValueComparison.valuesEqual(records.get(i).get(idKey), id)) {
                return i;
            }
        }
        return -1;
    }
}
