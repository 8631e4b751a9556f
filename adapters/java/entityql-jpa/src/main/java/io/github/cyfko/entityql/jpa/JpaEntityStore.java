package io.github.cyfko.entityql.jpa;

import io.github.cyfko.entityql.core.api.ConditionGroup;
import io.github.cyfko.entityql.core.exception.StoreException;
import io.github.cyfko.entityql.core.model.EntityRecord;
import io.github.cyfko.entityql.core.model.MapReduce;
import io.github.cyfko.entityql.core.model.SortBy;
import io.github.cyfko.entityql.core.spi.EntityStore;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.PersistenceException;
import jakarta.persistence.Tuple;
import jakarta.persistence.TypedQuery;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Selection;
import jakarta.persistence.metamodel.Attribute;
import jakarta.persistence.metamodel.EntityType;
import jakarta.persistence.metamodel.SingularAttribute;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * {@link EntityStore} backed by a JPA {@link EntityManagerFactory}.
 * <p>
 * An entity name designates a managed entity, by its JPA entity name or its class name. Queries
 * are built with the Criteria API (see {@link JpaPredicateBuilder} for the operator mapping)
 * and select the basic singular attributes of the entity as a tuple, which becomes an
 * {@link EntityRecord} keyed by attribute name. Collection and association attributes can be
 * filtered on but are not part of the records.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * EntityManagerFactory emf = Persistence.createEntityManagerFactory("appPU");
 * EntityQueryFactory factory = EntityQueryFactory.of(new JpaEntityStore(emf), EngineConfig.defaults());
 *
 * EntityQuery query = factory.query("Player");
 * query.whereKeyGreaterThanOrEqualTo("score", 5);
 * query.orderDescendingByKey("score");
 * List<EntityRecord> players = query.findAll();
 * }</pre>
 *
 * <p>
 * Ordering and pagination are pushed to the database; ties on the ordering key are broken by
 * the id so that pages are stable. Map-reduce aggregation is not supported. Every JPA failure
 * surfaces as a {@link StoreException}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JpaEntityStore implements EntityStore {

    private static final Logger logger = Logger.getLogger(JpaEntityStore.class.getName());

    private final EntityManagerFactory emf;
    private final String idKey;
    private final Map<String, EntityType<?>> entityTypes = new ConcurrentHashMap<>();

    /**
     * Creates a store where the id key {@code "id"} designates the {@code @Id} attribute.
     *
     * @param emf the entity manager factory
     */
    public JpaEntityStore(EntityManagerFactory emf) {
        this(emf, "id");
    }

    /**
     * @param emf   the entity manager factory
     * @param idKey the key designating the {@code @Id} attribute of every entity
     */
    public JpaEntityStore(EntityManagerFactory emf, String idKey) {
        this.emf = Objects.requireNonNull(emf, "EntityManagerFactory cannot be null");
        this.idKey = Objects.requireNonNull(idKey, "Id key cannot be null");
    }

    @Override
    public List<EntityRecord> evaluate(String entityName, ConditionGroup predicate, SortBy order, int skip, int limit) {
        long startTime = System.nanoTime();

        List<EntityRecord> records = run(entityName, em -> {
            EntityType<?> type = entityType(em, entityName);
            String idAttribute = idAttribute(type);
            CriteriaBuilder cb = em.getCriteriaBuilder();
            CriteriaQuery<Tuple> query = cb.createTupleQuery();
            Root<?> root = query.from(type);

            List<String> columns = basicAttributes(type, idAttribute);
            List<Selection<?>> selections = new ArrayList<>(columns.size());
            for (String column : columns) {
                selections.add(root.get(column).alias(column));
            }
            query.multiselect(selections);

            JpaPredicateBuilder builder = new JpaPredicateBuilder(cb, root, type, idKey, idAttribute);
            query.where(predicate.accept(builder));
            if (order != null) {
                Path<?> sortPath = builder.resolve(order.key());
                query.orderBy(
                        order.isDescending() ? cb.desc(sortPath) : cb.asc(sortPath),
                        cb.asc(root.get(idAttribute)));
            }

            TypedQuery<Tuple> typed = em.createQuery(query);
            if (skip > 0) {
                typed.setFirstResult(skip);
            }
            if (limit > 0) {
                typed.setMaxResults(limit);
            }

            List<EntityRecord> result = new ArrayList<>();
            for (Tuple tuple : typed.getResultList()) {
                Map<String, Object> attributes = new LinkedHashMap<>();
                for (String column : columns) {
                    attributes.put(column, tuple.get(column));
                }
                result.add(new EntityRecord(attributes));
            }
            return result;
        });

        long durationMs = (System.nanoTime() - startTime) / 1_000_000;
        logger.info(() -> String.format("JPA query on %s completed in %dms: %d records", entityName, durationMs, records.size()));
        return records;
    }

    @Override
    public List<EntityRecord> evaluateAggregation(String entityName, ConditionGroup predicate, MapReduce mapReduce) {
        throw new StoreException("Map-reduce aggregation is not supported by the JPA store");
    }

    @Override
    public long count(String entityName, ConditionGroup predicate) {
        long startTime = System.nanoTime();

        Long count = run(entityName, em -> {
            EntityType<?> type = entityType(em, entityName);
            CriteriaBuilder cb = em.getCriteriaBuilder();
            CriteriaQuery<Long> countQuery = cb.createQuery(Long.class);
            Root<?> root = countQuery.from(type);

            countQuery.select(cb.count(root));
            countQuery.where(predicate.accept(new JpaPredicateBuilder(cb, root, type, idKey, idAttribute(type))));
            return em.createQuery(countQuery).getSingleResult();
        });

        long durationMs = (System.nanoTime() - startTime) / 1_000_000;
        logger.info(() -> String.format("Count query on %s completed in %dms: %d matches", entityName, durationMs, count));
        return count;
    }

    private <T> T run(String entityName, Function<EntityManager, T> work) {
        Objects.requireNonNull(entityName, "Entity name cannot be null");
        EntityManager em;
        try {
            em = emf.createEntityManager();
        } catch (PersistenceException | IllegalStateException e) {
            throw new StoreException("Cannot open an EntityManager: " + e.getMessage(), e);
        }
        try {
            return work.apply(em);
        } catch (StoreException e) {
            throw e;
        } catch (PersistenceException | IllegalArgumentException | IllegalStateException e) {
            throw new StoreException("JPA query on " + entityName + " failed: " + e.getMessage(), e);
        } finally {
            em.close();
        }
    }

    private EntityType<?> entityType(EntityManager em, String entityName) {
        EntityType<?> cached = entityTypes.get(entityName);
        if (cached != null) {
            return cached;
        }
        for (EntityType<?> type : em.getMetamodel().getEntities()) {
            Class<?> javaType = type.getJavaType();
            if (type.getName().equals(entityName)
                    || (javaType != null && (javaType.getName().equals(entityName) || javaType.getSimpleName().equals(entityName)))) {
                entityTypes.put(entityName, type);
                return type;
            }
        }
        throw new StoreException("No JPA entity named '" + entityName + "'");
    }

    private static String idAttribute(EntityType<?> type) {
        if (!type.hasSingleIdAttribute()) {
            throw new StoreException("Entity " + type.getName() + " has a composite id, which is not supported");
        }
        return type.getId(type.getIdType().getJavaType()).getName();
    }

    // id first, then the other basic attributes by name
    private static List<String> basicAttributes(EntityType<?> type, String idAttribute) {
        List<String> names = new ArrayList<>();
        for (SingularAttribute<?, ?> attribute : type.getSingularAttributes()) {
            if (attribute.getPersistentAttributeType() == Attribute.PersistentAttributeType.BASIC
                    && !attribute.getName().equals(idAttribute)) {
                names.add(attribute.getName());
            }
        }
        names.sort(Comparator.naturalOrder());
        names.add(0, idAttribute);
        return names;
    }
}
