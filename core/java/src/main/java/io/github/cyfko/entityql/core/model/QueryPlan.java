package io.github.cyfko.entityql.core.model;

import io.github.cyfko.entityql.core.api.ConditionGroup;
import io.github.cyfko.entityql.core.cache.CanonicalPlanNormalizer;
import io.github.cyfko.entityql.core.config.CachePolicy;

import java.util.Objects;

/**
 * Immutable, fingerprinted form of a query, produced by {@code EntityQuery.compile()}.
 * <p>
 * A plan holds its own deep copy of the predicate tree, so mutating the builder after
 * compilation never affects a plan already handed to the executor. When a map-reduce stage is
 * set, {@code skip} is forced to 0: aggregation defines its own result shape.
 * </p>
 *
 * <h2>Fingerprint</h2>
 * <p>
 * The {@linkplain #fingerprint() fingerprint} is the SHA-256 of the canonical form computed by
 * {@link CanonicalPlanNormalizer}. It covers the entity name, the predicate (conditions of each
 * group sorted, nested groups in declared order), the order, limit, skip and aggregation
 * definition. The cache policy is deliberately left out: it decides whether the cache is used,
 * not what the query returns. Equal fingerprints imply equal result sets; two plans with equal
 * results may still have different fingerprints.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class QueryPlan {

    private final String entityName;
    private final ConditionGroup predicate;
    private final SortBy order;
    private final int limit;
    private final int skip;
    private final MapReduce mapReduce;
    private final CachePolicy cachePolicy;
    private final String fingerprint;

    /**
     * Creates a plan. Prefer {@code EntityQuery.compile()}, which performs query validation.
     *
     * @param entityName  the collection to query, never blank
     * @param predicate   the full composed predicate
     * @param order       the ordering, may be {@code null}
     * @param limit       maximum number of results, 0 for unbounded
     * @param skip        number of results to skip, ignored when {@code mapReduce} is set
     * @param mapReduce   the aggregation stage, may be {@code null}
     * @param cachePolicy the cache policy
     */
    public QueryPlan(String entityName, ConditionGroup predicate, SortBy order, int limit, int skip,
                     MapReduce mapReduce, CachePolicy cachePolicy) {
        this.entityName = Objects.requireNonNull(entityName, "Entity name cannot be null");
        this.predicate = Objects.requireNonNull(predicate, "Predicate cannot be null");
        if (limit < 0 || skip < 0) {
            throw new IllegalArgumentException("limit and skip must not be negative, got limit=" + limit + ", skip=" + skip);
        }
        this.order = order;
        this.limit = limit;
        this.mapReduce = mapReduce;
        this.skip = mapReduce != null ? 0 : skip;
        this.cachePolicy = Objects.requireNonNull(cachePolicy, "Cache policy cannot be null");
        this.fingerprint = CanonicalPlanNormalizer.INSTANCE.fingerprint(this);
    }

    public String entityName() { return entityName; }
    public ConditionGroup predicate() { return predicate; }
    public SortBy order() { return order; }
    public int limit() { return limit; }
    public int skip() { return skip; }
    public MapReduce mapReduce() { return mapReduce; }
    public CachePolicy cachePolicy() { return cachePolicy; }
    public String fingerprint() { return fingerprint; }

    public boolean hasAggregation() {
        return mapReduce != null;
    }

    /**
     * @param limit the new limit
     * @return a copy of this plan with another limit
     */
    public QueryPlan withLimit(int limit) {
        return new QueryPlan(entityName, predicate, order, limit, skip, mapReduce, cachePolicy);
    }

    /**
     * @param cachePolicy the new policy
     * @return a copy of this plan with another cache policy, sharing the fingerprint
     */
    public QueryPlan withCachePolicy(CachePolicy cachePolicy) {
        return new QueryPlan(entityName, predicate, order, limit, skip, mapReduce, cachePolicy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueryPlan other)) return false;
        return limit == other.limit
                && skip == other.skip
                && entityName.equals(other.entityName)
                && predicate.equals(other.predicate)
                && Objects.equals(order, other.order)
                && Objects.equals(mapReduce, other.mapReduce)
                && cachePolicy == other.cachePolicy
                && fingerprint.equals(other.fingerprint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fingerprint, cachePolicy);
    }

    @Override
    public String toString() {
        return "QueryPlan[entity=" + entityName + ", predicate=" + predicate + ", order=" + order
                + ", limit=" + limit + ", skip=" + skip + ", mapReduce=" + (mapReduce != null)
                + ", cachePolicy=" + cachePolicy + ", fingerprint=" + fingerprint + "]";
    }
}
