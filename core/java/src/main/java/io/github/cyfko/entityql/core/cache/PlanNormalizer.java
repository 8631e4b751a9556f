package io.github.cyfko.entityql.core.cache;

import io.github.cyfko.entityql.core.model.QueryPlan;

/**
 * Strategy producing the canonical text of a {@link QueryPlan}, from which its cache
 * fingerprint is derived.
 * <p>
 * Implementations must be deterministic: the same declared query state always yields the same
 * text, in any JVM. Two plans whose canonical texts are equal must return the same results.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface PlanNormalizer {

    /**
     * @param plan the plan to normalize
     * @return the canonical text
     */
    String normalize(QueryPlan plan);
}
