package io.github.cyfko.entityql.core.api;

/**
 * Member of a {@link ConditionGroup}: either a single {@link Condition} or a nested
 * {@link ConditionGroup}.
 * <p>
 * Implementations are immutable and therefore safe to share between threads and between
 * compiled plans.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface Criterion {

    /**
     * Dispatches to the visitor method matching the concrete type.
     *
     * @param visitor the visitor
     * @param <R>     the visit result type
     * @return the visitor's result
     */
    <R> R accept(Visitor<R> visitor);

    /**
     * Double-dispatch over the two kinds of criteria, used by stores to translate a predicate
     * tree into their own query form.
     *
     * @param <R> the result type
     */
    interface Visitor<R> {
        R visitCondition(Condition condition);

        R visitGroup(ConditionGroup group);
    }
}
