package io.github.cyfko.entityql.core.api;

import java.util.Collection;
import java.util.Set;

/**
 * Condition-appending surface shared by {@code EntityQuery} and {@link GroupHandle}.
 * <p>
 * Every {@code whereKey*} method builds a {@link Condition} (failing fast with
 * {@link io.github.cyfko.entityql.core.exception.InvalidConditionException} on a malformed
 * operand) and appends it to the conjunction of the receiving group. Conditions are never
 * merged or checked against each other: {@code x = 1} and {@code x = 2} both stay, and the
 * query simply matches nothing.
 * </p>
 *
 * <h2>Grouping</h2>
 * <pre>{@code
 * // status = ACTIVE AND (tier = GOLD OR (age >= 65 AND retired EXISTS))
 * query.whereKeyEqualTo("status", "ACTIVE");
 * query.or().whereKeyEqualTo("tier", "GOLD");
 * GroupHandle senior = query.or();
 * senior.whereKeyGreaterThanOrEqualTo("age", 65);
 * senior.whereKeyExists("retired");
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface QueryConditions {

    /**
     * Appends a condition to this group.
     *
     * @param condition the condition
     */
    void where(Condition condition);

    /**
     * Starts a new OR branch of this group. Conditions added through the returned handle are
     * ANDed together; the branches of one group are ORed with each other.
     *
     * @return a handle on the new branch
     */
    GroupHandle or();

    /**
     * Starts a new AND sub-group of this group.
     *
     * @return a handle on the new sub-group
     */
    GroupHandle and();

    default GroupHandle beginOr() {
        return or();
    }

    default GroupHandle beginAnd() {
        return and();
    }

    default void whereKey(String key, Op op, Object value) {
        where(Condition.of(key, op, value));
    }

    default void whereKeyEqualTo(String key, Object value) {
        whereKey(key, Op.EQ, value);
    }

    default void whereKeyNotEqualTo(String key, Object value) {
        whereKey(key, Op.NE, value);
    }

    default void whereKeyLessThan(String key, Object value) {
        whereKey(key, Op.LT, value);
    }

    default void whereKeyLessThanOrEqualTo(String key, Object value) {
        whereKey(key, Op.LTE, value);
    }

    default void whereKeyGreaterThan(String key, Object value) {
        whereKey(key, Op.GT, value);
    }

    default void whereKeyGreaterThanOrEqualTo(String key, Object value) {
        whereKey(key, Op.GTE, value);
    }

    default void whereKeyContainedIn(String key, Collection<?> values) {
        whereKey(key, Op.IN, values);
    }

    default void whereKeyNotContainedIn(String key, Collection<?> values) {
        whereKey(key, Op.NOT_IN, values);
    }

    /**
     * Matches records whose collection value under {@code key} holds every one of
     * {@code values}.
     */
    default void whereKeyContainsAllIn(String key, Collection<?> values) {
        whereKey(key, Op.CONTAINS_ALL, values);
    }

    default void whereKeyMatchesRegex(String key, String regex) {
        where(Condition.regex(key, regex, Set.of()));
    }

    default void whereKeyMatchesRegex(String key, String regex, Set<RegexOption> options) {
        where(Condition.regex(key, regex, options));
    }

    default void whereKeyContainsString(String key, String substring) {
        whereKey(key, Op.CONTAINS, substring);
    }

    default void whereKeyHasPrefix(String key, String prefix) {
        whereKey(key, Op.HAS_PREFIX, prefix);
    }

    default void whereKeyHasSuffix(String key, String suffix) {
        whereKey(key, Op.HAS_SUFFIX, suffix);
    }

    default void whereKeyExists(String key) {
        where(Condition.exists(key));
    }

    default void whereKeyDoesNotExist(String key) {
        where(Condition.notExists(key));
    }
}
