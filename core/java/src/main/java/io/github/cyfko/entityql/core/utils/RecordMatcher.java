package io.github.cyfko.entityql.core.utils;

import io.github.cyfko.entityql.core.api.Condition;
import io.github.cyfko.entityql.core.api.ConditionGroup;
import io.github.cyfko.entityql.core.api.Criterion;
import io.github.cyfko.entityql.core.api.Operand;
import io.github.cyfko.entityql.core.model.EntityRecord;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates a predicate tree against a single {@link EntityRecord}.
 *
 * <h2>Operator Semantics</h2>
 * <ul>
 *   <li>{@code EQ null} matches a missing key or a key holding {@code null};
 *       {@code NE null} matches a present, non-null value</li>
 *   <li>When the record value is a collection, {@code EQ} and {@code IN} match if any element
 *       matches</li>
 *   <li>Range comparisons never match a missing key or a value of an incomparable type</li>
 *   <li>{@code CONTAINS_ALL} requires a collection (or array) value holding every operand value</li>
 *   <li>{@code REGEX} finds the pattern anywhere in a string value</li>
 *   <li>{@code EXISTS} tests key presence, whatever the value</li>
 * </ul>
 * <p>Stateless and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class RecordMatcher {

    private RecordMatcher() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * @param record    the record
     * @param criterion a condition or a group
     * @return {@code true} when the record satisfies the criterion
     */
    public static boolean matches(EntityRecord record, Criterion criterion) {
        Objects.requireNonNull(record, "record");
        return criterion.accept(new Criterion.Visitor<Boolean>() {
            @Override
            public Boolean visitCondition(Condition condition) {
                return matchesCondition(record, condition);
            }

            @Override
            public Boolean visitGroup(ConditionGroup group) {
                return matchesGroup(record, group);
            }
        });
    }

    private static boolean matchesGroup(EntityRecord record, ConditionGroup group) {
        if (group.mode() == ConditionGroup.Mode.AND) {
            for (Criterion member : group.members()) {
                if (!matches(record, member)) return false;
            }
            return true;
        }
        for (Criterion member : group.members()) {
            if (matches(record, member)) return true;
        }
        return false;
    }

    private static boolean matchesCondition(EntityRecord record, Condition condition) {
        String key = condition.key();
        Object actual = record.get(key);
        Operand operand = condition.operand();

        return switch (condition.op()) {
            case EXISTS -> record.containsKey(key);
            case NOT_EXISTS -> !record.containsKey(key);
            case EQ -> isEqual(actual, condition.scalarValue());
            case NE -> !isEqual(actual, condition.scalarValue());
            case LT -> compare(actual, condition.scalarValue(), c -> c < 0);
            case LTE -> compare(actual, condition.scalarValue(), c -> c <= 0);
            case GT -> compare(actual, condition.scalarValue(), c -> c > 0);
            case GTE -> compare(actual, condition.scalarValue(), c -> c >= 0);
            case IN -> isIn(actual, ((Operand.Sequence) operand).values());
            case NOT_IN -> !isIn(actual, ((Operand.Sequence) operand).values());
            case CONTAINS_ALL -> containsAll(actual, ((Operand.Sequence) operand).values());
            case REGEX -> actual instanceof CharSequence text
                    && ((Operand.Pattern) operand).compile().matcher(text).find();
            case CONTAINS -> actual instanceof String text && text.contains((String) condition.scalarValue());
            case HAS_PREFIX -> actual instanceof String text && text.startsWith((String) condition.scalarValue());
            case HAS_SUFFIX -> actual instanceof String text && text.endsWith((String) condition.scalarValue());
        };
    }

    private static boolean isEqual(Object actual, Object expected) {
        if (expected == null) {
            return actual == null;
        }
        List<Object> elements = asList(actual);
        if (elements != null) {
            for (Object element : elements) {
                if (ValueComparison.valuesEqual(element, expected)) return true;
            }
            return false;
        }
        return ValueComparison.valuesEqual(actual, expected);
    }

    private static boolean isIn(Object actual, List<Object> candidates) {
        for (Object candidate : candidates) {
            if (isEqual(actual, candidate)) return true;
        }
        return false;
    }

    private static boolean containsAll(Object actual, List<Object> required) {
        List<Object> elements = asList(actual);
        if (elements == null) {
            return false;
        }
        for (Object value : required) {
            boolean found = false;
            for (Object element : elements) {
                if (ValueComparison.valuesEqual(element, value)) {
                    found = true;
                    break;
                }
            }
            if (!found) return false;
        }
        return true;
    }

    private static boolean compare(Object actual, Object expected, java.util.function.IntPredicate test) {
        Integer result = ValueComparison.compare(actual, expected);
        return result != null && test.test(result);
    }

    private static List<Object> asList(Object value) {
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> elements = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                elements.add(Array.get(value, i));
            }
            return elements;
        }
        return null;
    }
}
