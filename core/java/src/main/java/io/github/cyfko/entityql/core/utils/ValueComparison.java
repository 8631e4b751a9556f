package io.github.cyfko.entityql.core.utils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Loose comparison of schemaless attribute values.
 * <p>
 * Records carry whatever types their store produced, so a key may hold an {@code Integer} in
 * one record and a {@code Long} in another. Numbers are therefore compared by numeric value
 * across types; other values are compared only when one is an instance of the other's class
 * and is {@link Comparable}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ValueComparison {

    private ValueComparison() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Tests two values for equality, numbers by value. {@code NaN} equals nothing, itself
     * included.
     *
     * @param left  the first value, may be {@code null}
     * @param right the second value, may be {@code null}
     * @return {@code true} when equal
     */
    public static boolean valuesEqual(Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            if (isNaN(a) || isNaN(b)) {
                return false;
            }
            return compareNumbers(a, b) == 0;
        }
        if (left instanceof Enum<?> constant && right instanceof String name) {
            return constant.name().equals(name);
        }
        if (left instanceof String name && right instanceof Enum<?> constant) {
            return constant.name().equals(name);
        }
        return Objects.equals(left, right);
    }

    /**
     * Compares two non-null values.
     *
     * @param left  the first value
     * @param right the second value
     * @return a negative, zero or positive value, or {@code null} when the values are not
     *         mutually comparable ({@code NaN} is comparable to nothing)
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static Integer compare(Object left, Object right) {
        if (left == null || right == null) {
            return null;
        }
        if (left instanceof Number a && right instanceof Number b) {
            if (isNaN(a) || isNaN(b)) {
                return null;
            }
            return compareNumbers(a, b);
        }
        if (left instanceof Comparable comparable) {
            if (left.getClass().isInstance(right) || right.getClass().isInstance(left)) {
                try {
                    return comparable.compareTo(right);
                } catch (ClassCastException e) {
                    return null;
                }
            }
        }
        return null;
    }

    /**
     * Total order used for sorting. Values are ranked first: {@code null}, then numbers, then
     * every other type grouped by class name. Numbers compare by value, {@code NaN} last among
     * them; values of one class compare naturally when {@link Comparable}, otherwise by string
     * form.
     *
     * @param left  the first value, may be {@code null}
     * @param right the second value, may be {@code null}
     * @return a negative, zero or positive value
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static int compareForSort(Object left, Object right) {
        int byRank = Integer.compare(rank(left), rank(right));
        if (byRank != 0 || left == null) {
            return byRank;
        }
        if (left instanceof Number a) {
            return compareNumbers(a, (Number) right);
        }
        int byType = left.getClass().getName().compareTo(right.getClass().getName());
        if (byType != 0) {
            return byType;
        }
        if (left instanceof Comparable comparable) {
            try {
                return comparable.compareTo(right);
            } catch (ClassCastException e) {
                return left.toString().compareTo(right.toString());
            }
        }
        return left.toString().compareTo(right.toString());
    }

    private static int rank(Object value) {
        if (value == null) {
            return 0;
        }
        return value instanceof Number ? 1 : 2;
    }

    // -inf < finite values < +inf < NaN; NaN ties with NaN so that sorting stays consistent
    private static int compareNumbers(Number left, Number right) {
        int leftClass = numberClass(left);
        int rightClass = numberClass(right);
        if (leftClass != rightClass || leftClass != 1) {
            return Integer.compare(leftClass, rightClass);
        }
        return toBigDecimal(left).compareTo(toBigDecimal(right));
    }

    private static int numberClass(Number number) {
        if (number instanceof Double || number instanceof Float) {
            double value = number.doubleValue();
            if (Double.isNaN(value)) {
                return 3;
            }
            if (Double.isInfinite(value)) {
                return value > 0 ? 2 : 0;
            }
        }
        return 1;
    }

    private static boolean isNaN(Number number) {
        return numberClass(number) == 3;
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return BigDecimal.valueOf(number.longValue());
    }
}
