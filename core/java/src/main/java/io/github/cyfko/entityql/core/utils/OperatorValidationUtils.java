package io.github.cyfko.entityql.core.utils;

import io.github.cyfko.entityql.core.api.Op;
import io.github.cyfko.entityql.core.api.Operand;

/**
 * Static checks of operator/operand pairings.
 * <p>
 * Centralizes the rules enforced when a {@link io.github.cyfko.entityql.core.api.Condition} is
 * constructed:
 * </p>
 * <ul>
 *     <li>the operand shape matches the operator arity</li>
 *     <li>{@code LT}, {@code LTE}, {@code GT}, {@code GTE} need a non-null {@link Comparable}</li>
 *     <li>{@code CONTAINS}, {@code HAS_PREFIX}, {@code HAS_SUFFIX} need a non-empty string</li>
 *     <li>{@code null} scalars are only meaningful for {@code EQ} and {@code NE}</li>
 * </ul>
 * <p>Stateless and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class OperatorValidationUtils {

    private OperatorValidationUtils() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Validates that {@code operand} is acceptable for {@code op}.
     *
     * @param op      the operator
     * @param operand the operand
     * @return the validation outcome
     */
    public static ValidationResult validate(Op op, Operand operand) {
        if (op == null) {
            return ValidationResult.failure("Operator cannot be null");
        }
        if (operand == null) {
            return ValidationResult.failure("Operand cannot be null for operator " + op);
        }
        if (operand.arity() != op.getArity()) {
            return ValidationResult.failure(String.format(
                    "Operator %s expects a %s operand, got %s", op, op.getArity(), operand.arity()));
        }
        if (operand instanceof Operand.Scalar scalar) {
            return validateScalar(op, scalar.value());
        }
        return ValidationResult.success();
    }

    private static ValidationResult validateScalar(Op op, Object value) {
        if (op.isRangeComparison()) {
            if (value == null) {
                return ValidationResult.failure("Operator " + op + " requires a non-null value");
            }
            if (!(value instanceof Comparable<?>)) {
                return ValidationResult.failure(String.format(
                        "Operator %s requires a comparable value, got %s", op, value.getClass().getSimpleName()));
            }
        }
        if (op.isTextMatch()) {
            if (!(value instanceof String text)) {
                return ValidationResult.failure(String.format(
                        "Operator %s requires a string value, got %s", op,
                        value == null ? "null" : value.getClass().getSimpleName()));
            }
            if (text.isEmpty()) {
                return ValidationResult.failure("Operator " + op + " requires a non-empty string");
            }
        }
        return ValidationResult.success();
    }
}
