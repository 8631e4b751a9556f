package io.github.cyfko.entityql.core.api;

import io.github.cyfko.entityql.core.exception.InvalidConditionException;
import io.github.cyfko.entityql.core.utils.OperatorValidationUtils;
import io.github.cyfko.entityql.core.utils.ValidationResult;

import java.util.Objects;
import java.util.Set;

/**
 * A single predicate over one entity key: a key, an {@link Op} and an {@link Operand}.
 * <p>
 * The canonical constructor validates the operator/operand pairing eagerly. A {@code Condition}
 * that exists is therefore always well formed, and malformed pairings surface as
 * {@link InvalidConditionException} at the call site that built them.
 * </p>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * Condition adult = Condition.of("age", Op.GTE, 18);
 * Condition active = Condition.of("status", Op.IN, List.of("ACTIVE", "PENDING"));
 * Condition named = Condition.regex("name", "^jo", Set.of(RegexOption.CASE_INSENSITIVE));
 * Condition deleted = Condition.exists("deletedAt");
 * }</pre>
 *
 * @param key      the entity key, never blank
 * @param op       the operator
 * @param operand  the operand, shaped according to {@code op}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Condition(String key, Op op, Operand operand) implements Criterion {

    public Condition {
        if (key == null || key.isBlank()) {
            throw new InvalidConditionException("Condition key cannot be null or blank");
        }
        if (op == null) {
            throw new InvalidConditionException("Condition operator cannot be null for key '" + key + "'");
        }
        ValidationResult result = OperatorValidationUtils.validate(op, operand);
        if (!result.isValid()) {
            throw new InvalidConditionException("Invalid condition on key '" + key + "': " + result.getErrorMessage());
        }
    }

    /**
     * Builds a condition from a loosely typed value, shaping it as the operator requires.
     *
     * @param key   the entity key
     * @param op    the operator
     * @param value the raw value; a collection or array for sequence operators, {@code null}
     *              for existence checks
     * @return the condition
     * @throws InvalidConditionException on an invalid pairing
     */
    public static Condition of(String key, Op op, Object value) {
        if (op == null) {
            throw new InvalidConditionException("Condition operator cannot be null for key '" + key + "'");
        }
        return new Condition(key, op, Operand.forOperator(op, value));
    }

    /**
     * Builds a {@link Op#REGEX} condition.
     *
     * @param key     the entity key
     * @param regex   the expression
     * @param options the matching options, may be empty
     * @return the condition
     * @throws InvalidConditionException if the expression does not compile
     */
    public static Condition regex(String key, String regex, Set<RegexOption> options) {
        return new Condition(key, Op.REGEX, new Operand.Pattern(regex, options));
    }

    /**
     * Builds an {@link Op#EXISTS} condition.
     *
     * @param key the entity key
     * @return the condition
     */
    public static Condition exists(String key) {
        return new Condition(key, Op.EXISTS, Operand.Absent.INSTANCE);
    }

    /**
     * Builds a {@link Op#NOT_EXISTS} condition.
     *
     * @param key the entity key
     * @return the condition
     */
    public static Condition notExists(String key) {
        return new Condition(key, Op.NOT_EXISTS, Operand.Absent.INSTANCE);
    }

    /**
     * Returns the scalar value of this condition.
     *
     * @return the value
     * @throws IllegalStateException if the operand is not a scalar
     */
    public Object scalarValue() {
        if (operand instanceof Operand.Scalar scalar) {
            return scalar.value();
        }
        throw new IllegalStateException("Operator " + op + " does not carry a scalar operand");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return Objects.requireNonNull(visitor, "Visitor cannot be null").visitCondition(this);
    }

    @Override
    public String toString() {
        return switch (op.getArity()) {
            case NONE -> key + " " + op.getSymbol();
            case SCALAR -> key + " " + op.getSymbol() + " " + ((Operand.Scalar) operand).value();
            case SEQUENCE -> key + " " + op.getSymbol() + " " + ((Operand.Sequence) operand).values();
            case PATTERN -> key + " " + op.getSymbol() + " /" + ((Operand.Pattern) operand).regex() + "/"
                    + ((Operand.Pattern) operand).options();
        };
    }
}
