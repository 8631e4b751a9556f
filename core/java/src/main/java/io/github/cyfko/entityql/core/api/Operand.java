package io.github.cyfko.entityql.core.api;

import io.github.cyfko.entityql.core.exception.InvalidConditionException;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Closed tagged value carried by a {@link Condition}.
 * <p>
 * Every operator accepts exactly one operand shape (see {@link Op.Arity}):
 * </p>
 * <ul>
 *   <li>{@link Scalar} for comparisons and text matches</li>
 *   <li>{@link Sequence} for {@code IN}, {@code NOT_IN} and {@code CONTAINS_ALL}</li>
 *   <li>{@link Pattern} for {@code REGEX}</li>
 *   <li>{@link Absent} for {@code EXISTS} and {@code NOT_EXISTS}</li>
 * </ul>
 * <p>
 * Operands are immutable value objects: two operands built from equal inputs are equal, which
 * is what makes compiled plans comparable.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface Operand {

    /**
     * @return the arity this operand satisfies
     */
    Op.Arity arity();

    /**
     * Builds the operand matching the arity of {@code op} from a loosely typed value.
     * <p>
     * Collections and arrays become a {@link Sequence}; any other value becomes a
     * {@link Scalar}. Operators without operand require {@code value} to be {@code null}.
     * </p>
     *
     * @param op    the operator the operand is meant for
     * @param value the raw value
     * @return the operand
     * @throws InvalidConditionException if the value cannot take the shape the operator needs
     */
    static Operand forOperator(Op op, Object value) {
        Objects.requireNonNull(op, "Operator cannot be null");
        switch (op.getArity()) {
            case NONE:
                if (value != null) {
                    throw new InvalidConditionException("Operator " + op + " does not accept an operand, got: " + value);
                }
                return Absent.INSTANCE;
            case SEQUENCE:
                return Sequence.of(value);
            case PATTERN:
                if (value instanceof Pattern pattern) {
                    return pattern;
                }
                if (value instanceof CharSequence regex) {
                    return new Pattern(regex.toString(), Set.of());
                }
                throw new InvalidConditionException("Operator " + op + " requires a regular expression, got: " + describe(value));
            default:
                if (value instanceof Operand operand) {
                    return operand;
                }
                return new Scalar(value);
        }
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    /**
     * A single value. {@code null} is allowed here and restricted per operator by
     * {@link Condition}.
     *
     * @param value the value, a string, number, boolean, character, enum, temporal or UUID
     */
    record Scalar(Object value) implements Operand {
        public Scalar {
            if (value instanceof CharSequence chars && !(value instanceof String)) {
                value = chars.toString();
            }
            if (value instanceof Collection<?> || value instanceof Map<?, ?> || value instanceof Operand
                    || (value != null && value.getClass().isArray())) {
                throw new InvalidConditionException("A scalar operand cannot be a " + describe(value));
            }
        }

        @Override
        public Op.Arity arity() {
            return Op.Arity.SCALAR;
        }
    }

    /**
     * A non-empty ordered sequence of scalar values.
     *
     * @param values the values, unmodifiable
     */
    record Sequence(List<Object> values) implements Operand {
        public Sequence {
            if (values == null || values.isEmpty()) {
                throw new InvalidConditionException("A sequence operand requires at least one value");
            }
            List<Object> copy = new ArrayList<>(values.size());
            for (Object element : values) {
                copy.add(new Scalar(element).value());
            }
            values = Collections.unmodifiableList(copy);
        }

        /**
         * Builds a sequence from a collection or an array.
         *
         * @param value a {@link Collection}, an array or an existing sequence
         * @return the sequence
         * @throws InvalidConditionException when {@code value} is neither
         */
        public static Sequence of(Object value) {
            if (value instanceof Sequence sequence) {
                return sequence;
            }
            if (value instanceof Collection<?> collection) {
                return new Sequence(new ArrayList<>(collection));
            }
            if (value != null && value.getClass().isArray()) {
                int length = Array.getLength(value);
                List<Object> elements = new ArrayList<>(length);
                for (int i = 0; i < length; i++) {
                    elements.add(Array.get(value, i));
                }
                return new Sequence(elements);
            }
            throw new InvalidConditionException("Expected a collection or an array, got: " + describe(value));
        }

        @Override
        public Op.Arity arity() {
            return Op.Arity.SEQUENCE;
        }
    }

    /**
     * A regular expression. The expression must compile with the given options.
     *
     * @param regex   the expression source
     * @param options the matching options, unmodifiable
     */
    record Pattern(String regex, Set<RegexOption> options) implements Operand {
        public Pattern {
            if (regex == null) {
                throw new InvalidConditionException("A regular expression operand cannot be null");
            }
            options = options == null || options.isEmpty()
                    ? Collections.unmodifiableSet(EnumSet.noneOf(RegexOption.class))
                    : Collections.unmodifiableSet(EnumSet.copyOf(options));
            try {
                java.util.regex.Pattern.compile(regex, RegexOption.toPatternFlags(options));
            } catch (java.util.regex.PatternSyntaxException e) {
                throw new InvalidConditionException("Malformed regular expression '" + regex + "': " + e.getDescription(), e);
            }
        }

        /**
         * Compiles this operand into a {@link java.util.regex.Pattern}.
         *
         * @return a compiled pattern
         */
        public java.util.regex.Pattern compile() {
            return java.util.regex.Pattern.compile(regex, RegexOption.toPatternFlags(options));
        }

        @Override
        public Op.Arity arity() {
            return Op.Arity.PATTERN;
        }
    }

    /**
     * The operand of existence checks.
     */
    enum Absent implements Operand {
        INSTANCE;

        @Override
        public Op.Arity arity() {
            return Op.Arity.NONE;
        }
    }
}
