package io.github.cyfko.entityql.core.api;

/**
 * Enumeration of supported condition operators.
 * <p>
 * Each operator defines a short code and the shape of operand it accepts. The operand shape is
 * enforced when a {@link Condition} is constructed, so a condition that exists is always
 * well formed.
 * </p>
 *
 * <p><strong>Operator Categories:</strong></p>
 *
 * <p><em>Comparison Operators</em> (single value):</p>
 * <pre>{@code
 * user.age == 25          -> Op.EQ
 * user.status != ACTIVE   -> Op.NE
 * user.age > 18           -> Op.GT
 * user.age >= 21          -> Op.GTE
 * user.salary < 50000     -> Op.LT
 * user.experience <= 5    -> Op.LTE
 * }</pre>
 *
 * <p><em>Membership Operators</em> (non-empty sequence):</p>
 * <pre>{@code
 * user.status IN ('ACTIVE', 'PENDING')       -> Op.IN
 * user.role NOT IN ('ADMIN', 'MODERATOR')    -> Op.NOT_IN
 * user.tags CONTAINS ALL ('java', 'jpa')     -> Op.CONTAINS_ALL
 * }</pre>
 *
 * <p><em>Text Matching</em>:</p>
 * <pre>{@code
 * user.name ~ /^jo.*$/i     -> Op.REGEX
 * user.name CONTAINS 'oh'   -> Op.CONTAINS
 * user.name STARTS 'Jo'     -> Op.HAS_PREFIX
 * user.email ENDS '.org'    -> Op.HAS_SUFFIX
 * }</pre>
 *
 * <p><em>Existence Checks</em> (no operand):</p>
 * <pre>{@code
 * user.deletedAt EXISTS        -> Op.EXISTS
 * user.deletedAt NOT EXISTS    -> Op.NOT_EXISTS
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Op {

    /** Equality operator: "=" */
    EQ("=", Arity.SCALAR),

    /** Not equal operator: "!=" */
    NE("!=", Arity.SCALAR),

    /** Less than operator: "&lt;" */
    LT("<", Arity.SCALAR),

    /** Less than or equal operator: "&lt;=" */
    LTE("<=", Arity.SCALAR),

    /** Greater than operator: "&gt;" */
    GT(">", Arity.SCALAR),

    /** Greater than or equal operator: "&gt;=" */
    GTE(">=", Arity.SCALAR),

    /** Inclusion operator: the key value must be one of the operand values. */
    IN("IN", Arity.SEQUENCE),

    /** Negated inclusion operator. */
    NOT_IN("NOT IN", Arity.SEQUENCE),

    /** The key value (a collection) must contain every operand value. */
    CONTAINS_ALL("ALL", Arity.SEQUENCE),

    /** Regular expression match, with optional {@link RegexOption}s. */
    REGEX("~", Arity.PATTERN),

    /** Substring match. */
    CONTAINS("CONTAINS", Arity.SCALAR),

    /** Prefix match. */
    HAS_PREFIX("STARTS", Arity.SCALAR),

    /** Suffix match. */
    HAS_SUFFIX("ENDS", Arity.SCALAR),

    /** The key is present on the entity. */
    EXISTS("EXISTS", Arity.NONE),

    /** The key is absent from the entity. */
    NOT_EXISTS("NOT EXISTS", Arity.NONE);

    /**
     * Shape of the operand an operator accepts.
     */
    public enum Arity {
        /** A single value. */
        SCALAR,
        /** A non-empty ordered sequence of values. */
        SEQUENCE,
        /** A regular expression with options. */
        PATTERN,
        /** No operand at all. */
        NONE
    }

    private final String symbol;
    private final Arity arity;

    Op(String symbol, Arity arity) {
        this.symbol = symbol;
        this.arity = arity;
    }

    /**
     * Returns the display symbol of the operator, e.g. "=", "IN", "~".
     *
     * @return the symbol representing the operator
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * Returns the operand shape accepted by this operator.
     *
     * @return the operator arity
     */
    public Arity getArity() {
        return arity;
    }

    /**
     * Indicates whether this operator requires an operand.
     *
     * @return {@code false} for {@link #EXISTS} and {@link #NOT_EXISTS}
     */
    public boolean requiresValue() {
        return arity != Arity.NONE;
    }

    /**
     * Indicates whether this operator is an ordering comparison ({@code LT}, {@code LTE},
     * {@code GT}, {@code GTE}), which needs a non-null comparable operand.
     *
     * @return {@code true} for range comparisons
     */
    public boolean isRangeComparison() {
        return this == LT || this == LTE || this == GT || this == GTE;
    }

    /**
     * Indicates whether this operator matches text and therefore needs a string operand.
     *
     * @return {@code true} for {@link #CONTAINS}, {@link #HAS_PREFIX} and {@link #HAS_SUFFIX}
     */
    public boolean isTextMatch() {
        return this == CONTAINS || this == HAS_PREFIX || this == HAS_SUFFIX;
    }

    /**
     * Finds an {@code Op} by its name or symbol, ignoring case.
     *
     * @param value name or symbol to search for
     * @return matching {@code Op}
     * @throws NullPointerException     if {@code value} is {@code null}
     * @throws IllegalArgumentException if no operator matches
     */
    public static Op fromString(String value) {
        String trimmed = value.trim();
        for (Op op : values()) {
            if (op.name().equalsIgnoreCase(trimmed) || op.symbol.equalsIgnoreCase(trimmed)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown operator: " + value);
    }
}
