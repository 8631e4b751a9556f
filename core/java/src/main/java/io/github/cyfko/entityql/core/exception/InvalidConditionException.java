package io.github.cyfko.entityql.core.exception;

/**
 * Exception thrown when a condition cannot be constructed because its operator and operand
 * do not fit together.
 * <p>
 * This exception is always raised synchronously, at the moment the condition is built, whether
 * the query is later executed inline or in the background. Construction is never deferred.
 * </p>
 *
 * <p><strong>Common Scenarios:</strong></p>
 * <ul>
 *   <li>{@code IN}, {@code NOT_IN} or {@code CONTAINS_ALL} with a scalar or an empty collection</li>
 *   <li>{@code REGEX} with a malformed expression</li>
 *   <li>{@code LT}/{@code GT} family with a {@code null} or non-comparable value</li>
 *   <li>{@code HAS_PREFIX}, {@code HAS_SUFFIX}, {@code CONTAINS} with a non-string value</li>
 *   <li>{@code EXISTS}/{@code NOT_EXISTS} given an operand</li>
 * </ul>
 *
 * <pre>{@code
 * try {
 *     query.whereKeyContainedIn("status", List.of());
 * } catch (InvalidConditionException e) {
 *     logger.warning("Rejected condition: " + e.getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class InvalidConditionException extends RuntimeException {

    /**
     * Creates an exception with an explanatory message.
     *
     * @param message the description of the malformed pairing
     */
    public InvalidConditionException(String message) {
        super(message);
    }

    /**
     * Creates an exception with an explanatory message and an underlying cause.
     *
     * @param message the description of the malformed pairing
     * @param cause   the original cause, e.g. a {@link java.util.regex.PatternSyntaxException}
     */
    public InvalidConditionException(String message, Throwable cause) {
        super(message, cause);
    }
}
