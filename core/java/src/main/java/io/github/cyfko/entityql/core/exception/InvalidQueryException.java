package io.github.cyfko.entityql.core.exception;

/**
 * Exception thrown when a query cannot be compiled into a plan, for instance because it has no
 * entity name.
 * <p>
 * Raised by {@code EntityQuery.compile()} before any store interaction.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class InvalidQueryException extends RuntimeException {

    /**
     * @param message the description of the structural defect
     */
    public InvalidQueryException(String message) {
        super(message);
    }
}
