package io.github.cyfko.entityql.core.exception;

import io.github.cyfko.entityql.core.model.QueryOperation;

/**
 * Exception thrown when an operation is requested against a plan whose shape does not support
 * it, such as {@code findOne} or {@code countAll} on a plan carrying a map-reduce stage.
 * <p>
 * Aggregation output is not a single entity and has no defined "first" element, and a count of
 * groups is not defined, so both are rejected before the store is contacted.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class UnsupportedQueryException extends RuntimeException {

    private final QueryOperation operation;

    /**
     * @param operation the operation that was refused
     * @param message   the reason
     */
    public UnsupportedQueryException(QueryOperation operation, String message) {
        super(message);
        this.operation = operation;
    }

    /**
     * @return the operation that was refused
     */
    public QueryOperation getOperation() {
        return operation;
    }
}
