package io.github.cyfko.entityql.core.exception;

import io.github.cyfko.entityql.core.model.QueryOperation;

/**
 * Exception raised by an {@link io.github.cyfko.entityql.core.spi.EntityStore} when it fails to
 * evaluate a query.
 * <p>
 * The executor never retries a failed store call. It propagates the failure with the same
 * message and cause, only tagged with the {@link QueryOperation} during which it occurred
 * (see {@link #taggedWith(QueryOperation)}).
 * </p>
 *
 * <pre>{@code
 * try {
 *     List<EntityRecord> users = query.findAll();
 * } catch (StoreException e) {
 *     logger.warning(e.getOperation() + " failed: " + e.getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class StoreException extends RuntimeException {

    private final QueryOperation operation;

    /**
     * Creates a store failure not yet associated with an operation.
     *
     * @param message the description of the failure
     */
    public StoreException(String message) {
        this(message, null, null);
    }

    /**
     * Creates a store failure wrapping the underlying cause.
     *
     * @param message the description of the failure
     * @param cause   the original cause, e.g. a persistence or I/O exception
     */
    public StoreException(String message, Throwable cause) {
        this(message, cause, null);
    }

    private StoreException(String message, Throwable cause, QueryOperation operation) {
        super(message, cause);
        this.operation = operation;
    }

    /**
     * Returns the operation during which the store failed, or {@code null} when the exception
     * has not passed through the executor.
     *
     * @return the failed operation
     */
    public QueryOperation getOperation() {
        return operation;
    }

    /**
     * Returns a copy of this exception tagged with {@code operation}. Message, cause and stack
     * trace are preserved. An exception that already carries a tag is returned unchanged.
     *
     * @param operation the operation that failed
     * @return the tagged exception
     */
    public StoreException taggedWith(QueryOperation operation) {
        if (this.operation != null) {
            return this;
        }
        StoreException tagged = new StoreException(getMessage(), getCause(), operation);
        tagged.setStackTrace(getStackTrace());
        for (Throwable suppressed : getSuppressed()) {
            tagged.addSuppressed(suppressed);
        }
        return tagged;
    }
}
