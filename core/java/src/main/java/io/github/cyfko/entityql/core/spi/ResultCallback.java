package io.github.cyfko.entityql.core.spi;

/**
 * Continuation receiving the outcome of a background query.
 * <p>
 * Exactly one of {@code result} and {@code error} is meaningful: on success {@code error} is
 * {@code null}; on failure {@code result} is {@code null}. For {@code findOne} and
 * {@code findById} a successful call that matched nothing delivers an empty
 * {@link java.util.Optional}, not an error.
 * </p>
 *
 * @param <T> the result type
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResultCallback<T> {

    void onResult(T result, Throwable error);
}
