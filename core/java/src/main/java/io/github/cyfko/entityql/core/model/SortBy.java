package io.github.cyfko.entityql.core.model;

import java.util.Objects;

/**
 * Single-key ordering of a query.
 *
 * @param key       the entity key to sort on
 * @param direction the sort direction
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record SortBy(String key, Direction direction) {

    /**
     * Sort direction.
     */
    public enum Direction {
        ASC,
        DESC
    }

    public SortBy {
        Objects.requireNonNull(key, "Sort key cannot be null");
        Objects.requireNonNull(direction, "Sort direction cannot be null");
        if (key.isBlank()) {
            throw new IllegalArgumentException("Sort key cannot be blank");
        }
    }

    public static SortBy ascending(String key) {
        return new SortBy(key, Direction.ASC);
    }

    public static SortBy descending(String key) {
        return new SortBy(key, Direction.DESC);
    }

    public boolean isDescending() {
        return direction == Direction.DESC;
    }
}
