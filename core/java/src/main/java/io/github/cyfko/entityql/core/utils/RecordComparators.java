package io.github.cyfko.entityql.core.utils;

import io.github.cyfko.entityql.core.model.EntityRecord;
import io.github.cyfko.entityql.core.model.SortBy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Client-side ordering and pagination of records, for stores that cannot do either.
 * <p>
 * Sorting is stable, so records with equal sort keys keep the order in which the store
 * returned them, and repeated calls against the same store state give the same result.
 * Missing keys sort like {@code null}: first in ascending order, last in descending order.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class RecordComparators {

    private RecordComparators() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static Comparator<EntityRecord> of(SortBy order) {
        Objects.requireNonNull(order, "order");
        Comparator<EntityRecord> ascending =
                (left, right) -> ValueComparison.compareForSort(left.get(order.key()), right.get(order.key()));
        return order.isDescending() ? ascending.reversed() : ascending;
    }

    /**
     * Returns a stably sorted copy of {@code records}.
     *
     * @param records the records
     * @param order   the ordering, {@code null} to keep the input order
     * @return the sorted copy
     */
    public static List<EntityRecord> sort(List<EntityRecord> records, SortBy order) {
        List<EntityRecord> copy = new ArrayList<>(records);
        if (order != null) {
            copy.sort(of(order));
        }
        return copy;
    }

    /**
     * Applies skip and limit to an already ordered list.
     *
     * @param records the records
     * @param skip    number of leading records to drop
     * @param limit   maximum number of records kept, 0 for unbounded
     * @return the page, unmodifiable
     */
    public static List<EntityRecord> page(List<EntityRecord> records, int skip, int limit) {
        int from = Math.min(skip, records.size());
        int to = limit == 0 ? records.size() : (int) Math.min((long) from + limit, records.size());
        return Collections.unmodifiableList(new ArrayList<>(records.subList(from, to)));
    }
}
