package io.github.cyfko.entityql.core.cache;

import io.github.cyfko.entityql.core.model.EntityRecord;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Result set stored under a plan fingerprint. Entries are never mutated: a newer result for
 * the same fingerprint replaces the whole entry.
 *
 * @param fingerprint the fingerprint of the plan that produced the records
 * @param entityName  the queried collection, used for per-entity invalidation
 * @param records     the records, or the raw aggregation rows before any result processor, unmodifiable
 * @param storedAt    when the entry was created
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CacheEntry(String fingerprint, String entityName, List<EntityRecord> records, Instant storedAt) {

    public CacheEntry {
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(entityName, "entityName");
        Objects.requireNonNull(storedAt, "storedAt");
        records = List.copyOf(records);
    }
}
