package io.github.cyfko.entityql.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable key/value view of a raw record returned by an entity store.
 * <p>
 * Records are schemaless: any key may be present or missing, and a present key may hold
 * {@code null}. {@link #containsKey(String)} distinguishes the two cases, which matters for
 * {@code EXISTS}/{@code NOT_EXISTS} conditions. Attribute order is preserved.
 * </p>
 *
 * <pre>{@code
 * EntityRecord user = EntityRecord.of(Map.of("id", 1, "name", "Alice"));
 * String name = (String) user.get("name");
 * }</pre>
 *
 * @param attributes the record attributes, unmodifiable
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record EntityRecord(Map<String, Object> attributes) {

    public EntityRecord {
        Objects.requireNonNull(attributes, "Record attributes cannot be null");
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * Creates a record from a map of attributes. The map is copied.
     *
     * @param attributes the attributes
     * @return the record
     */
    public static EntityRecord of(Map<String, ?> attributes) {
        return new EntityRecord(new LinkedHashMap<>(attributes));
    }

    /**
     * @param key the attribute key
     * @return the value, or {@code null} when missing or null
     */
    public Object get(String key) {
        return attributes.get(key);
    }

    /**
     * @param key the attribute key
     * @return {@code true} when the key is present, even with a {@code null} value
     */
    public boolean containsKey(String key) {
        return attributes.containsKey(key);
    }

    /**
     * @return the unmodifiable attribute map
     */
    public Map<String, Object> asMap() {
        return attributes;
    }
}
