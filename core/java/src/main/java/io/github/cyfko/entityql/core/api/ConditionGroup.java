package io.github.cyfko.entityql.core.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Logical combination of {@link Criterion} members.
 * <p>
 * Members are evaluated with the group's {@link Mode}. An empty {@code AND} group is vacuously
 * true and an empty {@code OR} group is vacuously false. Member order is kept as declared.
 * Groups are immutable: the member list is copied on construction.
 * </p>
 *
 * <pre>{@code
 * // status = 'ACTIVE' AND (age >= 18 OR guardian EXISTS)
 * ConditionGroup predicate = ConditionGroup.and(List.of(
 *     Condition.of("status", Op.EQ, "ACTIVE"),
 *     ConditionGroup.or(List.of(
 *         Condition.of("age", Op.GTE, 18),
 *         Condition.exists("guardian")))));
 * }</pre>
 *
 * @param mode    how members combine
 * @param members the members, unmodifiable
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ConditionGroup(Mode mode, List<Criterion> members) implements Criterion {

    /**
     * Logical connective of a group.
     */
    public enum Mode {
        AND,
        OR
    }

    public ConditionGroup {
        Objects.requireNonNull(mode, "Group mode cannot be null");
        Objects.requireNonNull(members, "Group members cannot be null");
        List<Criterion> copy = new ArrayList<>(members);
        if (copy.contains(null)) {
            throw new NullPointerException("Group members cannot contain null");
        }
        members = Collections.unmodifiableList(copy);
    }

    public static ConditionGroup and(List<? extends Criterion> members) {
        return new ConditionGroup(Mode.AND, new ArrayList<>(members));
    }

    public static ConditionGroup or(List<? extends Criterion> members) {
        return new ConditionGroup(Mode.OR, new ArrayList<>(members));
    }

    /**
     * @return an empty {@code AND} group, matching every entity
     */
    public static ConditionGroup matchAll() {
        return new ConditionGroup(Mode.AND, List.of());
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return Objects.requireNonNull(visitor, "Visitor cannot be null").visitGroup(this);
    }

    @Override
    public String toString() {
        return mode + members.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
