package io.github.cyfko.entityql.core.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Arena owning the group nodes of a query under construction.
 * <p>
 * Node 0 is the root conjunction. Every {@link GroupHandle} is a reference to one node,
 * tagged with the generation of the arena it was issued in; {@link #clear()} starts a new
 * generation, after which older handles are rejected.
 * </p>
 * <p>
 * A node composes as {@code conditions AND (orBranch[0] OR orBranch[1] ...) AND andGroup[0]
 * AND andGroup[1] ...}. Branches and sub-groups without any condition contribute nothing.
 * </p>
 * <p>Not thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class QueryTree {

    private static final int ROOT = 0;

    private final List<Node> nodes = new ArrayList<>();
    private int generation;

    public QueryTree() {
        nodes.add(new Node());
    }

    /**
     * @return a handle on the root conjunction for the current generation
     */
    public GroupHandle root() {
        return new GroupHandle(this, ROOT, generation);
    }

    /**
     * Drops every node and invalidates all handles issued so far.
     */
    public void clear() {
        nodes.clear();
        nodes.add(new Node());
        generation++;
    }

    /**
     * Composes an immutable copy of the whole tree.
     *
     * @return the root conjunction
     */
    public ConditionGroup compose() {
        ConditionGroup root = compose(ROOT);
        return root == null ? ConditionGroup.matchAll() : root;
    }

    void append(GroupHandle handle, Condition condition) {
        Objects.requireNonNull(condition, "Condition cannot be null");
        node(handle).conditions.add(condition);
    }

    GroupHandle open(GroupHandle parent, ConditionGroup.Mode mode) {
        Node owner = node(parent);
        int index = nodes.size();
        nodes.add(new Node());
        if (mode == ConditionGroup.Mode.OR) {
            owner.orBranches.add(index);
        } else {
            owner.andGroups.add(index);
        }
        return new GroupHandle(this, index, generation);
    }

    boolean isCurrent(GroupHandle handle) {
        return handle.generation() == generation && handle.index() < nodes.size();
    }

    private Node node(GroupHandle handle) {
        if (handle.tree() != this) {
            throw new IllegalArgumentException("Group handle belongs to another query");
        }
        if (!isCurrent(handle)) {
            throw new IllegalStateException("Group handle is stale: the query was reset after it was obtained");
        }
        return nodes.get(handle.index());
    }

    // null when the node holds no condition at any depth
    private ConditionGroup compose(int index) {
        Node node = nodes.get(index);
        List<Criterion> members = new ArrayList<>(node.conditions);

        List<Criterion> branches = new ArrayList<>();
        for (int branch : node.orBranches) {
            ConditionGroup composed = compose(branch);
            if (composed != null) {
                branches.add(composed);
            }
        }
        if (!branches.isEmpty()) {
            members.add(ConditionGroup.or(branches));
        }

        for (int group : node.andGroups) {
            ConditionGroup composed = compose(group);
            if (composed != null) {
                members.add(composed);
            }
        }
        return members.isEmpty() ? null : ConditionGroup.and(members);
    }

    private static final class Node {
        final List<Condition> conditions = new ArrayList<>();
        final List<Integer> orBranches = new ArrayList<>();
        final List<Integer> andGroups = new ArrayList<>();
    }
}
