package io.github.cyfko.entityql.core.api;

/**
 * Tagged reference to one group of a query under construction.
 * <p>
 * A handle does not hold conditions itself: it names a node of the owning {@link QueryTree},
 * and every call appends to that node. Handles stay usable until the owning query is reset;
 * after that any call throws {@link IllegalStateException}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class GroupHandle implements QueryConditions {

    private final QueryTree tree;
    private final int index;
    private final int generation;

    GroupHandle(QueryTree tree, int index, int generation) {
        this.tree = tree;
        this.index = index;
        this.generation = generation;
    }

    @Override
    public void where(Condition condition) {
        tree.append(this, condition);
    }

    @Override
    public GroupHandle or() {
        return tree.open(this, ConditionGroup.Mode.OR);
    }

    @Override
    public GroupHandle and() {
        return tree.open(this, ConditionGroup.Mode.AND);
    }

    /**
     * @return {@code false} once the owning query has been reset
     */
    public boolean isValid() {
        return tree.isCurrent(this);
    }

    QueryTree tree() {
        return tree;
    }

    int index() {
        return index;
    }

    int generation() {
        return generation;
    }

    @Override
    public String toString() {
        return "GroupHandle[node=" + index + ", generation=" + generation + "]";
    }
}
