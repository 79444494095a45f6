package com.semsql.model;

import java.util.Objects;

/**
 * One edge of a resolved join path: {@code child} is joined to the already reached {@code parent}
 * through {@code relation}.
 */
public final class PathStep {
    private final Relation relation;
    private final TableRef parent;
    private final TableRef child;
    private final int depth;

    public PathStep(Relation relation, TableRef parent, TableRef child, int depth) {
        this.relation = Objects.requireNonNull(relation, "relation");
        this.parent = Objects.requireNonNull(parent, "parent");
        this.child = Objects.requireNonNull(child, "child");
        this.depth = depth;
    }

    public Relation getRelation() {
        return relation;
    }

    public TableRef getParent() {
        return parent;
    }

    public TableRef getChild() {
        return child;
    }

    /**
     * Number of edges between the grain table and {@code child}.
     */
    public int getDepth() {
        return depth;
    }

    /**
     * Cardinality read from the parent side, i.e. how many child rows one parent row can match.
     */
    public Cardinality cardinality() {
        return relation.cardinalityFrom(parent.getTable());
    }

    @Override
    public String toString() {
        return parent + " -[" + relation.getName() + "]-> " + child;
    }
}
