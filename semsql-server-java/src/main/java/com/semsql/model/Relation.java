package com.semsql.model;

import java.util.Objects;

/**
 * A declared join relationship between two tables. The cardinality is expressed from
 * the {@code left} table's point of view.
 */
public final class Relation {
    private final String name;
    private final String left;
    private final String right;
    private final String condition;
    private final Cardinality cardinality;
    private final int ordinal;

    public Relation(String name, String left, String right, String condition, Cardinality cardinality, int ordinal) {
        this.name = Objects.requireNonNull(name, "name");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
        this.condition = Objects.requireNonNull(condition, "condition");
        this.cardinality = Objects.requireNonNull(cardinality, "cardinality");
        this.ordinal = ordinal;
    }

    public String getName() {
        return name;
    }

    public String getLeft() {
        return left;
    }

    public String getRight() {
        return right;
    }

    public String getCondition() {
        return condition;
    }

    public Cardinality getCardinality() {
        return cardinality;
    }

    public int getOrdinal() {
        return ordinal;
    }

    public boolean isSelfRelation() {
        return left.equals(right);
    }

    public boolean touches(String table) {
        return left.equals(table) || right.equals(table);
    }

    public String otherEnd(String table) {
        if (left.equals(table)) {
            return right;
        }
        if (right.equals(table)) {
            return left;
        }
        throw new IllegalArgumentException("Relation " + name + " does not touch table " + table);
    }

    /**
     * Cardinality seen from {@code table}. A self relation is always read from its left side,
     * which is the referencing instance.
     */
    public Cardinality cardinalityFrom(String table) {
        if (left.equals(table)) {
            return cardinality;
        }
        if (right.equals(table)) {
            return cardinality.reverse();
        }
        throw new IllegalArgumentException("Relation " + name + " does not touch table " + table);
    }

    @Override
    public String toString() {
        return name + "[" + left + " " + cardinality.getValue() + " " + right + "]";
    }
}
