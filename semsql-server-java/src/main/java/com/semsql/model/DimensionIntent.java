package com.semsql.model;

import java.util.Objects;

/**
 * How one dimension takes part in a query.
 * <p>
 * {@code usage} is {@code null} when the planner sent a usage hint outside the known values.
 * {@code role} names the relation through which the table is reached when the same table
 * plays several roles (for example an order date and a ship date on one date table).
 */
public final class DimensionIntent {
    private final String name;
    private final String table;
    private final String column;
    private final DimensionUsage usage;
    private final boolean optional;
    private final String role;

    public DimensionIntent(String name, String table, String column, DimensionUsage usage, boolean optional, String role) {
        this.name = Objects.requireNonNull(name, "name");
        this.table = Objects.requireNonNull(table, "table");
        this.column = column == null ? name : column;
        this.usage = usage;
        this.optional = optional;
        this.role = role;
    }

    public static DimensionIntent filter(String name, String table) {
        return new DimensionIntent(name, table, name, DimensionUsage.FILTER, false, null);
    }

    public static DimensionIntent select(String name, String table, boolean optional) {
        return new DimensionIntent(name, table, name, DimensionUsage.SELECT, optional, null);
    }

    public static DimensionIntent both(String name, String table) {
        return new DimensionIntent(name, table, name, DimensionUsage.BOTH, false, null);
    }

    public String getName() {
        return name;
    }

    public String getTable() {
        return table;
    }

    public String getColumn() {
        return column;
    }

    public DimensionUsage getUsage() {
        return usage;
    }

    public boolean isOptional() {
        return optional;
    }

    public String getRole() {
        return role;
    }

    /**
     * Filter-only dimensions restrict rows but are not projected.
     */
    public boolean isSelected() {
        return usage != DimensionUsage.FILTER;
    }

    @Override
    public String toString() {
        return name + "(" + table + "." + column + ", " + (usage == null ? "?" : usage.getValue())
            + (optional ? ", optional" : "") + (role == null ? "" : ", role=" + role) + ")";
    }
}
