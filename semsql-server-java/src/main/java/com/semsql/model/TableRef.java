package com.semsql.model;

import java.util.Objects;

/**
 * One instance of a table inside a plan. The primary instance has no role; further
 * instances of the same table carry the name of the relation they are joined through.
 */
public final class TableRef {
    private final String table;
    private final String role;

    public TableRef(String table, String role) {
        this.table = Objects.requireNonNull(table, "table");
        this.role = role;
    }

    public static TableRef of(String table) {
        return new TableRef(table, null);
    }

    public String getTable() {
        return table;
    }

    public String getRole() {
        return role;
    }

    public boolean isPrimary() {
        return role == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TableRef)) {
            return false;
        }
        TableRef other = (TableRef) o;
        return table.equals(other.table) && Objects.equals(role, other.role);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table, role);
    }

    @Override
    public String toString() {
        return role == null ? table : table + "@" + role;
    }
}
