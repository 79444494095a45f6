package com.semsql.model;

import java.util.Objects;

/**
 * A requested aggregate, bound to one base table.
 */
public final class MetricIntent {
    public static final String ALL_ROWS = "*";

    private final String name;
    private final String table;
    private final String column;
    private final Aggregation aggregation;

    public MetricIntent(String name, String table, String column, Aggregation aggregation) {
        this.name = Objects.requireNonNull(name, "name");
        this.table = Objects.requireNonNull(table, "table");
        this.column = Objects.requireNonNull(column, "column");
        this.aggregation = Objects.requireNonNull(aggregation, "aggregation");
    }

    public static MetricIntent sum(String name, String table, String column) {
        return new MetricIntent(name, table, column, Aggregation.SUM);
    }

    public static MetricIntent count(String name, String table) {
        return new MetricIntent(name, table, ALL_ROWS, Aggregation.COUNT);
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

    public Aggregation getAggregation() {
        return aggregation;
    }

    public boolean countsAllRows() {
        return ALL_ROWS.equals(column);
    }

    @Override
    public String toString() {
        return name + "=" + aggregation.render(table + "." + column);
    }
}
