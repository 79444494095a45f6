package com.semsql.model;

/**
 * A metric attached to the table instance that computes it.
 */
public final class MetricBinding {
    private final MetricIntent metric;
    private final TableRef instance;
    private final String column;

    public MetricBinding(MetricIntent metric, TableRef instance, String column) {
        this.metric = metric;
        this.instance = instance;
        this.column = column;
    }

    public MetricIntent getMetric() {
        return metric;
    }

    public TableRef getInstance() {
        return instance;
    }

    /**
     * Declared spelling of the aggregated column, or {@link MetricIntent#ALL_ROWS}.
     */
    public String getColumn() {
        return column;
    }

    public String getName() {
        return metric.getName();
    }

    public Aggregation getAggregation() {
        return metric.getAggregation();
    }

    public String argument(String alias) {
        return metric.countsAllRows() ? MetricIntent.ALL_ROWS : alias + "." + column;
    }
}
