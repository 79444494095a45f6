package com.semsql.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Strict, immutable form of what a query asks for. Built once per question by the planning
 * layer; the compiler never modifies it.
 */
public final class SemanticQueryIntent {
    private final List<MetricIntent> metrics;
    private final List<DimensionIntent> dimensionIntents;
    private final List<FilterPredicate> filters;
    private final List<OrderSpec> orderBy;
    private final Integer limit;

    public SemanticQueryIntent(List<MetricIntent> metrics, List<DimensionIntent> dimensionIntents,
                               List<FilterPredicate> filters, List<OrderSpec> orderBy, Integer limit) {
        if (metrics == null || metrics.isEmpty()) {
            throw new IllegalArgumentException("At least one metric is required");
        }
        this.metrics = List.copyOf(metrics);
        this.dimensionIntents = dimensionIntents == null ? List.of() : List.copyOf(dimensionIntents);
        this.filters = filters == null ? List.of() : List.copyOf(filters);
        this.orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
        this.limit = limit;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<MetricIntent> getMetrics() {
        return metrics;
    }

    public List<DimensionIntent> getDimensionIntents() {
        return dimensionIntents;
    }

    public List<FilterPredicate> getFilters() {
        return filters;
    }

    public List<OrderSpec> getOrderBy() {
        return orderBy;
    }

    public Integer getLimit() {
        return limit;
    }

    /**
     * The table owning the first requested metric; it defines the row granularity.
     */
    public String grainTable() {
        return metrics.get(0).getTable();
    }

    @Override
    public String toString() {
        return "SemanticQueryIntent{metrics=" + metrics + ", dimensions=" + dimensionIntents
            + ", filters=" + filters + ", limit=" + limit + "}";
    }

    public static final class Builder {
        private final List<MetricIntent> metrics = new ArrayList<>();
        private final List<DimensionIntent> dimensionIntents = new ArrayList<>();
        private final List<FilterPredicate> filters = new ArrayList<>();
        private final List<OrderSpec> orderBy = new ArrayList<>();
        private Integer limit;

        private Builder() {
        }

        public Builder metric(MetricIntent metric) {
            metrics.add(metric);
            return this;
        }

        public Builder dimension(DimensionIntent dimension) {
            dimensionIntents.add(dimension);
            return this;
        }

        public Builder filter(FilterPredicate filter) {
            filters.add(filter);
            return this;
        }

        public Builder orderBy(OrderSpec order) {
            orderBy.add(order);
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public SemanticQueryIntent build() {
            return new SemanticQueryIntent(metrics, dimensionIntents, filters, orderBy, limit);
        }
    }
}
