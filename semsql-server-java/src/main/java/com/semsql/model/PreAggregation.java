package com.semsql.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Derived table replacing the "many" side of a fan-out join: the subtree is grouped by the
 * join key so each in-scope row matches at most one derived row.
 */
public final class PreAggregation {
    private final String table;
    private final String alias;
    private final List<String> keyColumns;
    private final List<SelectItem> aggregates;
    private final List<CompiledJoinStep> joins;
    private final List<String> filters;

    public PreAggregation(String table, String alias, List<String> keyColumns, List<SelectItem> aggregates,
                          List<CompiledJoinStep> joins, List<String> filters) {
        this.table = Objects.requireNonNull(table, "table");
        this.alias = Objects.requireNonNull(alias, "alias");
        this.keyColumns = List.copyOf(keyColumns);
        this.aggregates = List.copyOf(aggregates);
        this.joins = List.copyOf(joins);
        this.filters = List.copyOf(filters);
    }

    public String getTable() {
        return table;
    }

    public String getAlias() {
        return alias;
    }

    @JsonProperty("key_columns")
    public List<String> getKeyColumns() {
        return keyColumns;
    }

    public List<SelectItem> getAggregates() {
        return aggregates;
    }

    public List<CompiledJoinStep> getJoins() {
        return joins;
    }

    public List<String> getFilters() {
        return filters;
    }
}
