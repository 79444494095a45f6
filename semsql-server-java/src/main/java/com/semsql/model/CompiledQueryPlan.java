package com.semsql.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Everything the serializer needs to print one statement. Built fresh for every compilation.
 */
public final class CompiledQueryPlan {
    private final String grainTable;
    private final String grainAlias;
    private final List<SelectItem> selectItems;
    private final List<CompiledJoinStep> joinSteps;
    private final List<String> wherePredicates;
    private final List<String> groupBy;
    private final List<String> orderBy;
    private final Integer limit;
    private final List<FanOutMarker> fanOutMarkers;

    public CompiledQueryPlan(String grainTable, String grainAlias, List<SelectItem> selectItems,
                             List<CompiledJoinStep> joinSteps, List<String> wherePredicates, List<String> groupBy,
                             List<String> orderBy, Integer limit, List<FanOutMarker> fanOutMarkers) {
        this.grainTable = Objects.requireNonNull(grainTable, "grainTable");
        this.grainAlias = Objects.requireNonNull(grainAlias, "grainAlias");
        this.selectItems = List.copyOf(selectItems);
        this.joinSteps = List.copyOf(joinSteps);
        this.wherePredicates = List.copyOf(wherePredicates);
        this.groupBy = List.copyOf(groupBy);
        this.orderBy = List.copyOf(orderBy);
        this.limit = limit;
        this.fanOutMarkers = List.copyOf(fanOutMarkers);
    }

    @JsonProperty("grain_table")
    public String getGrainTable() {
        return grainTable;
    }

    @JsonProperty("grain_alias")
    public String getGrainAlias() {
        return grainAlias;
    }

    @JsonProperty("select")
    public List<SelectItem> getSelectItems() {
        return selectItems;
    }

    @JsonProperty("joins")
    public List<CompiledJoinStep> getJoinSteps() {
        return joinSteps;
    }

    @JsonProperty("where")
    public List<String> getWherePredicates() {
        return wherePredicates;
    }

    @JsonProperty("group_by")
    public List<String> getGroupBy() {
        return groupBy;
    }

    @JsonProperty("order_by")
    public List<String> getOrderBy() {
        return orderBy;
    }

    public Integer getLimit() {
        return limit;
    }

    @JsonProperty("fan_out_markers")
    public List<FanOutMarker> getFanOutMarkers() {
        return fanOutMarkers;
    }
}
