package com.semsql.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Records a join that would have multiplied grain rows and how it was neutralized.
 */
public final class FanOutMarker {
    public static final String PRE_AGGREGATE = "PRE_AGGREGATE";

    private final String relation;
    private final String parentTable;
    private final String table;
    private final String alias;
    private final Cardinality cardinality;
    private final List<String> joinKeys;
    private final String strategy;

    public FanOutMarker(String relation, String parentTable, String table, String alias,
                        Cardinality cardinality, List<String> joinKeys, String strategy) {
        this.relation = relation;
        this.parentTable = parentTable;
        this.table = table;
        this.alias = alias;
        this.cardinality = cardinality;
        this.joinKeys = List.copyOf(joinKeys);
        this.strategy = strategy;
    }

    public String getRelation() {
        return relation;
    }

    @JsonProperty("parent_table")
    public String getParentTable() {
        return parentTable;
    }

    public String getTable() {
        return table;
    }

    public String getAlias() {
        return alias;
    }

    /**
     * Cardinality before the rewrite, read from the grain side; after the rewrite the join is many-to-one.
     */
    public Cardinality getCardinality() {
        return cardinality;
    }

    @JsonProperty("join_keys")
    public List<String> getJoinKeys() {
        return joinKeys;
    }

    public String getStrategy() {
        return strategy;
    }
}
