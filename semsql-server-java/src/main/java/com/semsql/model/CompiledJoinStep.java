package com.semsql.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One join of the plan. The left side is the instance already in scope, the right side is the
 * instance being joined; {@code cardinality} is read from the left side.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CompiledJoinStep {
    private final String relationName;
    private final String leftTable;
    private final String leftAlias;
    private final String rightTable;
    private final String rightAlias;
    private final JoinKind joinType;
    private final String normalizedCondition;
    private final Cardinality cardinality;
    private final List<String> leftColumns;
    private final List<String> rightColumns;
    private final PreAggregation preAggregation;

    public CompiledJoinStep(String relationName, String leftTable, String leftAlias, String rightTable,
                            String rightAlias, JoinKind joinType, String normalizedCondition,
                            Cardinality cardinality, List<String> leftColumns, List<String> rightColumns,
                            PreAggregation preAggregation) {
        this.relationName = Objects.requireNonNull(relationName, "relationName");
        this.leftTable = Objects.requireNonNull(leftTable, "leftTable");
        this.leftAlias = Objects.requireNonNull(leftAlias, "leftAlias");
        this.rightTable = Objects.requireNonNull(rightTable, "rightTable");
        this.rightAlias = Objects.requireNonNull(rightAlias, "rightAlias");
        this.joinType = Objects.requireNonNull(joinType, "joinType");
        this.normalizedCondition = Objects.requireNonNull(normalizedCondition, "normalizedCondition");
        this.cardinality = Objects.requireNonNull(cardinality, "cardinality");
        this.leftColumns = List.copyOf(leftColumns);
        this.rightColumns = List.copyOf(rightColumns);
        this.preAggregation = preAggregation;
    }

    public CompiledJoinStep withPreAggregation(PreAggregation derived) {
        return new CompiledJoinStep(relationName, leftTable, leftAlias, rightTable, rightAlias, joinType,
            normalizedCondition, cardinality, leftColumns, rightColumns, derived);
    }

    @JsonProperty("relation")
    public String getRelationName() {
        return relationName;
    }

    @JsonProperty("left_table")
    public String getLeftTable() {
        return leftTable;
    }

    @JsonProperty("left_alias")
    public String getLeftAlias() {
        return leftAlias;
    }

    @JsonProperty("right_table")
    public String getRightTable() {
        return rightTable;
    }

    @JsonProperty("right_alias")
    public String getRightAlias() {
        return rightAlias;
    }

    @JsonProperty("join_type")
    public JoinKind getJoinType() {
        return joinType;
    }

    @JsonProperty("normalized_condition")
    public String getNormalizedCondition() {
        return normalizedCondition;
    }

    public Cardinality getCardinality() {
        return cardinality;
    }

    /**
     * Join-key columns on the left (in-scope) instance, aligned with {@link #getRightColumns()}.
     */
    @JsonProperty("left_columns")
    public List<String> getLeftColumns() {
        return leftColumns;
    }

    @JsonProperty("right_columns")
    public List<String> getRightColumns() {
        return rightColumns;
    }

    @JsonProperty("pre_aggregation")
    public PreAggregation getPreAggregation() {
        return preAggregation;
    }

    public boolean isPreAggregated() {
        return preAggregation != null;
    }

    @Override
    public String toString() {
        return joinType.sql() + " " + rightTable + " " + rightAlias + " ON " + normalizedCondition;
    }
}
