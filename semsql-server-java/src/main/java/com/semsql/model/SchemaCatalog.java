package com.semsql.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of a schema graph: tables in registration order, then relations in registration order.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SchemaCatalog {
    private List<TableEntry> tables = new ArrayList<>();
    private List<RelationEntry> relations = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class TableEntry {
        private String name;
        private String alias;

        @JsonProperty("primary_key")
        private List<String> primaryKey = new ArrayList<>();

        private List<String> columns = new ArrayList<>();

        public TableEntry() {}

        public TableEntry(String name, String alias, List<String> primaryKey, List<String> columns) {
            this.name = name;
            this.alias = alias;
            this.primaryKey = primaryKey;
            this.columns = columns;
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RelationEntry {
        private String name;
        private String left;
        private String right;
        private String condition;
        private Cardinality cardinality;

        public RelationEntry() {}

        public RelationEntry(String name, String left, String right, String condition, Cardinality cardinality) {
            this.name = name;
            this.left = left;
            this.right = right;
            this.condition = condition;
            this.cardinality = cardinality;
        }
    }
}
