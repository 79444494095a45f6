package com.semsql.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Loosely typed compile request as it arrives over HTTP. Converted into a
 * {@link SemanticQueryIntent} by {@code SemanticIntentMapper}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CompileRequest {
    @NotEmpty(message = "At least one metric is required")
    @Valid
    private List<MetricRequest> metrics = new ArrayList<>();

    @JsonProperty("dimension_intents")
    @Valid
    private List<DimensionRequest> dimensionIntents = new ArrayList<>();

    @Valid
    private List<FilterRequest> filters = new ArrayList<>();

    @JsonProperty("order_by")
    @Valid
    private List<OrderRequest> orderBy = new ArrayList<>();

    private Integer limit;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MetricRequest {
        @NotBlank(message = "Metric name is required")
        @Pattern(regexp = SelectItem.NAME_PATTERN, message = "Metric name must be a plain identifier")
        private String name;

        @NotBlank(message = "Metric table is required")
        private String table;

        private String column;

        @NotBlank(message = "Metric aggregation is required")
        private String aggregation;

        public MetricRequest() {}

        public MetricRequest(String name, String table, String column, String aggregation) {
            this.name = name;
            this.table = table;
            this.column = column;
            this.aggregation = aggregation;
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DimensionRequest {
        @NotBlank(message = "Dimension name is required")
        @Pattern(regexp = SelectItem.NAME_PATTERN, message = "Dimension name must be a plain identifier")
        private String name;

        @NotBlank(message = "Dimension table is required")
        private String table;

        private String column;

        private String usage;

        private Boolean optional;

        private String role;

        public DimensionRequest() {}

        public DimensionRequest(String name, String table, String usage, Boolean optional) {
            this.name = name;
            this.table = table;
            this.usage = usage;
            this.optional = optional;
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FilterRequest {
        @NotBlank(message = "Filter dimension is required")
        @Pattern(regexp = SelectItem.NAME_PATTERN, message = "Filter dimension must be a plain identifier")
        private String dimension;

        private String table;

        private String operator = "=";

        private Object value;

        public FilterRequest() {}

        public FilterRequest(String dimension, String operator, Object value) {
            this.dimension = dimension;
            this.operator = operator;
            this.value = value;
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OrderRequest {
        @NotBlank(message = "Order field is required")
        @Pattern(regexp = SelectItem.NAME_PATTERN, message = "Order field must be a plain identifier")
        private String field;

        private String direction = "ASC";
    }
}
