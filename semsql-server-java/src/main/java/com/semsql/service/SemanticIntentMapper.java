package com.semsql.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.semsql.exception.InvalidIntentException;
import com.semsql.model.Aggregation;
import com.semsql.model.CompileRequest;
import com.semsql.model.DimensionIntent;
import com.semsql.model.DimensionUsage;
import com.semsql.model.FilterPredicate;
import com.semsql.model.MetricIntent;
import com.semsql.model.OrderSpec;
import com.semsql.model.SelectItem;
import com.semsql.model.SemanticQueryIntent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validates loosely typed intent payloads into the strict {@link SemanticQueryIntent}. All
 * problems found are reported together.
 */
@Service
public class SemanticIntentMapper {
    private static final Logger logger = LoggerFactory.getLogger(SemanticIntentMapper.class);

    @Autowired
    private ObjectMapper objectMapper;

    public SemanticIntentMapper() {}

    public SemanticIntentMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Maps an untyped dictionary, e.g. one produced by an upstream planner.
     */
    public SemanticQueryIntent fromMap(Map<String, Object> raw) {
        CompileRequest request;
        try {
            request = objectMapper.convertValue(raw, CompileRequest.class);
        } catch (IllegalArgumentException e) {
            logger.warn("Rejected intent payload: {}", e.getMessage());
            throw new InvalidIntentException("Intent payload does not match the intent shape: " + e.getMessage());
        }
        return toIntent(request);
    }

    public SemanticQueryIntent toIntent(CompileRequest request) {
        List<String> violations = new ArrayList<>();
        SemanticQueryIntent.Builder builder = SemanticQueryIntent.builder();

        if (request.getMetrics() == null || request.getMetrics().isEmpty()) {
            violations.add("At least one metric is required");
        } else {
            for (CompileRequest.MetricRequest metric : request.getMetrics()) {
                MetricIntent mapped = toMetric(metric, violations);
                if (mapped != null) {
                    builder.metric(mapped);
                }
            }
        }

        if (request.getDimensionIntents() != null) {
            for (CompileRequest.DimensionRequest dimension : request.getDimensionIntents()) {
                DimensionIntent mapped = toDimension(dimension, violations);
                if (mapped != null) {
                    builder.dimension(mapped);
                }
            }
        }

        if (request.getFilters() != null) {
            for (CompileRequest.FilterRequest filter : request.getFilters()) {
                if (isBlank(filter.getDimension())) {
                    violations.add("Filter dimension is required");
                    continue;
                }
                if (!SelectItem.isValidName(filter.getDimension().trim())) {
                    violations.add("Filter dimension '" + filter.getDimension() + "' is not a plain identifier");
                    continue;
                }
                String operator = filter.getOperator() == null ? "=" : filter.getOperator();
                if (!SqlCompiler.isSupportedOperator(operator)) {
                    violations.add("Unsupported operator '" + operator + "' on filter " + filter.getDimension());
                    continue;
                }
                if (!isScalarOrList(filter.getValue())) {
                    violations.add("Filter on " + filter.getDimension()
                        + " must compare against a string, number, boolean or a list of those");
                    continue;
                }
                builder.filter(new FilterPredicate(filter.getDimension().trim(), trimToNull(filter.getTable()),
                    operator, filter.getValue()));
            }
        }

        if (request.getOrderBy() != null) {
            for (CompileRequest.OrderRequest order : request.getOrderBy()) {
                String direction = order.getDirection() == null ? "ASC" : order.getDirection().trim().toUpperCase();
                if (isBlank(order.getField())) {
                    violations.add("Order field is required");
                } else if (!SelectItem.isValidName(order.getField().trim())) {
                    violations.add("Order field '" + order.getField() + "' is not a plain identifier");
                } else if (!"ASC".equals(direction) && !"DESC".equals(direction)) {
                    violations.add("Invalid order direction '" + order.getDirection() + "' for " + order.getField());
                } else {
                    builder.orderBy(new OrderSpec(order.getField().trim(), "DESC".equals(direction)));
                }
            }
        }

        if (request.getLimit() != null && request.getLimit() <= 0) {
            violations.add("Limit must be positive but was " + request.getLimit());
        }
        builder.limit(request.getLimit());

        if (!violations.isEmpty()) {
            logger.warn("Rejected intent with {} violations: {}", violations.size(), violations);
            throw new InvalidIntentException(violations);
        }
        return builder.build();
    }

    private MetricIntent toMetric(CompileRequest.MetricRequest metric, List<String> violations) {
        if (isBlank(metric.getName()) || isBlank(metric.getTable())) {
            violations.add("Metric name and table are required");
            return null;
        }
        if (!SelectItem.isValidName(metric.getName().trim())) {
            violations.add("Metric name '" + metric.getName() + "' is not a plain identifier");
            return null;
        }
        Optional<Aggregation> aggregation = Aggregation.fromValue(metric.getAggregation());
        if (aggregation.isEmpty()) {
            violations.add("Unsupported aggregation '" + metric.getAggregation() + "' on metric " + metric.getName());
            return null;
        }
        String column = trimToNull(metric.getColumn());
        if (column == null) {
            if (aggregation.get() != Aggregation.COUNT) {
                violations.add("Metric " + metric.getName() + " needs a column for " + aggregation.get());
                return null;
            }
            column = MetricIntent.ALL_ROWS;
        }
        return new MetricIntent(metric.getName().trim(), metric.getTable().trim(), column, aggregation.get());
    }

    private DimensionIntent toDimension(CompileRequest.DimensionRequest dimension, List<String> violations) {
        if (isBlank(dimension.getName()) || isBlank(dimension.getTable())) {
            violations.add("Dimension name and table are required");
            return null;
        }
        if (!SelectItem.isValidName(dimension.getName().trim())) {
            violations.add("Dimension name '" + dimension.getName() + "' is not a plain identifier");
            return null;
        }
        DimensionUsage usage = null;
        if (dimension.getUsage() == null) {
            usage = DimensionUsage.SELECT;
        } else {
            usage = DimensionUsage.fromValue(dimension.getUsage()).orElse(null);
            if (usage == null) {
                logger.warn("Unrecognized usage '{}' on dimension {}, joining it as optional", dimension.getUsage(),
                    dimension.getName());
            }
        }
        boolean optional = dimension.getOptional() == null || dimension.getOptional();
        return new DimensionIntent(dimension.getName().trim(), dimension.getTable().trim(),
            trimToNull(dimension.getColumn()), usage, optional, trimToNull(dimension.getRole()));
    }

    private static boolean isScalarOrList(Object value) {
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                if (!isScalar(item)) {
                    return false;
                }
            }
            return true;
        }
        return value == null || isScalar(value);
    }

    private static boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static String trimToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }
}
