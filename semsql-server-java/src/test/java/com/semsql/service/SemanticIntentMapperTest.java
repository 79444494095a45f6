package com.semsql.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.semsql.exception.InvalidIntentException;
import com.semsql.model.Aggregation;
import com.semsql.model.CompileRequest;
import com.semsql.model.DimensionIntent;
import com.semsql.model.DimensionUsage;
import com.semsql.model.MetricIntent;
import com.semsql.model.SemanticQueryIntent;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SemanticIntentMapperTest {

    private final SemanticIntentMapper mapper = new SemanticIntentMapper(new ObjectMapper());

    @Test
    void shouldMapUntypedPayload() {
        Map<String, Object> raw = Map.of(
            "metrics", List.of(Map.of("name", "total_amount", "table", "transactions",
                "column", "transaction_amount", "aggregation", "sum")),
            "dimension_intents", List.of(Map.of("name", "customer_type", "table", "customer", "usage", "filter")),
            "filters", List.of(Map.of("dimension", "customer_type", "value", "CORPORATE")),
            "order_by", List.of(Map.of("field", "total_amount", "direction", "desc")),
            "limit", 5,
            "confidence", 0.93);

        SemanticQueryIntent intent = mapper.fromMap(raw);

        MetricIntent metric = intent.getMetrics().get(0);
        assertEquals(Aggregation.SUM, metric.getAggregation());
        assertEquals("transactions", intent.grainTable());
        DimensionIntent dimension = intent.getDimensionIntents().get(0);
        assertEquals(DimensionUsage.FILTER, dimension.getUsage());
        assertEquals("customer_type", dimension.getColumn());
        assertTrue(dimension.isOptional());
        assertEquals("=", intent.getFilters().get(0).getOperator());
        assertTrue(intent.getOrderBy().get(0).isDescending());
        assertEquals(5, intent.getLimit());
    }

    @Test
    void shouldKeepUnknownUsageAsUnrecognized() {
        CompileRequest request = new CompileRequest();
        request.getMetrics().add(new CompileRequest.MetricRequest("orders", "orders", null, "count"));
        request.getDimensionIntents().add(new CompileRequest.DimensionRequest("c_name", "customer", "group", false));
        request.getDimensionIntents().add(new CompileRequest.DimensionRequest("n_name", "nation", null, null));

        SemanticQueryIntent intent = mapper.toIntent(request);

        assertEquals(MetricIntent.ALL_ROWS, intent.getMetrics().get(0).getColumn());
        assertNull(intent.getDimensionIntents().get(0).getUsage());
        assertFalse(intent.getDimensionIntents().get(0).isOptional());
        assertEquals(DimensionUsage.SELECT, intent.getDimensionIntents().get(1).getUsage());
    }

    @Test
    void shouldReportEveryViolation() {
        CompileRequest request = new CompileRequest();
        request.getMetrics().add(new CompileRequest.MetricRequest("total", "orders", "o_totalprice", "median"));
        request.getMetrics().add(new CompileRequest.MetricRequest("avg", "orders", null, "avg"));
        request.getFilters().add(new CompileRequest.FilterRequest("status", "~=", "F"));
        request.setLimit(0);

        InvalidIntentException error = assertThrows(InvalidIntentException.class, () -> mapper.toIntent(request));

        assertEquals(4, error.getViolations().size());
        assertEquals("INVALID_INTENT", error.getErrorCode());
    }

    @Test
    void shouldRejectNamesThatAreNotPlainIdentifiers() {
        CompileRequest request = new CompileRequest();
        request.getMetrics().add(new CompileRequest.MetricRequest("x FROM customer; DROP TABLE orders; --", "orders",
            "o_totalprice", "sum"));
        request.getDimensionIntents().add(new CompileRequest.DimensionRequest("market segment", "customer", null, null));
        CompileRequest.OrderRequest order = new CompileRequest.OrderRequest();
        order.setField("1; --");
        request.getOrderBy().add(order);

        InvalidIntentException error = assertThrows(InvalidIntentException.class, () -> mapper.toIntent(request));

        assertEquals(3, error.getViolations().size());
        assertTrue(error.getViolations().get(0).contains("not a plain identifier"));
    }

    @Test
    void shouldRejectFilterValuesThatAreNotScalars() {
        CompileRequest request = new CompileRequest();
        request.getMetrics().add(new CompileRequest.MetricRequest("total", "orders", "o_totalprice", "sum"));
        request.getFilters().add(new CompileRequest.FilterRequest("o_orderstatus", "=", Map.of("raw", "1 OR 1=1")));
        request.getFilters().add(new CompileRequest.FilterRequest("o_orderpriority", "IN",
            List.of("1-URGENT", List.of("2-HIGH"))));
        request.getFilters().add(new CompileRequest.FilterRequest("o_totalprice", "BETWEEN", List.of(10, 20.5)));

        InvalidIntentException error = assertThrows(InvalidIntentException.class, () -> mapper.toIntent(request));

        assertEquals(2, error.getViolations().size());
    }

    @Test
    void shouldRequireAtLeastOneMetric() {
        InvalidIntentException error = assertThrows(InvalidIntentException.class,
            () -> mapper.toIntent(new CompileRequest()));

        assertEquals(List.of("At least one metric is required"), error.getViolations());
    }

    @Test
    void shouldRejectPayloadOfWrongShape() {
        assertThrows(InvalidIntentException.class, () -> mapper.fromMap(Map.of("metrics", "revenue")));
    }
}
