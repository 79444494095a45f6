package com.semsql;

import com.semsql.config.SemsqlProperties;
import com.semsql.model.CompilationResult;
import com.semsql.model.DimensionIntent;
import com.semsql.model.MetricIntent;
import com.semsql.model.SchemaGraph;
import com.semsql.model.SemanticQueryIntent;
import com.semsql.service.SemanticQueryCompiler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

@SpringBootTest
class SemsqlDefaultsTests {

    @Autowired
    private SemsqlProperties properties;

    @Autowired
    private SchemaGraph schemaGraph;

    @Autowired
    private SemanticQueryCompiler compiler;

    @Test
    void shouldNotCapQueriesWithoutLimitByDefault() {
        SemanticQueryIntent intent = SemanticQueryIntent.builder()
            .metric(MetricIntent.sum("total_price", "orders", "o_totalprice"))
            .dimension(DimensionIntent.select("c_mktsegment", "customer", true))
            .build();

        CompilationResult result = compiler.compile(intent, schemaGraph);

        assertNull(properties.getCompiler().getDefaultLimit());
        assertNull(result.getPlan().getLimit());
        assertFalse(result.getSql().contains("LIMIT"), result.getSql());
    }
}
