package com.semsql;

import com.semsql.model.CompilationResult;
import com.semsql.model.DimensionIntent;
import com.semsql.model.MetricIntent;
import com.semsql.model.SchemaGraph;
import com.semsql.model.SemanticQueryIntent;
import com.semsql.service.SemanticQueryCompiler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest(properties = {
    "semsql.compiler.table-qualifier=tpch.tiny",
    "semsql.compiler.default-limit=50"
})
class SemsqlApplicationTests {

    @Autowired
    private SchemaGraph schemaGraph;

    @Autowired
    private SemanticQueryCompiler compiler;

    @Test
    void shouldCompileAgainstBundledCatalogue() {
        SemanticQueryIntent intent = SemanticQueryIntent.builder()
            .metric(MetricIntent.sum("total_price", "orders", "o_totalprice"))
            .dimension(DimensionIntent.select("n_name", "nation", false))
            .build();

        CompilationResult result = compiler.compile(intent, schemaGraph);

        assertEquals(8, schemaGraph.size());
        assertEquals("SELECT SUM(o.o_totalprice) AS total_price, n.n_name FROM tpch.tiny.orders o "
            + "INNER JOIN tpch.tiny.customer c ON c.c_custkey = o.o_custkey "
            + "INNER JOIN tpch.tiny.nation n ON n.n_nationkey = c.c_nationkey GROUP BY n.n_name LIMIT 50", result.getSql());
    }
}
