package com.semsql.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.semsql.exception.MalformedConditionException;
import com.semsql.model.Cardinality;
import com.semsql.model.SchemaCatalog;
import com.semsql.model.SchemaGraph;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SchemaGraphLoaderTest {

    private final SchemaGraphLoader loader = new SchemaGraphLoader(new DefaultResourceLoader(), new ObjectMapper(),
        new JoinConditionNormalizer());

    @Test
    void shouldLoadBundledTpchCatalogue() {
        SchemaGraph graph = loader.load("classpath:schema/tpch.json");

        assertEquals(8, graph.size());
        assertEquals(10, graph.getRelations().size());
        assertEquals("ps", graph.table("partsupp").get().getAlias());
        assertEquals("l", graph.table("lineitem").get().getAlias());
        assertEquals(Cardinality.MANY_TO_ONE, graph.relation("lineitem_orders").get().getCardinality());
        assertEquals(List.of("l_orderkey", "l_linenumber"), graph.table("lineitem").get().getPrimaryKey());
    }

    @Test
    void shouldDescribeGraphWithCanonicalConditions() {
        SchemaGraph graph = loader.load("classpath:schema/tpch.json");

        SchemaCatalog catalog = loader.describe(graph);

        assertEquals("region", catalog.getTables().get(0).getName());
        assertEquals("r", catalog.getTables().get(0).getAlias());
        SchemaCatalog.RelationEntry ordersCustomer = catalog.getRelations().get(3);
        assertEquals("orders_customer", ordersCustomer.getName());
        assertEquals("c.c_custkey = o.o_custkey", ordersCustomer.getCondition());
    }

    @Test
    void shouldFailOnMalformedRelationCondition() {
        assertThrows(MalformedConditionException.class, () -> loader.load("classpath:schema/broken-condition.json"));
    }

    @Test
    void shouldFailOnUnreadableCatalogue() {
        assertThrows(IllegalStateException.class, () -> loader.load("classpath:schema/unknown-cardinality.json"));
        assertThrows(IllegalStateException.class, () -> loader.load("classpath:schema/missing.json"));
    }
}
