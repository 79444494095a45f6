package com.semsql.service;

import com.semsql.TestSchemas;
import com.semsql.exception.MalformedConditionException;
import com.semsql.model.NormalizedCondition;
import com.semsql.model.SchemaGraph;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JoinConditionNormalizerTest {

    private final JoinConditionNormalizer normalizer = new JoinConditionNormalizer();
    private final SchemaGraph graph = TestSchemas.tpch();

    @Test
    void shouldNormalizeEveryPresentationToTheSameText() {
        List<String> presentations = List.of(
            "orders.o_custkey = customer.c_custkey",
            "customer.c_custkey = orders.o_custkey",
            "o.o_custkey = c.c_custkey",
            "tpch.tiny.orders.o_custkey = tpch.tiny.customer.c_custkey",
            "O.O_CUSTKEY=C.C_CUSTKEY",
            "(orders.o_custkey = customer.c_custkey)");

        for (String raw : presentations) {
            assertEquals("c.c_custkey = o.o_custkey", normalizer.normalize(raw, "orders", "customer", graph), raw);
            assertEquals("c.c_custkey = o.o_custkey", normalizer.normalize(raw, "customer", "orders", graph), raw);
        }
    }

    @Test
    void shouldSortEqualitiesOfCompositeKeys() {
        String expected = "ps.ps_partkey = l.l_partkey AND ps.ps_suppkey = l.l_suppkey";

        assertEquals(expected, normalizer.normalize(
            "lineitem.l_partkey = partsupp.ps_partkey AND lineitem.l_suppkey = partsupp.ps_suppkey",
            "lineitem", "partsupp", graph));
        assertEquals(expected, normalizer.normalize(
            "ps.ps_suppkey = l.l_suppkey and l.l_partkey = ps.ps_partkey",
            "partsupp", "lineitem", graph));
    }

    @Test
    void shouldExposeColumnsOfBothSides() {
        NormalizedCondition condition = normalizer.parse(graph.relation("lineitem_orders").get(), graph);

        assertEquals("orders", condition.getFirstTable().getName());
        assertEquals(List.of("o_orderkey"), condition.firstColumns());
        assertEquals(List.of("l_orderkey"), condition.secondColumns());
        assertEquals("o1.o_orderkey = l2.l_orderkey", condition.render("o1", "l2"));
    }

    @Test
    void shouldKeepOperandOrderOfSelfRelation() {
        SchemaGraph employees = TestSchemas.employees();

        NormalizedCondition condition = normalizer.parse(employees.relation("employee_manager").get(), employees);

        assertEquals("e.manager_id = e2.employee_id", condition.render("e", "e2"));
    }

    @Test
    void shouldRejectMalformedConditions() {
        assertMalformed("orders.o_custkey == customer.c_custkey", "expected");
        assertMalformed("o_custkey = c_custkey", "expected");
        assertMalformed("orders.o_custkey = customer.c_custkey OR 1 = 1", "expected");
        assertMalformed("", "empty");
        assertMalformed("foo.o_custkey = customer.c_custkey", "unknown table or alias 'foo'");
        assertMalformed("orders.o_custkey = nation.n_nationkey", "is not one of the joined tables");
        assertMalformed("orders.o_custkey = customer.c_missing", "unknown column 'c_missing'");
        assertMalformed("orders.o_custkey = orders.o_orderkey", "both sides");
    }

    private void assertMalformed(String raw, String reason) {
        MalformedConditionException error = assertThrows(MalformedConditionException.class,
            () -> normalizer.normalize(raw, "orders", "customer", graph));
        assertEquals("MALFORMED_CONDITION", error.getErrorCode());
        assertTrue(error.getMessage().contains(reason), error.getMessage());
    }
}
