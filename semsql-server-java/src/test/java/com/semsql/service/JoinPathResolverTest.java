package com.semsql.service;

import com.semsql.TestSchemas;
import com.semsql.exception.InvalidIntentException;
import com.semsql.exception.UnreachableTableException;
import com.semsql.model.Cardinality;
import com.semsql.model.JoinPath;
import com.semsql.model.PathStep;
import com.semsql.model.SchemaGraph;
import com.semsql.model.TableRef;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JoinPathResolverTest {

    private final JoinPathResolver resolver = new JoinPathResolver();

    @Test
    void shouldPreferFirstRegisteredEdgeBetweenEqualPaths() {
        SchemaGraph viaB = diamond("b_d", "c_d");
        SchemaGraph viaC = diamond("c_d", "b_d");

        assertEquals(List.of("a_b", "b_d"), relations(resolver.resolve(viaB, "a", List.of(TableRef.of("d")))));
        assertEquals(List.of("a_c", "c_d"), relations(resolver.resolve(viaC, "a", List.of(TableRef.of("d")))));
    }

    @Test
    void shouldNotDependOnOrderOfRequiredTables() {
        SchemaGraph graph = diamond("b_d", "c_d");

        JoinPath first = resolver.resolve(graph, "a", List.of(TableRef.of("d"), TableRef.of("c")));
        JoinPath second = resolver.resolve(graph, "a", List.of(TableRef.of("c"), TableRef.of("d")));

        assertEquals(List.of("a_b", "a_c", "b_d"), relations(first));
        assertEquals(relations(first), relations(second));
    }

    @Test
    void shouldOrderParentsBeforeChildren() {
        SchemaGraph graph = TestSchemas.tpch();

        JoinPath path = resolver.resolve(graph, "lineitem", List.of(TableRef.of("region"), TableRef.of("customer")));

        // nation is one hop closer through supplier than through orders and customer.
        assertEquals(List.of("lineitem_orders", "lineitem_supplier", "supplier_nation", "orders_customer", "nation_region"),
            relations(path));
        assertEquals(3, path.getSteps().get(4).getDepth());
        assertEquals(Cardinality.MANY_TO_ONE, path.getSteps().get(0).cardinality());
    }

    @Test
    void shouldReadCardinalityFromParentSide() {
        SchemaGraph graph = TestSchemas.tpch();

        JoinPath path = resolver.resolve(graph, "orders", List.of(TableRef.of("lineitem")));

        PathStep step = path.getSteps().get(0);
        assertEquals(TableRef.of("orders"), step.getParent());
        assertEquals(Cardinality.ONE_TO_MANY, step.cardinality());
    }

    @Test
    void shouldReturnEmptyPathWhenOnlyGrainIsNeeded() {
        JoinPath path = resolver.resolve(TestSchemas.tpch(), "ORDERS", List.of(TableRef.of("orders")));

        assertTrue(path.getSteps().isEmpty());
        assertEquals(TableRef.of("orders"), path.getGrain());
    }

    @Test
    void shouldReportAllUnreachableTables() {
        SchemaGraph graph = SchemaGraph.builder()
            .table("a", List.of("id"), List.of("id", "b_id"))
            .table("b", List.of("id"), List.of("id"))
            .table("x", List.of("id"), List.of("id"))
            .table("y", List.of("id"), List.of("id"))
            .relation("a", "b", "a.b_id = b.id", Cardinality.MANY_TO_ONE)
            .build();

        UnreachableTableException error = assertThrows(UnreachableTableException.class, () -> resolver.resolve(graph, "a",
            List.of(TableRef.of("y"), TableRef.of("ghost"), TableRef.of("b"), TableRef.of("x"))));

        assertEquals(List.of("x", "y", "ghost"), error.getTables());
        assertEquals("a", error.getGrainTable());
        assertEquals("UNREACHABLE_TABLE", error.getErrorCode());
    }

    @Test
    void shouldRejectUnknownGrainTable() {
        assertThrows(UnreachableTableException.class,
            () -> resolver.resolve(TestSchemas.tpch(), "events", List.of(TableRef.of("events"))));
    }

    @Test
    void shouldAddRoleInstanceAfterTreeSteps() {
        SchemaGraph graph = TestSchemas.flights();

        JoinPath path = resolver.resolve(graph, "flights", List.of(
            new TableRef("date_dim", "arrival_date"), new TableRef("date_dim", "departure_date")));

        assertEquals(List.of("departure_date", "arrival_date"), relations(path));
        assertEquals(TableRef.of("date_dim"), path.getSteps().get(0).getChild());
        assertEquals(new TableRef("date_dim", "arrival_date"), path.getSteps().get(1).getChild());
    }

    @Test
    void shouldJoinSelfRelationFromPrimaryInstance() {
        SchemaGraph graph = TestSchemas.employees();

        JoinPath path = resolver.resolve(graph, "employee", List.of(new TableRef("employee", "employee_manager")));

        assertEquals(1, path.getSteps().size());
        PathStep step = path.getSteps().get(0);
        assertEquals(TableRef.of("employee"), step.getParent());
        assertEquals(new TableRef("employee", "employee_manager"), step.getChild());
        assertEquals(Cardinality.MANY_TO_ONE, step.cardinality());
    }

    @Test
    void shouldRejectInvalidRoles() {
        SchemaGraph graph = TestSchemas.tpch();

        assertThrows(InvalidIntentException.class,
            () -> resolver.resolve(graph, "orders", List.of(new TableRef("customer", "no_such_relation"))));
        assertThrows(InvalidIntentException.class,
            () -> resolver.resolve(graph, "orders", List.of(new TableRef("region", "orders_customer"))));
    }

    private static SchemaGraph diamond(String firstToD, String secondToD) {
        SchemaGraph.Builder builder = SchemaGraph.builder()
            .table("a", List.of("id"), List.of("id", "b_id", "c_id"))
            .table("b", List.of("id"), List.of("id", "d_id"))
            .table("c", List.of("id"), List.of("id", "d_id"))
            .table("d", List.of("id"), List.of("id"))
            .relation("a", "b", "a.b_id = b.id", Cardinality.MANY_TO_ONE)
            .relation("a", "c", "a.c_id = c.id", Cardinality.MANY_TO_ONE);
        for (String name : List.of(firstToD, secondToD)) {
            String from = name.substring(0, 1);
            builder.relation(from, "d", from + ".d_id = d.id", Cardinality.MANY_TO_ONE);
        }
        return builder.build();
    }

    private static List<String> relations(JoinPath path) {
        return path.getSteps().stream()
            .map(step -> step.getRelation().getName())
            .collect(Collectors.toList());
    }
}
