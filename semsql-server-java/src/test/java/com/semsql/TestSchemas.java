package com.semsql;

import com.semsql.model.Cardinality;
import com.semsql.model.SchemaGraph;

import java.util.List;

/**
 * Schema graphs shared by the tests.
 */
public final class TestSchemas {

    private TestSchemas() {
    }

    /**
     * customer is registered before transactions, so its alias comes first in join conditions.
     */
    public static SchemaGraph transactions() {
        return SchemaGraph.builder()
            .table("customer", List.of("customer_id"), List.of("customer_id", "customer_type", "name"))
            .table("transactions", List.of("transaction_id"),
                List.of("transaction_id", "customer_id", "transaction_amount", "transaction_date"))
            .relation("transactions", "customer", "transactions.customer_id = customer.customer_id",
                Cardinality.MANY_TO_ONE)
            .build();
    }

    public static SchemaGraph tpch() {
        return SchemaGraph.builder()
            .table("region", List.of("r_regionkey"), List.of("r_regionkey", "r_name", "r_comment"))
            .table("nation", List.of("n_nationkey"), List.of("n_nationkey", "n_name", "n_regionkey", "n_comment"))
            .table("customer", List.of("c_custkey"),
                List.of("c_custkey", "c_name", "c_address", "c_nationkey", "c_phone", "c_acctbal", "c_mktsegment"))
            .table("supplier", List.of("s_suppkey"), List.of("s_suppkey", "s_name", "s_nationkey", "s_acctbal"))
            .table("part", List.of("p_partkey"), List.of("p_partkey", "p_name", "p_brand", "p_type", "p_retailprice"))
            .table("partsupp", "ps", List.of("ps_partkey", "ps_suppkey"),
                List.of("ps_partkey", "ps_suppkey", "ps_availqty", "ps_supplycost"))
            .table("orders", List.of("o_orderkey"),
                List.of("o_orderkey", "o_custkey", "o_orderstatus", "o_totalprice", "o_orderdate", "o_orderpriority"))
            .table("lineitem", List.of("l_orderkey", "l_linenumber"),
                List.of("l_orderkey", "l_partkey", "l_suppkey", "l_linenumber", "l_quantity", "l_extendedprice",
                    "l_discount", "l_shipmode"))
            .relation("nation", "region", "nation.n_regionkey = region.r_regionkey", Cardinality.MANY_TO_ONE)
            .relation("customer", "nation", "customer.c_nationkey = nation.n_nationkey", Cardinality.MANY_TO_ONE)
            .relation("supplier", "nation", "supplier.s_nationkey = nation.n_nationkey", Cardinality.MANY_TO_ONE)
            .relation("orders", "customer", "orders.o_custkey = customer.c_custkey", Cardinality.MANY_TO_ONE)
            .relation("lineitem", "orders", "lineitem.l_orderkey = orders.o_orderkey", Cardinality.MANY_TO_ONE)
            .relation("partsupp", "part", "partsupp.ps_partkey = part.p_partkey", Cardinality.MANY_TO_ONE)
            .relation("partsupp", "supplier", "partsupp.ps_suppkey = supplier.s_suppkey", Cardinality.MANY_TO_ONE)
            .relation("lineitem", "part", "lineitem.l_partkey = part.p_partkey", Cardinality.MANY_TO_ONE)
            .relation("lineitem", "supplier", "lineitem.l_suppkey = supplier.s_suppkey", Cardinality.MANY_TO_ONE)
            .relation("lineitem", "partsupp",
                "lineitem.l_partkey = partsupp.ps_partkey AND lineitem.l_suppkey = partsupp.ps_suppkey",
                Cardinality.MANY_TO_ONE)
            .build();
    }

    /**
     * employee references itself through manager_id.
     */
    public static SchemaGraph employees() {
        return SchemaGraph.builder()
            .table("employee", List.of("employee_id"), List.of("employee_id", "name", "manager_id", "department_id", "salary"))
            .table("department", List.of("department_id"), List.of("department_id", "name"))
            .relation("employee", "department", "employee.department_id = department.department_id",
                Cardinality.MANY_TO_ONE)
            .relation("employee_manager", "employee", "employee", "e.manager_id = e.employee_id",
                Cardinality.MANY_TO_ONE)
            .build();
    }

    /**
     * date_dim plays two roles for flights.
     */
    public static SchemaGraph flights() {
        return SchemaGraph.builder()
            .table("flights", List.of("flight_id"), List.of("flight_id", "departure_date_id", "arrival_date_id", "seats"))
            .table("date_dim", List.of("date_id"), List.of("date_id", "year", "month"))
            .relation("departure_date", "flights", "date_dim", "flights.departure_date_id = date_dim.date_id",
                Cardinality.MANY_TO_ONE)
            .relation("arrival_date", "flights", "date_dim", "date_dim.date_id = flights.arrival_date_id",
                Cardinality.MANY_TO_ONE)
            .build();
    }
}
