package com.semsql.model;

import java.util.Objects;

public final class OrderSpec {
    private final String field;
    private final boolean descending;

    public OrderSpec(String field, boolean descending) {
        this.field = Objects.requireNonNull(field, "field");
        this.descending = descending;
    }

    public static OrderSpec asc(String field) {
        return new OrderSpec(field, false);
    }

    public static OrderSpec desc(String field) {
        return new OrderSpec(field, true);
    }

    public String getField() {
        return field;
    }

    public boolean isDescending() {
        return descending;
    }

    public String direction() {
        return descending ? "DESC" : "ASC";
    }
}
