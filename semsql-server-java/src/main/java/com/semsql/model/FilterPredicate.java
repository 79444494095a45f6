package com.semsql.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code dimension operator value}. {@code table} is only needed when the dimension is not
 * declared among the intent's dimension intents.
 */
public final class FilterPredicate {
    private final String dimension;
    private final String table;
    private final String operator;
    private final Object value;

    public FilterPredicate(String dimension, String table, String operator, Object value) {
        this.dimension = Objects.requireNonNull(dimension, "dimension");
        this.table = table;
        this.operator = Objects.requireNonNull(operator, "operator");
        this.value = value instanceof List ? Collections.unmodifiableList((List<?>) value) : value;
    }

    public static FilterPredicate equalTo(String dimension, Object value) {
        return new FilterPredicate(dimension, null, "=", value);
    }

    public String getDimension() {
        return dimension;
    }

    public String getTable() {
        return table;
    }

    public String getOperator() {
        return operator;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public String toString() {
        return dimension + " " + operator + " " + value;
    }
}
