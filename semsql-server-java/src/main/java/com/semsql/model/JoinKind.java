package com.semsql.model;

public enum JoinKind {
    INNER("INNER JOIN"),
    LEFT("LEFT JOIN");

    private final String sql;

    JoinKind(String sql) {
        this.sql = sql;
    }

    public String sql() {
        return sql;
    }
}
