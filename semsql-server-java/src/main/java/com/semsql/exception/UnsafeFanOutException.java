package com.semsql.exception;

import java.util.LinkedHashMap;
import java.util.Map;

public class UnsafeFanOutException extends SemanticCompilationException {

    private final String relation;
    private final String table;

    public UnsafeFanOutException(String relation, String table, String reason) {
        super("UNSAFE_FAN_OUT",
            "Cannot protect join of '" + table + "' through relation '" + relation + "' against fan-out: " + reason,
            details(relation, table, reason));
        this.relation = relation;
        this.table = table;
    }

    public String getRelation() {
        return relation;
    }

    public String getTable() {
        return table;
    }

    private static Map<String, Object> details(String relation, String table, String reason) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("relation", relation);
        details.put("table", table);
        details.put("reason", reason);
        return details;
    }
}
