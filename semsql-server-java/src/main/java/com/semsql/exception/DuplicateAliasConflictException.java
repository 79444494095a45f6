package com.semsql.exception;

import java.util.LinkedHashMap;
import java.util.Map;

public class DuplicateAliasConflictException extends SemanticCompilationException {

    private final String alias;
    private final String table;

    public DuplicateAliasConflictException(String alias, String table, String conflictsWith) {
        super("DUPLICATE_ALIAS_CONFLICT",
            "Alias '" + alias + "' for table '" + table + "' collides with " + conflictsWith,
            details(alias, table, conflictsWith));
        this.alias = alias;
        this.table = table;
    }

    public String getAlias() {
        return alias;
    }

    public String getTable() {
        return table;
    }

    private static Map<String, Object> details(String alias, String table, String conflictsWith) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("alias", alias);
        details.put("table", table);
        details.put("conflicts_with", conflictsWith);
        return details;
    }
}
