package com.semsql.exception;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class UnreachableTableException extends SemanticCompilationException {

    private final String grainTable;
    private final List<String> tables;

    public UnreachableTableException(String grainTable, List<String> tables) {
        super("UNREACHABLE_TABLE",
            "No join path from grain table '" + grainTable + "' to " + tables,
            details(grainTable, tables));
        this.grainTable = grainTable;
        this.tables = List.copyOf(tables);
    }

    public String getGrainTable() {
        return grainTable;
    }

    public List<String> getTables() {
        return tables;
    }

    private static Map<String, Object> details(String grainTable, List<String> tables) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("grain_table", grainTable);
        details.put("tables", List.copyOf(tables));
        return details;
    }
}
