package com.semsql.model;

import java.util.Objects;

public final class CompilationResult {
    private final String sql;
    private final CompiledQueryPlan plan;
    private final ValidationReport report;

    public CompilationResult(String sql, CompiledQueryPlan plan, ValidationReport report) {
        this.sql = Objects.requireNonNull(sql, "sql");
        this.plan = Objects.requireNonNull(plan, "plan");
        this.report = Objects.requireNonNull(report, "report");
    }

    public String getSql() {
        return sql;
    }

    public CompiledQueryPlan getPlan() {
        return plan;
    }

    public ValidationReport getReport() {
        return report;
    }
}
