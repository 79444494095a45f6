package com.semsql.model;

import lombok.Data;

@Data
public class CompileResponse {
    private String sql;

    private CompiledQueryPlan plan;

    private ValidationReport report;

    // Constructors
    public CompileResponse() {}

    public CompileResponse(String sql, CompiledQueryPlan plan, ValidationReport report) {
        this.sql = sql;
        this.plan = plan;
        this.report = report;
    }

    public static CompileResponse of(CompilationResult result) {
        return new CompileResponse(result.getSql(), result.getPlan(), result.getReport());
    }
}
