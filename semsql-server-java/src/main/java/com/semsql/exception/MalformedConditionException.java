package com.semsql.exception;

import java.util.LinkedHashMap;
import java.util.Map;

public class MalformedConditionException extends SemanticCompilationException {

    private final String condition;

    public MalformedConditionException(String condition, String reason) {
        super("MALFORMED_CONDITION",
            "Malformed join condition '" + condition + "': " + reason,
            details(condition, reason));
        this.condition = condition;
    }

    public String getCondition() {
        return condition;
    }

    private static Map<String, Object> details(String condition, String reason) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("condition", String.valueOf(condition));
        details.put("reason", reason);
        return details;
    }
}
