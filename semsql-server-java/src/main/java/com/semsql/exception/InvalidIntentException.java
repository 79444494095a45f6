package com.semsql.exception;

import java.util.List;
import java.util.Map;

/**
 * The intent does not fit the strict intent shape or does not match the schema graph.
 */
public class InvalidIntentException extends SemanticCompilationException {

    private final List<String> violations;

    public InvalidIntentException(List<String> violations) {
        super("INVALID_INTENT",
            "Invalid semantic query intent: " + String.join("; ", violations),
            Map.of("violations", List.copyOf(violations)));
        this.violations = List.copyOf(violations);
    }

    public InvalidIntentException(String violation) {
        this(List.of(violation));
    }

    public List<String> getViolations() {
        return violations;
    }
}
