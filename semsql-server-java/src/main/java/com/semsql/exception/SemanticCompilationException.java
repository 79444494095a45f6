package com.semsql.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type of every error the compiler reports. Compilation either succeeds completely
 * or fails with one of these; there is no partial output.
 */
public abstract class SemanticCompilationException extends RuntimeException {

    private final String errorCode;
    private final Map<String, Object> details;

    protected SemanticCompilationException(String errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
