package com.semsql.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * How a query uses a dimension: to restrict rows, to augment them, or both.
 */
public enum DimensionUsage {
    FILTER("filter"),
    SELECT("select"),
    BOTH("both");

    private final String value;

    DimensionUsage(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parses a usage hint; anything outside the three known values is reported as empty.
     */
    public static Optional<DimensionUsage> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (DimensionUsage usage : values()) {
            if (usage.value.equals(normalized)) {
                return Optional.of(usage);
            }
        }
        return Optional.empty();
    }
}
