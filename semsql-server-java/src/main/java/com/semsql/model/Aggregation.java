package com.semsql.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum Aggregation {
    SUM,
    COUNT,
    COUNT_DISTINCT,
    AVG,
    MIN,
    MAX;

    @JsonValue
    public String getValue() {
        return name();
    }

    public String render(String expression) {
        if (this == COUNT_DISTINCT) {
            return "COUNT(DISTINCT " + expression + ")";
        }
        return name() + "(" + expression + ")";
    }

    /**
     * Whether repeating an input row changes the aggregate.
     */
    public boolean isDuplicateSensitive() {
        return this == SUM || this == COUNT || this == AVG;
    }

    public static Optional<Aggregation> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
        for (Aggregation aggregation : values()) {
            if (aggregation.name().equals(normalized)) {
                return Optional.of(aggregation);
            }
        }
        return Optional.empty();
    }
}
