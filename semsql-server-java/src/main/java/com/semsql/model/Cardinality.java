package com.semsql.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Cardinality of a relation, read from the side the relation is viewed from.
 */
public enum Cardinality {
    ONE_TO_ONE("one_to_one"),
    MANY_TO_ONE("many_to_one"),
    ONE_TO_MANY("one_to_many"),
    MANY_TO_MANY("many_to_many");

    private final String value;

    Cardinality(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * The same relation seen from the opposite side.
     */
    public Cardinality reverse() {
        switch (this) {
            case MANY_TO_ONE:
                return ONE_TO_MANY;
            case ONE_TO_MANY:
                return MANY_TO_ONE;
            default:
                return this;
        }
    }

    /**
     * True when one row on the viewing side may match several rows on the other side.
     */
    public boolean isToMany() {
        return this == ONE_TO_MANY || this == MANY_TO_MANY;
    }

    /**
     * True when several rows on the viewing side may share one row on the other side,
     * so values of the other side are repeated per viewing-side row.
     */
    public boolean isFromMany() {
        return this == MANY_TO_ONE || this == MANY_TO_MANY;
    }

    @JsonCreator
    public static Cardinality fromValue(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Cardinality is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        switch (normalized) {
            case "one_to_one":
            case "1:1":
                return ONE_TO_ONE;
            case "many_to_one":
            case "n:1":
                return MANY_TO_ONE;
            case "one_to_many":
            case "1:n":
                return ONE_TO_MANY;
            case "many_to_many":
            case "n:n":
            case "n:m":
                return MANY_TO_MANY;
            default:
                throw new IllegalArgumentException("Unknown cardinality: " + raw);
        }
    }
}
