package com.semsql.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A table registered in the schema graph. The alias is fixed when the graph is built.
 */
public final class Table {
    private final String name;
    private final String alias;
    private final List<String> primaryKey;
    private final List<String> columns;
    private final int ordinal;
    private final Map<String, String> columnLookup;

    public Table(String name, String alias, List<String> primaryKey, List<String> columns, int ordinal) {
        this.name = Objects.requireNonNull(name, "name");
        this.alias = Objects.requireNonNull(alias, "alias");
        this.primaryKey = List.copyOf(primaryKey);
        this.ordinal = ordinal;

        Map<String, String> lookup = new LinkedHashMap<>();
        for (String column : columns) {
            lookup.putIfAbsent(column.toLowerCase(Locale.ROOT), column);
        }
        for (String column : primaryKey) {
            lookup.putIfAbsent(column.toLowerCase(Locale.ROOT), column);
        }
        this.columnLookup = Collections.unmodifiableMap(lookup);
        this.columns = List.copyOf(lookup.values());
    }

    public String getName() {
        return name;
    }

    public String getAlias() {
        return alias;
    }

    @JsonProperty("primary_key")
    public List<String> getPrimaryKey() {
        return primaryKey;
    }

    public List<String> getColumns() {
        return columns;
    }

    /**
     * Registration order in the graph; the total order used for canonical conditions.
     */
    @JsonProperty("ordinal")
    public int getOrdinal() {
        return ordinal;
    }

    /**
     * Returns the column spelled as declared, matching case-insensitively.
     */
    public Optional<String> column(String column) {
        if (column == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(columnLookup.get(column.toLowerCase(Locale.ROOT)));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Table)) {
            return false;
        }
        return name.equals(((Table) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name + " " + alias;
    }
}
