package com.semsql.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A join predicate in canonical form: equalities between a column of {@code firstTable} and a
 * column of {@code secondTable}, where the first table is the earlier-registered one (or, for a
 * self relation, the referencing instance).
 */
public final class NormalizedCondition {
    private final Table firstTable;
    private final Table secondTable;
    private final List<ColumnPair> pairs;

    public NormalizedCondition(Table firstTable, Table secondTable, List<ColumnPair> pairs) {
        this.firstTable = Objects.requireNonNull(firstTable, "firstTable");
        this.secondTable = Objects.requireNonNull(secondTable, "secondTable");
        this.pairs = List.copyOf(pairs);
    }

    public Table getFirstTable() {
        return firstTable;
    }

    public Table getSecondTable() {
        return secondTable;
    }

    public List<ColumnPair> getPairs() {
        return pairs;
    }

    public List<String> firstColumns() {
        List<String> columns = new ArrayList<>();
        for (ColumnPair pair : pairs) {
            columns.add(pair.getFirstColumn());
        }
        return columns;
    }

    public List<String> secondColumns() {
        List<String> columns = new ArrayList<>();
        for (ColumnPair pair : pairs) {
            columns.add(pair.getSecondColumn());
        }
        return columns;
    }

    public String render(String firstAlias, String secondAlias) {
        StringBuilder result = new StringBuilder();
        for (ColumnPair pair : pairs) {
            if (result.length() > 0) {
                result.append(" AND ");
            }
            result.append(firstAlias).append('.').append(pair.getFirstColumn())
                .append(" = ")
                .append(secondAlias).append('.').append(pair.getSecondColumn());
        }
        return result.toString();
    }

    /**
     * Canonical text using each table's canonical alias.
     */
    @Override
    public String toString() {
        return render(firstTable.getAlias(), secondTable.getAlias());
    }

    public static final class ColumnPair {
        private final String firstColumn;
        private final String secondColumn;

        public ColumnPair(String firstColumn, String secondColumn) {
            this.firstColumn = Objects.requireNonNull(firstColumn, "firstColumn");
            this.secondColumn = Objects.requireNonNull(secondColumn, "secondColumn");
        }

        public String getFirstColumn() {
            return firstColumn;
        }

        public String getSecondColumn() {
            return secondColumn;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof ColumnPair)) {
                return false;
            }
            ColumnPair other = (ColumnPair) o;
            return firstColumn.equals(other.firstColumn) && secondColumn.equals(other.secondColumn);
        }

        @Override
        public int hashCode() {
            return Objects.hash(firstColumn, secondColumn);
        }
    }
}
