package com.semsql.service;

import com.semsql.config.SemsqlProperties;
import com.semsql.exception.InvalidIntentException;
import com.semsql.model.CompiledJoinStep;
import com.semsql.model.CompiledQueryPlan;
import com.semsql.model.PreAggregation;
import com.semsql.model.SelectItem;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Serializes a {@link CompiledQueryPlan} into one SQL statement. Clauses are separated by a
 * single space, so identical plans always print identical text.
 */
@Service
public class SqlCompiler {

    private static final List<String> OPERATORS = List.of(
        "=", "!=", "<>", ">", "<", ">=", "<=", "LIKE", "NOT LIKE", "IN", "NOT IN", "BETWEEN", "IS NULL", "IS NOT NULL");

    private final String tableQualifier;

    @Autowired
    public SqlCompiler(SemsqlProperties properties) {
        String qualifier = properties.getCompiler().getTableQualifier();
        this.tableQualifier = qualifier == null ? "" : qualifier.trim();
    }

    public String compile(CompiledQueryPlan plan) {
        List<String> sqlParts = new ArrayList<>();

        // SELECT clause
        sqlParts.add("SELECT " + buildSelectClause(plan.getSelectItems()));

        // FROM clause
        sqlParts.add("FROM " + qualify(plan.getGrainTable()) + " " + plan.getGrainAlias());

        // JOIN clauses
        for (CompiledJoinStep step : plan.getJoinSteps()) {
            sqlParts.add(renderJoin(step));
        }

        // WHERE clause
        if (!plan.getWherePredicates().isEmpty()) {
            sqlParts.add("WHERE " + String.join(" AND ", plan.getWherePredicates()));
        }

        // GROUP BY clause
        if (!plan.getGroupBy().isEmpty()) {
            sqlParts.add("GROUP BY " + String.join(", ", plan.getGroupBy()));
        }

        // ORDER BY clause
        if (!plan.getOrderBy().isEmpty()) {
            sqlParts.add("ORDER BY " + String.join(", ", plan.getOrderBy()));
        }

        // LIMIT clause
        if (plan.getLimit() != null) {
            sqlParts.add("LIMIT " + plan.getLimit());
        }

        return String.join(" ", sqlParts);
    }

    public String renderJoin(CompiledJoinStep step) {
        String target = step.isPreAggregated()
            ? "(" + renderPreAggregation(step.getPreAggregation()) + ")"
            : qualify(step.getRightTable());
        return step.getJoinType().sql() + " " + target + " " + step.getRightAlias() + " ON " + step.getNormalizedCondition();
    }

    /**
     * Body of the derived table that replaces a fan-out join, without surrounding parentheses.
     */
    public String renderPreAggregation(PreAggregation derived) {
        List<String> keys = new ArrayList<>();
        for (String column : derived.getKeyColumns()) {
            keys.add(derived.getAlias() + "." + column);
        }
        List<String> projections = new ArrayList<>(keys);
        for (SelectItem aggregate : derived.getAggregates()) {
            projections.add(aggregate.sql());
        }

        List<String> sqlParts = new ArrayList<>();
        sqlParts.add("SELECT " + String.join(", ", projections));
        sqlParts.add("FROM " + qualify(derived.getTable()) + " " + derived.getAlias());
        for (CompiledJoinStep join : derived.getJoins()) {
            sqlParts.add(renderJoin(join));
        }
        if (!derived.getFilters().isEmpty()) {
            sqlParts.add("WHERE " + String.join(" AND ", derived.getFilters()));
        }
        sqlParts.add("GROUP BY " + String.join(", ", keys));
        return String.join(" ", sqlParts);
    }

    /**
     * Renders {@code column operator value}.
     *
     * @throws InvalidIntentException for unsupported operators or values that do not fit the operator
     */
    public String renderFilter(String column, String operator, Object value) {
        String op = normalizeOperator(operator);
        switch (op) {
            case "IS NULL":
            case "IS NOT NULL":
                return column + " " + op;
            case "IN":
            case "NOT IN":
                if (value instanceof Collection) {
                    Collection<?> values = (Collection<?>) value;
                    if (values.isEmpty()) {
                        throw new InvalidIntentException("Operator " + op + " on " + column + " needs at least one value");
                    }
                    List<String> quoted = new ArrayList<>();
                    for (Object item : values) {
                        quoted.add(sqlQuote(requireValue(column, op, item)));
                    }
                    return column + " " + op + " (" + String.join(", ", quoted) + ")";
                }
                return column + " " + op + " (" + sqlQuote(requireValue(column, op, value)) + ")";
            case "BETWEEN":
                if (!(value instanceof List) || ((List<?>) value).size() != 2) {
                    throw new InvalidIntentException("Operator BETWEEN on " + column + " needs exactly two values");
                }
                List<?> bounds = (List<?>) value;
                return column + " BETWEEN " + sqlQuote(requireValue(column, op, bounds.get(0)))
                    + " AND " + sqlQuote(requireValue(column, op, bounds.get(1)));
            default:
                if (value instanceof Collection) {
                    throw new InvalidIntentException("Operator " + op + " on " + column + " takes a single value");
                }
                return column + " " + op + " " + sqlQuote(requireValue(column, op, value));
        }
    }

    public String qualify(String table) {
        return tableQualifier.isEmpty() ? table : tableQualifier + "." + table;
    }

    public static boolean isSupportedOperator(String operator) {
        return operator != null && OPERATORS.contains(operator.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT));
    }

    public static String normalizeOperator(String operator) {
        if (operator == null) {
            throw new InvalidIntentException("Filter operator is required");
        }
        String op = operator.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
        if (!OPERATORS.contains(op)) {
            throw new InvalidIntentException("Unsupported filter operator: " + operator);
        }
        return op;
    }

    private String buildSelectClause(List<SelectItem> items) {
        List<String> columns = new ArrayList<>();
        for (SelectItem item : items) {
            columns.add(item.sql());
        }
        return String.join(", ", columns);
    }

    private static Object requireValue(String column, String operator, Object value) {
        if (value == null) {
            throw new InvalidIntentException("Operator " + operator + " on " + column + " needs a value");
        }
        return value;
    }

    private String sqlQuote(Object value) {
        if (value instanceof String) {
            return "'" + ((String) value).replace("'", "''") + "'";
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? "TRUE" : "FALSE";
        }
        if (value instanceof Number) {
            return String.valueOf(value);
        }
        throw new InvalidIntentException("Unsupported filter value of type " + value.getClass().getSimpleName()
            + ": only strings, numbers and booleans can be compared");
    }
}
