package com.semsql.service;

import com.semsql.exception.MalformedConditionException;
import com.semsql.model.NormalizedCondition;
import com.semsql.model.NormalizedCondition.ColumnPair;
import com.semsql.model.Relation;
import com.semsql.model.SchemaGraph;
import com.semsql.model.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites a join predicate template into canonical alias form, so that every spelling of the
 * same join (reversed operands, table names instead of aliases, schema-qualified names) yields
 * identical text. The earlier-registered table is always written first.
 */
@Service
public class JoinConditionNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(JoinConditionNormalizer.class);

    private static final Pattern AND_SPLIT = Pattern.compile("(?i)\\s+AND\\s+");
    private static final String IDENTIFIER = "(?:[A-Za-z_][A-Za-z0-9_$]*|\"[^\"]+\"|`[^`]+`)";
    private static final Pattern EQUALITY = Pattern.compile(
        "^\\s*(" + IDENTIFIER + "(?:\\s*\\.\\s*" + IDENTIFIER + ")+)\\s*=\\s*("
            + IDENTIFIER + "(?:\\s*\\.\\s*" + IDENTIFIER + ")+)\\s*$");

    public String normalize(String raw, String tableA, String tableB, SchemaGraph graph) {
        return parse(raw, tableA, tableB, graph).toString();
    }

    public NormalizedCondition parse(Relation relation, SchemaGraph graph) {
        return parse(relation.getCondition(), relation.getLeft(), relation.getRight(), graph);
    }

    /**
     * Parses {@code raw} as one or more {@code x.col = y.col} equalities joined by {@code AND}.
     *
     * @throws MalformedConditionException if an operand does not parse or does not belong to
     *                                     {@code tableA}/{@code tableB}
     */
    public NormalizedCondition parse(String raw, String tableA, String tableB, SchemaGraph graph) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new MalformedConditionException(raw, "condition is empty");
        }
        Table first = graph.table(tableA)
            .orElseThrow(() -> new MalformedConditionException(raw, "unknown table '" + tableA + "'"));
        Table second = graph.table(tableB)
            .orElseThrow(() -> new MalformedConditionException(raw, "unknown table '" + tableB + "'"));
        boolean self = first.equals(second);
        if (!self && second.getOrdinal() < first.getOrdinal()) {
            Table swap = first;
            first = second;
            second = swap;
        }

        List<ColumnPair> pairs = new ArrayList<>();
        for (String equality : AND_SPLIT.split(stripParentheses(raw))) {
            Matcher matcher = EQUALITY.matcher(stripParentheses(equality));
            if (!matcher.matches()) {
                throw new MalformedConditionException(raw, "expected 'table.column = table.column' but found '"
                    + equality.trim() + "'");
            }
            Operand left = resolve(raw, matcher.group(1), first, second, graph);
            Operand right = resolve(raw, matcher.group(2), first, second, graph);
            if (self) {
                pairs.add(new ColumnPair(left.column, right.column));
            } else if (left.table.equals(right.table)) {
                throw new MalformedConditionException(raw, "both sides reference table '" + left.table.getName() + "'");
            } else if (left.table.equals(first)) {
                pairs.add(new ColumnPair(left.column, right.column));
            } else {
                pairs.add(new ColumnPair(right.column, left.column));
            }
        }

        String firstAlias = first.getAlias();
        String secondAlias = second.getAlias();
        pairs.sort(Comparator.comparing(pair -> firstAlias + "." + pair.getFirstColumn() + " = "
            + secondAlias + "." + pair.getSecondColumn()));
        NormalizedCondition condition = new NormalizedCondition(first, second, pairs);
        logger.debug("Normalized join condition '{}' to '{}'", raw, condition);
        return condition;
    }

    private Operand resolve(String raw, String operand, Table first, Table second, SchemaGraph graph) {
        String[] parts = operand.split("\\s*\\.\\s*");
        String column = unquote(parts[parts.length - 1]);
        String tableRef = unquote(parts[parts.length - 2]);

        Optional<Table> resolved = graph.resolve(tableRef);
        if (resolved.isEmpty()) {
            throw new MalformedConditionException(raw, "unknown table or alias '" + tableRef + "'");
        }
        Table table = resolved.get();
        if (!table.equals(first) && !table.equals(second)) {
            throw new MalformedConditionException(raw, "'" + tableRef + "' is not one of the joined tables "
                + first.getName() + ", " + second.getName());
        }
        if (table.getColumns().isEmpty()) {
            return new Operand(table, column);
        }
        String declared = table.column(column)
            .orElseThrow(() -> new MalformedConditionException(raw, "unknown column '" + column
                + "' on table '" + table.getName() + "'"));
        return new Operand(table, declared);
    }

    private static String stripParentheses(String text) {
        String result = text.trim();
        while (result.startsWith("(") && result.endsWith(")") && balanced(result.substring(1, result.length() - 1))) {
            result = result.substring(1, result.length() - 1).trim();
        }
        return result;
    }

    private static boolean balanced(String text) {
        int depth = 0;
        for (char c : text.toCharArray()) {
            if (c == '(') {
                depth++;
            } else if (c == ')' && --depth < 0) {
                return false;
            }
        }
        return depth == 0;
    }

    private static String unquote(String identifier) {
        if (identifier.length() > 1 && (identifier.startsWith("\"") || identifier.startsWith("`"))) {
            return identifier.substring(1, identifier.length() - 1);
        }
        return identifier;
    }

    private static final class Operand {
        private final Table table;
        private final String column;

        private Operand(Table table, String column) {
            this.table = table;
            this.column = column;
        }
    }
}
