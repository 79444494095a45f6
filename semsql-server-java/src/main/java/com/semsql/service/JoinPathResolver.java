package com.semsql.service;

import com.semsql.exception.InvalidIntentException;
import com.semsql.exception.UnreachableTableException;
import com.semsql.model.JoinPath;
import com.semsql.model.PathStep;
import com.semsql.model.Relation;
import com.semsql.model.SchemaGraph;
import com.semsql.model.Table;
import com.semsql.model.TableRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds the join tree connecting the grain table to every table a query needs.
 * <p>
 * The search is breadth-first and level by level, so every table is reached through a shortest
 * path. When several edges reach the same table on one level, the edge registered first wins.
 * This tie-break is part of the contract: plans stay stable for a given schema graph no matter
 * in which order the query lists its dimensions.
 */
@Service
public class JoinPathResolver {
    private static final Logger logger = LoggerFactory.getLogger(JoinPathResolver.class);

    /**
     * @param required table instances the query references; a role names the relation a second
     *                 instance of the table is joined through
     * @throws UnreachableTableException if a required table is unknown or disconnected from the grain
     * @throws InvalidIntentException    if a role names an unknown relation or one not touching its table
     */
    public JoinPath resolve(SchemaGraph graph, String grainTable, Collection<TableRef> required) {
        Table grain = graph.table(grainTable)
            .orElseThrow(() -> new UnreachableTableException(grainTable, List.of(grainTable)));

        Set<String> requiredTables = new LinkedHashSet<>();
        List<String> unknown = new ArrayList<>();
        Map<Relation, TableRef> roleInstances = new HashMap<>();
        for (TableRef ref : required) {
            Table table = graph.table(ref.getTable()).orElse(null);
            if (table == null) {
                if (!unknown.contains(ref.getTable())) {
                    unknown.add(ref.getTable());
                }
                continue;
            }
            requiredTables.add(table.getName());
            if (!ref.isPrimary()) {
                Relation relation = roleRelation(graph, table, ref.getRole());
                requiredTables.add(relation.otherEnd(table.getName()));
                roleInstances.putIfAbsent(relation, new TableRef(table.getName(), relation.getName()));
            }
        }

        Map<String, Discovery> tree = discover(graph, grain);

        List<String> unreachable = new ArrayList<>();
        for (Table table : graph.getTables()) {
            if (requiredTables.contains(table.getName()) && !tree.containsKey(table.getName())) {
                unreachable.add(table.getName());
            }
        }
        unreachable.addAll(unknown);
        if (!unreachable.isEmpty()) {
            logger.warn("Tables {} cannot be reached from grain table {}", unreachable, grain.getName());
            throw new UnreachableTableException(grain.getName(), unreachable);
        }

        // A role that names the tree edge of its table is the primary instance.
        roleInstances.entrySet().removeIf(entry -> {
            Discovery discovery = tree.get(entry.getValue().getTable());
            return discovery.relation != null && discovery.relation.equals(entry.getKey())
                && !entry.getKey().isSelfRelation();
        });

        Set<String> included = new LinkedHashSet<>();
        for (String table : requiredTables) {
            String current = table;
            while (current != null && included.add(current)) {
                current = tree.get(current).parent;
            }
        }

        List<PathStep> steps = new ArrayList<>();
        Map<String, Integer> depths = new HashMap<>();
        depths.put(grain.getName(), 0);
        for (Map.Entry<String, Discovery> entry : tree.entrySet()) {
            Discovery discovery = entry.getValue();
            if (discovery.parent == null || !included.contains(entry.getKey())) {
                continue;
            }
            int depth = depths.get(discovery.parent) + 1;
            depths.put(entry.getKey(), depth);
            steps.add(new PathStep(discovery.relation, TableRef.of(discovery.parent), TableRef.of(entry.getKey()), depth));
        }

        List<Relation> roles = new ArrayList<>(roleInstances.keySet());
        roles.sort(Comparator.comparingInt(Relation::getOrdinal));
        for (Relation relation : roles) {
            TableRef child = roleInstances.get(relation);
            String parent = relation.otherEnd(child.getTable());
            steps.add(new PathStep(relation, TableRef.of(parent), child, depths.get(parent) + 1));
        }

        JoinPath path = new JoinPath(TableRef.of(grain.getName()), steps);
        logger.debug("Resolved join path {}", path);
        return path;
    }

    private Relation roleRelation(SchemaGraph graph, Table table, String role) {
        Relation relation = graph.relation(role)
            .orElseThrow(() -> new InvalidIntentException("Unknown role relation '" + role + "' for table '"
                + table.getName() + "'"));
        if (!relation.touches(table.getName())) {
            throw new InvalidIntentException("Role relation '" + relation.getName() + "' does not involve table '"
                + table.getName() + "'");
        }
        return relation;
    }

    /**
     * Breadth-first spanning tree from {@code grain}, in discovery order.
     */
    private Map<String, Discovery> discover(SchemaGraph graph, Table grain) {
        Map<String, Discovery> tree = new LinkedHashMap<>();
        tree.put(grain.getName(), new Discovery(null, null));
        List<String> level = List.of(grain.getName());
        while (!level.isEmpty()) {
            Map<String, Discovery> candidates = new HashMap<>();
            for (String table : level) {
                for (Relation relation : graph.relationsOf(table)) {
                    if (relation.isSelfRelation()) {
                        continue;
                    }
                    String other = relation.otherEnd(table);
                    if (tree.containsKey(other)) {
                        continue;
                    }
                    Discovery current = candidates.get(other);
                    if (current == null || relation.getOrdinal() < current.relation.getOrdinal()) {
                        candidates.put(other, new Discovery(table, relation));
                    }
                }
            }
            List<Map.Entry<String, Discovery>> next = new ArrayList<>(candidates.entrySet());
            next.sort(Comparator.comparingInt((Map.Entry<String, Discovery> entry) -> entry.getValue().relation.getOrdinal())
                .thenComparing(Map.Entry::getKey));
            List<String> nextLevel = new ArrayList<>();
            for (Map.Entry<String, Discovery> entry : next) {
                tree.put(entry.getKey(), entry.getValue());
                nextLevel.add(entry.getKey());
            }
            level = nextLevel;
        }
        return tree;
    }

    private static final class Discovery {
        private final String parent;
        private final Relation relation;

        private Discovery(String parent, Relation relation) {
            this.parent = parent;
            this.relation = relation;
        }
    }
}
