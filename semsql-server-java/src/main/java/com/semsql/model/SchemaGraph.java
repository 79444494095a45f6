package com.semsql.model;

import com.semsql.exception.DuplicateAliasConflictException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only model of tables, their canonical aliases and the relations between them.
 * <p>
 * Instances are created through {@link #builder()} and never change afterwards, so one graph
 * can be shared by any number of concurrent compilations.
 */
public final class SchemaGraph {

    private final Map<String, Table> tablesByName;
    private final Map<String, Table> tablesByAlias;
    private final List<Relation> relations;
    private final Map<String, Relation> relationsByName;
    private final Map<String, List<Relation>> adjacency;

    private SchemaGraph(List<Table> tables, List<Relation> relations) {
        Map<String, Table> byName = new LinkedHashMap<>();
        Map<String, Table> byAlias = new LinkedHashMap<>();
        for (Table table : tables) {
            byName.put(key(table.getName()), table);
            byAlias.put(key(table.getAlias()), table);
        }
        Map<String, Relation> byRelationName = new LinkedHashMap<>();
        Map<String, List<Relation>> edges = new LinkedHashMap<>();
        for (Table table : tables) {
            edges.put(table.getName(), new ArrayList<>());
        }
        for (Relation relation : relations) {
            byRelationName.put(key(relation.getName()), relation);
            edges.get(relation.getLeft()).add(relation);
            if (!relation.isSelfRelation()) {
                edges.get(relation.getRight()).add(relation);
            }
        }
        Map<String, List<Relation>> frozen = new LinkedHashMap<>();
        for (Map.Entry<String, List<Relation>> entry : edges.entrySet()) {
            List<Relation> sorted = new ArrayList<>(entry.getValue());
            sorted.sort(Comparator.comparingInt(Relation::getOrdinal));
            frozen.put(entry.getKey(), Collections.unmodifiableList(sorted));
        }

        this.tablesByName = Collections.unmodifiableMap(byName);
        this.tablesByAlias = Collections.unmodifiableMap(byAlias);
        this.relations = List.copyOf(relations);
        this.relationsByName = Collections.unmodifiableMap(byRelationName);
        this.adjacency = Collections.unmodifiableMap(frozen);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Tables in registration order.
     */
    public List<Table> getTables() {
        return List.copyOf(tablesByName.values());
    }

    /**
     * Relations in registration order.
     */
    public List<Relation> getRelations() {
        return relations;
    }

    public Optional<Table> table(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tablesByName.get(key(name)));
    }

    /**
     * Resolves either a table name or a canonical alias. Names win over aliases.
     */
    public Optional<Table> resolve(String nameOrAlias) {
        if (nameOrAlias == null) {
            return Optional.empty();
        }
        Table byName = tablesByName.get(key(nameOrAlias));
        if (byName != null) {
            return Optional.of(byName);
        }
        return Optional.ofNullable(tablesByAlias.get(key(nameOrAlias)));
    }

    public Optional<Relation> relation(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(relationsByName.get(key(name)));
    }

    /**
     * Relations touching {@code table}, in registration order.
     */
    public List<Relation> relationsOf(String table) {
        List<Relation> edges = adjacency.get(table);
        return edges == null ? List.of() : edges;
    }

    public boolean isAliasTaken(String alias) {
        return alias != null && tablesByAlias.containsKey(key(alias));
    }

    public boolean isTableName(String candidate) {
        return candidate != null && tablesByName.containsKey(key(candidate));
    }

    public int size() {
        return tablesByName.size();
    }

    private static String key(String raw) {
        return raw.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Single-writer construction phase of a {@link SchemaGraph}.
     */
    public static final class Builder {
        // Short keywords a derived alias must never collide with.
        private static final Set<String> RESERVED_ALIASES = Set.of(
            "as", "at", "by", "do", "if", "in", "is", "of", "on", "or", "to",
            "all", "and", "any", "asc", "end", "for", "key", "not", "row", "set", "top", "use");

        private final List<TableDeclaration> tables = new ArrayList<>();
        private final List<RelationDeclaration> relations = new ArrayList<>();

        private Builder() {
        }

        public Builder table(String name, List<String> primaryKey, List<String> columns) {
            return table(name, null, primaryKey, columns);
        }

        public Builder table(String name, String alias, List<String> primaryKey, List<String> columns) {
            if (name == null || name.trim().isEmpty()) {
                throw new IllegalArgumentException("Table name is required");
            }
            tables.add(new TableDeclaration(name.trim(), alias == null ? null : alias.trim(),
                primaryKey == null ? List.of() : primaryKey,
                columns == null ? List.of() : columns));
            return this;
        }

        public Builder relation(String left, String right, String condition, Cardinality cardinality) {
            return relation(null, left, right, condition, cardinality);
        }

        public Builder relation(String name, String left, String right, String condition, Cardinality cardinality) {
            relations.add(new RelationDeclaration(name, left, right, condition, cardinality));
            return this;
        }

        public SchemaGraph build() {
            Map<String, TableDeclaration> declared = new LinkedHashMap<>();
            for (TableDeclaration table : tables) {
                if (declared.put(key(table.name), table) != null) {
                    throw new IllegalArgumentException("Table registered twice: " + table.name);
                }
            }

            Map<String, String> aliases = assignAliases(declared);

            List<Table> built = new ArrayList<>();
            int ordinal = 0;
            for (TableDeclaration table : tables) {
                built.add(new Table(table.name, aliases.get(key(table.name)), table.primaryKey, table.columns, ordinal++));
            }

            List<Relation> builtRelations = new ArrayList<>();
            Set<String> relationNames = new HashSet<>();
            Map<String, Integer> pairCounts = new LinkedHashMap<>();
            int relationOrdinal = 0;
            for (RelationDeclaration relation : relations) {
                TableDeclaration left = declared.get(key(requireText(relation.left, "Relation left table")));
                TableDeclaration right = declared.get(key(requireText(relation.right, "Relation right table")));
                if (left == null || right == null) {
                    throw new IllegalArgumentException("Relation references an unknown table: "
                        + relation.left + " -> " + relation.right);
                }
                if (relation.cardinality == null) {
                    throw new IllegalArgumentException("Relation " + left.name + " -> " + right.name + " has no cardinality");
                }
                String name = relation.name;
                if (name == null || name.trim().isEmpty()) {
                    String base = left.name + "_" + right.name;
                    int seen = pairCounts.merge(key(base), 1, Integer::sum);
                    name = seen == 1 ? base : base + "_" + seen;
                }
                if (!relationNames.add(key(name))) {
                    throw new IllegalArgumentException("Relation registered twice: " + name);
                }
                builtRelations.add(new Relation(name.trim(), left.name, right.name,
                    requireText(relation.condition, "Relation condition"), relation.cardinality, relationOrdinal++));
            }
            return new SchemaGraph(built, builtRelations);
        }

        private Map<String, String> assignAliases(Map<String, TableDeclaration> declared) {
            Map<String, String> aliases = new LinkedHashMap<>();
            Map<String, String> owners = new LinkedHashMap<>();

            // Pinned aliases are reserved before any alias is derived.
            for (TableDeclaration table : tables) {
                if (table.alias == null || table.alias.isEmpty()) {
                    continue;
                }
                String alias = table.alias.toLowerCase(Locale.ROOT);
                String owner = owners.get(alias);
                if (owner != null) {
                    throw new DuplicateAliasConflictException(alias, table.name, "alias of table '" + owner + "'");
                }
                TableDeclaration named = declared.get(alias);
                if (named != null && named != table) {
                    throw new DuplicateAliasConflictException(alias, table.name, "table name '" + named.name + "'");
                }
                owners.put(alias, table.name);
                aliases.put(key(table.name), alias);
            }

            for (TableDeclaration table : tables) {
                if (aliases.containsKey(key(table.name))) {
                    continue;
                }
                String alias = deriveAlias(table, declared, owners);
                owners.put(alias, table.name);
                aliases.put(key(table.name), alias);
            }
            return aliases;
        }

        private static String deriveAlias(TableDeclaration table, Map<String, TableDeclaration> declared,
                                          Map<String, String> owners) {
            String name = table.name.toLowerCase(Locale.ROOT);
            String shortName = name.substring(name.lastIndexOf('.') + 1);
            String letters = shortName.replaceAll("[^a-z0-9_]", "");
            if (letters.isEmpty() || !Character.isLetter(letters.charAt(0))) {
                letters = "t" + letters;
            }

            List<String> candidates = new ArrayList<>();
            candidates.add(letters.substring(0, 1));
            String[] words = letters.split("_+");
            if (words.length > 1 && !words[1].isEmpty()) {
                candidates.add(words[0].substring(0, 1) + words[1].substring(0, 1));
            }
            String compact = letters.replace("_", "");
            if (compact.length() > 1) {
                candidates.add(compact.substring(0, 2));
            }
            for (String candidate : candidates) {
                if (isFree(candidate, table, declared, owners)) {
                    return candidate;
                }
            }
            String first = letters.substring(0, 1);
            for (int suffix = 1; ; suffix++) {
                String candidate = first + suffix;
                if (isFree(candidate, table, declared, owners)) {
                    return candidate;
                }
            }
        }

        private static boolean isFree(String candidate, TableDeclaration table,
                                      Map<String, TableDeclaration> declared, Map<String, String> owners) {
            if (owners.containsKey(candidate) || RESERVED_ALIASES.contains(candidate)) {
                return false;
            }
            TableDeclaration named = declared.get(candidate);
            return named == null || named == table;
        }

        private static String requireText(String value, String what) {
            if (value == null || value.trim().isEmpty()) {
                throw new IllegalArgumentException(what + " is required");
            }
            return value.trim();
        }
    }

    private static final class TableDeclaration {
        private final String name;
        private final String alias;
        private final List<String> primaryKey;
        private final List<String> columns;

        private TableDeclaration(String name, String alias, List<String> primaryKey, List<String> columns) {
            this.name = name;
            this.alias = alias;
            this.primaryKey = primaryKey;
            this.columns = columns;
        }
    }

    private static final class RelationDeclaration {
        private final String name;
        private final String left;
        private final String right;
        private final String condition;
        private final Cardinality cardinality;

        private RelationDeclaration(String name, String left, String right, String condition, Cardinality cardinality) {
            this.name = name;
            this.left = left;
            this.right = right;
            this.condition = condition;
            this.cardinality = cardinality;
        }
    }
}
