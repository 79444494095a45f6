package com.semsql.service;

import com.semsql.config.SemsqlProperties;
import com.semsql.exception.DuplicateAliasConflictException;
import com.semsql.exception.InvalidIntentException;
import com.semsql.exception.UnreachableTableException;
import com.semsql.model.Aggregation;
import com.semsql.model.CompilationResult;
import com.semsql.model.CompiledJoinStep;
import com.semsql.model.CompiledQueryPlan;
import com.semsql.model.DimensionBinding;
import com.semsql.model.DimensionIntent;
import com.semsql.model.DimensionUsage;
import com.semsql.model.FanOutMarker;
import com.semsql.model.FilterBinding;
import com.semsql.model.FilterPredicate;
import com.semsql.model.JoinKind;
import com.semsql.model.JoinPath;
import com.semsql.model.MetricBinding;
import com.semsql.model.MetricIntent;
import com.semsql.model.NormalizedCondition;
import com.semsql.model.OrderSpec;
import com.semsql.model.PathStep;
import com.semsql.model.SchemaGraph;
import com.semsql.model.SelectItem;
import com.semsql.model.SemanticQueryIntent;
import com.semsql.model.Table;
import com.semsql.model.TableRef;
import com.semsql.model.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Compiles a {@link SemanticQueryIntent} into one SQL statement over a {@link SchemaGraph}.
 * <p>
 * The compiler holds no per-request state: every call builds its own bindings and plan, and the
 * graph is only read, so a single instance serves concurrent requests.
 */
@Service
public class SemanticQueryCompiler {
    private static final Logger logger = LoggerFactory.getLogger(SemanticQueryCompiler.class);

    private final JoinPathResolver joinPathResolver;
    private final JoinTypeResolver joinTypeResolver;
    private final JoinConditionNormalizer joinConditionNormalizer;
    private final FanOutGuard fanOutGuard;
    private final SqlCompiler sqlCompiler;
    private final Integer defaultLimit;

    @Autowired
    public SemanticQueryCompiler(JoinPathResolver joinPathResolver, JoinTypeResolver joinTypeResolver,
                                 JoinConditionNormalizer joinConditionNormalizer, FanOutGuard fanOutGuard,
                                 SqlCompiler sqlCompiler, SemsqlProperties properties) {
        this.joinPathResolver = joinPathResolver;
        this.joinTypeResolver = joinTypeResolver;
        this.joinConditionNormalizer = joinConditionNormalizer;
        this.fanOutGuard = fanOutGuard;
        this.sqlCompiler = sqlCompiler;
        this.defaultLimit = properties.getCompiler().getDefaultLimit();
    }

    /**
     * @throws com.semsql.exception.SemanticCompilationException when the intent cannot be compiled
     *                                                           into correct SQL; nothing is returned then
     */
    public CompilationResult compile(SemanticQueryIntent intent, SchemaGraph graph) {
        Table grain = graph.table(intent.grainTable())
            .orElseThrow(() -> new UnreachableTableException(intent.grainTable(), List.of(intent.grainTable())));
        logger.info("Compiling {} metrics, {} dimensions and {} filters on grain table {}",
            intent.getMetrics().size(), intent.getDimensionIntents().size(), intent.getFilters().size(), grain.getName());

        // Filters naming no dimension intent become implicit filter dimensions.
        List<DimensionIntent> dimensions = new ArrayList<>(intent.getDimensionIntents());
        Map<FilterPredicate, DimensionIntent> filterTargets = new LinkedHashMap<>();
        for (FilterPredicate filter : intent.getFilters()) {
            DimensionIntent target = findDimension(dimensions, filter, graph);
            if (target == null) {
                if (filter.getTable() == null) {
                    throw new InvalidIntentException("Filter on '" + filter.getDimension()
                        + "' names neither a requested dimension nor a table");
                }
                target = DimensionIntent.filter(filter.getDimension(), filter.getTable());
                dimensions.add(target);
            }
            filterTargets.put(filter, target);
        }

        Set<TableRef> required = new LinkedHashSet<>();
        for (MetricIntent metric : intent.getMetrics()) {
            required.add(TableRef.of(canonicalTable(metric.getTable(), graph)));
        }
        for (DimensionIntent dimension : dimensions) {
            required.add(requestedRef(dimension, graph));
        }
        JoinPath path = joinPathResolver.resolve(graph, grain.getName(), required);
        Map<TableRef, String> aliases = allocateAliases(path, graph);

        List<String> violations = new ArrayList<>();
        List<MetricBinding> metrics = bindMetrics(intent, path, graph, violations);
        Map<DimensionIntent, DimensionBinding> dimensionBindings = bindDimensions(dimensions,
            intent.getDimensionIntents().size(), new HashSet<>(filterTargets.values()), path, graph, violations);
        if (!violations.isEmpty()) {
            throw new InvalidIntentException(violations);
        }
        List<DimensionBinding> boundDimensions = new ArrayList<>(dimensionBindings.values());
        List<FilterBinding> filters = new ArrayList<>();
        for (Map.Entry<FilterPredicate, DimensionIntent> entry : filterTargets.entrySet()) {
            filters.add(new FilterBinding(entry.getKey(), dimensionBindings.get(entry.getValue())));
        }

        List<String> decisions = new ArrayList<>();
        List<CompiledJoinStep> steps = new ArrayList<>();
        for (PathStep step : path.getSteps()) {
            steps.add(compileStep(step, path, aliases, boundDimensions, graph, decisions));
        }

        FanOutGuard.Result guarded = fanOutGuard.protect(path, steps, aliases, metrics, boundDimensions, filters);
        for (FanOutMarker marker : guarded.getMarkers()) {
            decisions.add(marker.getRelation() + ": " + marker.getCardinality().getValue() + " from "
                + marker.getParentTable() + " pre-aggregated as " + marker.getAlias() + " grouped by "
                + String.join(", ", marker.getJoinKeys()));
        }

        List<SelectItem> selectItems = new ArrayList<>();
        for (MetricBinding metric : metrics) {
            selectItems.add(guarded.metricItem(metric));
        }
        List<String> groupBy = new ArrayList<>();
        for (DimensionIntent dimension : intent.getDimensionIntents()) {
            DimensionBinding binding = dimensionBindings.get(dimension);
            if (!binding.isSelected()) {
                continue;
            }
            String alias = aliases.get(binding.getInstance());
            String column = alias + "." + binding.getColumn();
            selectItems.add(new SelectItem(column, binding.getName(), alias, SelectItem.Kind.DIMENSION));
            if (!groupBy.contains(column)) {
                groupBy.add(column);
            }
        }

        List<String> where = new ArrayList<>();
        for (FilterBinding filter : filters) {
            if (guarded.isPushedDown(filter)) {
                continue;
            }
            where.add(sqlCompiler.renderFilter(aliases.get(filter.getInstance()) + "." + filter.getTarget().getColumn(),
                filter.getPredicate().getOperator(), filter.getPredicate().getValue()));
        }

        CompiledQueryPlan plan = new CompiledQueryPlan(grain.getName(), aliases.get(path.getGrain()), selectItems,
            guarded.getJoinSteps(), where, groupBy, orderBy(intent, selectItems), limit(intent),
            guarded.getMarkers());
        String sql = sqlCompiler.compile(plan);
        logger.info("Compiled query on {} with {} joins and {} pre-aggregations", grain.getName(),
            plan.getJoinSteps().size(), plan.getFanOutMarkers().size());
        logger.debug("Compiled SQL: {}", sql);
        return new CompilationResult(sql, plan, new ValidationReport(true, guarded.getMarkers(), decisions));
    }

    private DimensionIntent findDimension(List<DimensionIntent> dimensions, FilterPredicate filter, SchemaGraph graph) {
        for (DimensionIntent dimension : dimensions) {
            if (!dimension.getName().equalsIgnoreCase(filter.getDimension())) {
                continue;
            }
            if (filter.getTable() == null
                || canonicalTable(filter.getTable(), graph).equals(canonicalTable(dimension.getTable(), graph))) {
                return dimension;
            }
        }
        return null;
    }

    private TableRef requestedRef(DimensionIntent dimension, SchemaGraph graph) {
        String table = canonicalTable(dimension.getTable(), graph);
        if (dimension.getRole() == null || dimension.getRole().trim().isEmpty()) {
            return TableRef.of(table);
        }
        String role = graph.relation(dimension.getRole()).map(relation -> relation.getName()).orElse(dimension.getRole());
        return new TableRef(table, role);
    }

    /**
     * The instance a requested reference ends up on. A role that turned out to be the tree edge
     * of its table collapses onto the primary instance.
     */
    private TableRef instanceOf(TableRef requested, JoinPath path) {
        return path.contains(requested) ? requested : TableRef.of(requested.getTable());
    }

    private Map<TableRef, String> allocateAliases(JoinPath path, SchemaGraph graph) {
        Map<TableRef, String> aliases = new LinkedHashMap<>();
        Set<String> used = new HashSet<>();
        Map<String, Integer> instances = new HashMap<>();

        String grainAlias = graph.table(path.getGrain().getTable()).get().getAlias();
        aliases.put(path.getGrain(), grainAlias);
        used.add(grainAlias);
        for (PathStep step : path.getSteps()) {
            TableRef child = step.getChild();
            Table table = graph.table(child.getTable()).get();
            String alias = table.getAlias();
            if (!child.isPrimary()) {
                int ordinal = instances.merge(table.getName(), 2, (current, ignored) -> current + 1);
                alias = table.getAlias() + ordinal;
                if (graph.isAliasTaken(alias) || graph.isTableName(alias)) {
                    throw new DuplicateAliasConflictException(alias, table.getName() + "@" + child.getRole(),
                        "a table or alias registered in the schema graph");
                }
            }
            if (!used.add(alias)) {
                throw new DuplicateAliasConflictException(alias, child.toString(), "another instance in the plan");
            }
            aliases.put(child, alias);
        }
        return aliases;
    }

    private List<MetricBinding> bindMetrics(SemanticQueryIntent intent, JoinPath path, SchemaGraph graph,
                                            List<String> violations) {
        List<MetricBinding> metrics = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (MetricIntent metric : intent.getMetrics()) {
            Table table = graph.table(metric.getTable()).get();
            if (!SelectItem.isValidName(metric.getName())) {
                violations.add("Metric name '" + metric.getName() + "' is not a plain identifier");
            } else if (!names.add(metric.getName().toLowerCase(Locale.ROOT))) {
                violations.add("Metric name '" + metric.getName() + "' is used twice");
            }
            String column = metric.getColumn();
            if (metric.countsAllRows()) {
                if (metric.getAggregation() != Aggregation.COUNT) {
                    violations.add("Metric '" + metric.getName() + "' applies " + metric.getAggregation() + " to '*'");
                }
            } else {
                Optional<String> declared = declaredColumn(table, column);
                if (declared.isEmpty()) {
                    violations.add("Metric '" + metric.getName() + "' references unknown column "
                        + table.getName() + "." + column);
                } else {
                    column = declared.get();
                }
            }
            metrics.add(new MetricBinding(metric, instanceOf(TableRef.of(table.getName()), path), column));
        }
        return metrics;
    }

    private Map<DimensionIntent, DimensionBinding> bindDimensions(List<DimensionIntent> dimensions, int explicit,
                                                                  Set<DimensionIntent> filtered, JoinPath path,
                                                                  SchemaGraph graph, List<String> violations) {
        Map<DimensionIntent, DimensionBinding> bindings = new LinkedHashMap<>();
        for (int i = 0; i < dimensions.size(); i++) {
            DimensionIntent dimension = dimensions.get(i);
            if (!SelectItem.isValidName(dimension.getName())) {
                violations.add("Dimension name '" + dimension.getName() + "' is not a plain identifier");
                continue;
            }
            Table table = graph.table(dimension.getTable()).get();
            Optional<String> declared = declaredColumn(table, dimension.getColumn());
            if (declared.isEmpty()) {
                violations.add("Dimension '" + dimension.getName() + "' references unknown column "
                    + table.getName() + "." + dimension.getColumn());
                continue;
            }
            DimensionUsage usage = dimension.getUsage();
            if (usage == DimensionUsage.SELECT && filtered.contains(dimension)) {
                usage = DimensionUsage.BOTH;
            }
            TableRef instance = instanceOf(requestedRef(dimension, graph), path);
            bindings.put(dimension, new DimensionBinding(dimension, instance, declared.get(), usage, i >= explicit));
        }
        return bindings;
    }

    private CompiledJoinStep compileStep(PathStep step, JoinPath path, Map<TableRef, String> aliases,
                                         List<DimensionBinding> dimensions, SchemaGraph graph,
                                         List<String> decisions) {
        String parentAlias = aliases.get(step.getParent());
        String childAlias = aliases.get(step.getChild());
        NormalizedCondition condition = joinConditionNormalizer.parse(step.getRelation(), graph);

        String rendered;
        List<String> leftColumns;
        List<String> rightColumns;
        boolean parentFirst = step.getRelation().isSelfRelation()
            || condition.getFirstTable().getName().equals(step.getParent().getTable());
        if (parentFirst) {
            rendered = condition.render(parentAlias, childAlias);
            leftColumns = condition.firstColumns();
            rightColumns = condition.secondColumns();
        } else {
            rendered = condition.render(childAlias, parentAlias);
            leftColumns = condition.secondColumns();
            rightColumns = condition.firstColumns();
        }

        // INNER as soon as one dimension at or below the joined instance requires a match.
        Set<TableRef> subtree = path.subtree(step.getChild());
        DimensionBinding deciding = null;
        JoinKind kind = JoinKind.LEFT;
        for (DimensionBinding dimension : dimensions) {
            if (!subtree.contains(dimension.getInstance())) {
                continue;
            }
            JoinKind resolved = joinTypeResolver.resolve(dimension.getEffectiveUsage(), dimension.getDimension().isOptional());
            if (deciding == null || (resolved == JoinKind.INNER && kind == JoinKind.LEFT)) {
                deciding = dimension;
                kind = resolved;
            }
        }
        String reason;
        if (deciding == null) {
            kind = joinTypeResolver.resolve(DimensionUsage.SELECT, true);
            reason = kind + " (no dimension requires a match)";
        } else {
            reason = joinTypeResolver.explain(deciding.getEffectiveUsage(), deciding.getDimension().isOptional())
                + (deciding.isImplicit() ? " for filter on " : " for dimension ") + deciding.getName();
        }
        String decision = step.getRelation().getName() + ": " + step.getParent().getTable() + " " + parentAlias
            + " -> " + step.getChild().getTable() + " " + childAlias + " [" + step.cardinality().getValue() + "] "
            + kind.sql() + " ON " + rendered + ", " + reason;
        decisions.add(decision);
        logger.debug("Join decision {}", decision);

        return new CompiledJoinStep(step.getRelation().getName(), step.getParent().getTable(), parentAlias,
            step.getChild().getTable(), childAlias, kind, rendered, step.cardinality(), leftColumns, rightColumns, null);
    }

    private List<String> orderBy(SemanticQueryIntent intent, List<SelectItem> selectItems) {
        List<String> orderBy = new ArrayList<>();
        for (OrderSpec order : intent.getOrderBy()) {
            SelectItem target = null;
            for (SelectItem item : selectItems) {
                if (item.getName().equalsIgnoreCase(order.getField())) {
                    target = item;
                    break;
                }
            }
            if (target == null) {
                throw new InvalidIntentException("Cannot order by '" + order.getField()
                    + "': it is neither a metric nor a selected dimension");
            }
            orderBy.add(target.getName() + " " + order.direction());
        }
        return orderBy;
    }

    private Integer limit(SemanticQueryIntent intent) {
        Integer limit = intent.getLimit() != null ? intent.getLimit() : defaultLimit;
        if (limit != null && limit <= 0) {
            throw new InvalidIntentException("Limit must be positive but was " + limit);
        }
        return limit;
    }

    private static String canonicalTable(String table, SchemaGraph graph) {
        return graph.table(table).map(Table::getName).orElse(table);
    }

    /**
     * Tables declared without a column list accept any column.
     */
    private static Optional<String> declaredColumn(Table table, String column) {
        if (table.getColumns().isEmpty()) {
            return Optional.of(column);
        }
        return table.column(column);
    }
}
