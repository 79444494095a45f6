package com.semsql.service;

import com.semsql.exception.UnsafeFanOutException;
import com.semsql.model.Aggregation;
import com.semsql.model.CompiledJoinStep;
import com.semsql.model.DimensionBinding;
import com.semsql.model.FanOutMarker;
import com.semsql.model.FilterBinding;
import com.semsql.model.JoinPath;
import com.semsql.model.MetricBinding;
import com.semsql.model.PathStep;
import com.semsql.model.PreAggregation;
import com.semsql.model.SelectItem;
import com.semsql.model.TableRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Keeps one-to-many joins from multiplying grain rows.
 * <p>
 * Every step that fans out from the grain side is rewritten into a derived table grouped by
 * the child's join key, so each outer row matches at most one derived row. Metrics owned by the
 * rewritten subtree are aggregated inside it and re-aggregated outside. Anything that cannot be
 * made exact this way is rejected with {@link UnsafeFanOutException}; rows are never deduplicated
 * with {@code DISTINCT}.
 */
@Service
public class FanOutGuard {
    private static final Logger logger = LoggerFactory.getLogger(FanOutGuard.class);

    private final SqlCompiler sqlCompiler;

    @Autowired
    public FanOutGuard(SqlCompiler sqlCompiler) {
        this.sqlCompiler = sqlCompiler;
    }

    /**
     * @param steps    compiled join steps aligned index by index with {@code path.getSteps()}
     * @param aliases  alias of every instance in the path
     */
    public Result protect(JoinPath path, List<CompiledJoinStep> steps, Map<TableRef, String> aliases,
                          List<MetricBinding> metrics, List<DimensionBinding> dimensions,
                          List<FilterBinding> filters) {
        Map<TableRef, Set<TableRef>> subtrees = findFanOutSubtrees(path);

        Map<MetricBinding, SelectItem> metricItems = new IdentityHashMap<>();
        for (MetricBinding metric : metrics) {
            TableRef root = rootOf(metric.getInstance(), path, subtrees);
            checkRepetition(metric, root, path);
            String alias = aliases.get(metric.getInstance());
            metricItems.put(metric, new SelectItem(metric.getAggregation().render(metric.argument(alias)),
                metric.getName(), alias, SelectItem.Kind.METRIC));
        }

        List<CompiledJoinStep> outer = new ArrayList<>();
        Set<FilterBinding> pushed = new HashSet<>();
        List<FanOutMarker> markers = new ArrayList<>();
        List<PathStep> pathSteps = path.getSteps();
        for (int i = 0; i < pathSteps.size(); i++) {
            PathStep step = pathSteps.get(i);
            CompiledJoinStep compiled = steps.get(i);
            if (subtrees.containsKey(step.getChild())) {
                Set<TableRef> members = subtrees.get(step.getChild());
                checkSelectedDimensions(step, compiled, members, dimensions);
                PreAggregation derived = preAggregate(step, compiled, members, pathSteps, steps, aliases,
                    metrics, metricItems, filters, pushed);
                outer.add(compiled.withPreAggregation(derived));
                markers.add(new FanOutMarker(step.getRelation().getName(), step.getParent().getTable(),
                    step.getChild().getTable(), compiled.getRightAlias(), step.cardinality(),
                    compiled.getRightColumns(), FanOutMarker.PRE_AGGREGATE));
                logger.info("Pre-aggregating {} {} on {} to avoid {} fan-out", step.getChild(),
                    compiled.getRightAlias(), compiled.getRightColumns(), step.cardinality().getValue());
            } else if (!isInside(step.getChild(), subtrees)) {
                outer.add(compiled);
            }
        }
        return new Result(outer, metricItems, pushed, markers);
    }

    /**
     * Roots of the fan-out subtrees and their members. A to-many step below a root cannot be
     * neutralized by one grouping and is rejected.
     */
    private Map<TableRef, Set<TableRef>> findFanOutSubtrees(JoinPath path) {
        Map<TableRef, Set<TableRef>> subtrees = new LinkedHashMap<>();
        for (PathStep step : path.getSteps()) {
            boolean inside = isInside(step.getParent(), subtrees);
            if (!step.cardinality().isToMany()) {
                continue;
            }
            if (inside) {
                throw new UnsafeFanOutException(step.getRelation().getName(), step.getChild().getTable(),
                    "nested " + step.cardinality().getValue() + " join inside a pre-aggregated subtree");
            }
            subtrees.put(step.getChild(), path.subtree(step.getChild()));
        }
        return subtrees;
    }

    private void checkRepetition(MetricBinding metric, TableRef root, JoinPath path) {
        boolean preAggregated = !root.equals(path.getGrain());
        if (preAggregated && metric.getAggregation() == Aggregation.COUNT_DISTINCT) {
            PathStep step = path.stepFor(root);
            throw new UnsafeFanOutException(step.getRelation().getName(), metric.getInstance().getTable(),
                "COUNT_DISTINCT metric '" + metric.getName() + "' cannot be re-aggregated after pre-aggregation");
        }
        if (!metric.getAggregation().isDuplicateSensitive()) {
            return;
        }
        for (PathStep step : path.stepsBetween(root, metric.getInstance())) {
            if (step.cardinality().isFromMany()) {
                throw new UnsafeFanOutException(step.getRelation().getName(), metric.getInstance().getTable(),
                    metric.getAggregation() + " metric '" + metric.getName() + "' would be repeated once per "
                        + step.getParent().getTable() + " row");
            }
        }
    }

    private void checkSelectedDimensions(PathStep step, CompiledJoinStep compiled, Set<TableRef> members,
                                         List<DimensionBinding> dimensions) {
        for (DimensionBinding dimension : dimensions) {
            if (!dimension.isSelected() || !members.contains(dimension.getInstance())) {
                continue;
            }
            boolean keyColumn = dimension.getInstance().equals(step.getChild())
                && containsIgnoreCase(compiled.getRightColumns(), dimension.getColumn());
            if (!keyColumn) {
                throw new UnsafeFanOutException(step.getRelation().getName(), dimension.getInstance().getTable(),
                    "selected dimension '" + dimension.getName() + "' is not determined by join key "
                        + compiled.getRightColumns());
            }
        }
    }

    private PreAggregation preAggregate(PathStep root, CompiledJoinStep compiled, Set<TableRef> members,
                                        List<PathStep> pathSteps, List<CompiledJoinStep> steps,
                                        Map<TableRef, String> aliases, List<MetricBinding> metrics,
                                        Map<MetricBinding, SelectItem> metricItems, List<FilterBinding> filters,
                                        Set<FilterBinding> pushed) {
        String alias = compiled.getRightAlias();
        List<SelectItem> aggregates = new ArrayList<>();
        for (MetricBinding metric : metrics) {
            if (!members.contains(metric.getInstance())) {
                continue;
            }
            String argument = metric.argument(aliases.get(metric.getInstance()));
            String name = metric.getName();
            String outerExpression;
            switch (metric.getAggregation()) {
                case COUNT:
                    aggregates.add(new SelectItem("COUNT(" + argument + ")", name, alias, SelectItem.Kind.METRIC));
                    outerExpression = "COALESCE(SUM(" + alias + "." + name + "), 0)";
                    break;
                case AVG:
                    aggregates.add(new SelectItem("SUM(" + argument + ")", name + "_sum", alias, SelectItem.Kind.METRIC));
                    aggregates.add(new SelectItem("COUNT(" + argument + ")", name + "_count", alias, SelectItem.Kind.METRIC));
                    outerExpression = "1.0 * SUM(" + alias + "." + name + "_sum) / NULLIF(SUM(" + alias + "." + name + "_count), 0)";
                    break;
                default:
                    // SUM, MIN and MAX re-aggregate with themselves.
                    aggregates.add(new SelectItem(metric.getAggregation().render(argument), name, alias, SelectItem.Kind.METRIC));
                    outerExpression = metric.getAggregation().render(alias + "." + name);
                    break;
            }
            metricItems.put(metric, new SelectItem(outerExpression, name, alias, SelectItem.Kind.METRIC));
        }

        List<CompiledJoinStep> innerJoins = new ArrayList<>();
        for (int i = 0; i < pathSteps.size(); i++) {
            TableRef child = pathSteps.get(i).getChild();
            if (members.contains(child) && !child.equals(root.getChild())) {
                innerJoins.add(steps.get(i));
            }
        }

        List<String> innerFilters = new ArrayList<>();
        for (FilterBinding filter : filters) {
            if (members.contains(filter.getInstance())) {
                innerFilters.add(sqlCompiler.renderFilter(aliases.get(filter.getInstance()) + "." + filter.getTarget().getColumn(),
                    filter.getPredicate().getOperator(), filter.getPredicate().getValue()));
                pushed.add(filter);
            }
        }
        return new PreAggregation(root.getChild().getTable(), alias, compiled.getRightColumns(), aggregates,
            innerJoins, innerFilters);
    }

    private static TableRef rootOf(TableRef instance, JoinPath path, Map<TableRef, Set<TableRef>> subtrees) {
        for (Map.Entry<TableRef, Set<TableRef>> entry : subtrees.entrySet()) {
            if (entry.getValue().contains(instance)) {
                return entry.getKey();
            }
        }
        return path.getGrain();
    }

    private static boolean isInside(TableRef instance, Map<TableRef, Set<TableRef>> subtrees) {
        for (Set<TableRef> members : subtrees.values()) {
            if (members.contains(instance)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsIgnoreCase(List<String> columns, String column) {
        String wanted = column.toLowerCase(Locale.ROOT);
        for (String candidate : columns) {
            if (candidate.toLowerCase(Locale.ROOT).equals(wanted)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Outer join list and select expressions after the fan-out rewrite.
     */
    public static final class Result {
        private final List<CompiledJoinStep> joinSteps;
        private final Map<MetricBinding, SelectItem> metricItems;
        private final Set<FilterBinding> pushedFilters;
        private final List<FanOutMarker> markers;

        private Result(List<CompiledJoinStep> joinSteps, Map<MetricBinding, SelectItem> metricItems,
                       Set<FilterBinding> pushedFilters, List<FanOutMarker> markers) {
            this.joinSteps = List.copyOf(joinSteps);
            this.metricItems = metricItems;
            this.pushedFilters = pushedFilters;
            this.markers = List.copyOf(markers);
        }

        public List<CompiledJoinStep> getJoinSteps() {
            return joinSteps;
        }

        public SelectItem metricItem(MetricBinding metric) {
            return metricItems.get(metric);
        }

        public boolean isPushedDown(FilterBinding filter) {
            return pushedFilters.contains(filter);
        }

        public List<FanOutMarker> getMarkers() {
            return markers;
        }
    }
}
