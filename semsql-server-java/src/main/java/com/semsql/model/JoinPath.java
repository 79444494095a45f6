package com.semsql.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered, acyclic set of join steps anchored at the grain table. Parents always precede
 * their children.
 */
public final class JoinPath {
    private final TableRef grain;
    private final List<PathStep> steps;

    public JoinPath(TableRef grain, List<PathStep> steps) {
        this.grain = Objects.requireNonNull(grain, "grain");
        this.steps = List.copyOf(steps);
    }

    public TableRef getGrain() {
        return grain;
    }

    public List<PathStep> getSteps() {
        return steps;
    }

    public boolean contains(TableRef ref) {
        return grain.equals(ref) || stepFor(ref) != null;
    }

    /**
     * The step that joins {@code ref}, or {@code null} for the grain and for unknown instances.
     */
    public PathStep stepFor(TableRef ref) {
        for (PathStep step : steps) {
            if (step.getChild().equals(ref)) {
                return step;
            }
        }
        return null;
    }

    /**
     * {@code root} and every instance joined below it, in path order.
     */
    public Set<TableRef> subtree(TableRef root) {
        Set<TableRef> members = new LinkedHashSet<>();
        members.add(root);
        for (PathStep step : steps) {
            if (members.contains(step.getParent())) {
                members.add(step.getChild());
            }
        }
        return members;
    }

    /**
     * Steps leading from {@code from} down to {@code to}, outermost first. Empty when
     * {@code to} is {@code from} or is not below it.
     */
    public List<PathStep> stepsBetween(TableRef from, TableRef to) {
        List<PathStep> chain = new ArrayList<>();
        TableRef current = to;
        while (!current.equals(from)) {
            PathStep step = stepFor(current);
            if (step == null) {
                return List.of();
            }
            chain.add(0, step);
            current = step.getParent();
        }
        return chain;
    }

    @Override
    public String toString() {
        return "JoinPath{grain=" + grain + ", steps=" + steps + "}";
    }
}
