package com.semsql.model;

public final class FilterBinding {
    private final FilterPredicate predicate;
    private final DimensionBinding target;

    public FilterBinding(FilterPredicate predicate, DimensionBinding target) {
        this.predicate = predicate;
        this.target = target;
    }

    public FilterPredicate getPredicate() {
        return predicate;
    }

    public DimensionBinding getTarget() {
        return target;
    }

    public TableRef getInstance() {
        return target.getInstance();
    }
}
