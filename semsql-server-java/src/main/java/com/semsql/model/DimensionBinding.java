package com.semsql.model;

/**
 * A dimension attached to its table instance, with the usage that decides its join kind.
 * Filters on a selected dimension promote it to {@link DimensionUsage#BOTH}.
 */
public final class DimensionBinding {
    private final DimensionIntent dimension;
    private final TableRef instance;
    private final String column;
    private final DimensionUsage effectiveUsage;
    private final boolean implicit;

    public DimensionBinding(DimensionIntent dimension, TableRef instance, String column,
                            DimensionUsage effectiveUsage, boolean implicit) {
        this.dimension = dimension;
        this.instance = instance;
        this.column = column;
        this.effectiveUsage = effectiveUsage;
        this.implicit = implicit;
    }

    public DimensionIntent getDimension() {
        return dimension;
    }

    public TableRef getInstance() {
        return instance;
    }

    public String getColumn() {
        return column;
    }

    public DimensionUsage getEffectiveUsage() {
        return effectiveUsage;
    }

    /**
     * True for dimensions synthesized from a filter that names no dimension intent.
     */
    public boolean isImplicit() {
        return implicit;
    }

    public String getName() {
        return dimension.getName();
    }

    public boolean isSelected() {
        return effectiveUsage != DimensionUsage.FILTER;
    }
}
