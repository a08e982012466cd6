package org.iceforge.kpigate.registry;

/**
 * Aggregate function applied to a KPI's value columns.
 * Additive metrics sum; ratio and rate metrics average.
 */
public enum Aggregation {
    SUM,
    AVG;

    public String apply(String column) {
        return name() + "(" + column + ")";
    }
}
