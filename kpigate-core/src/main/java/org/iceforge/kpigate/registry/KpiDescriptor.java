package org.iceforge.kpigate.registry;

import java.util.Objects;

/**
 * Static description of one KPI: where it lives and how it aggregates.
 *
 * <p>Current and prior period columns are derived from {@code valueColumn} as
 * {@code <col>_CY} and {@code <col>_LY}.
 */
public record KpiDescriptor(
        String key,
        String dataset,
        String valueColumn,
        Aggregation aggregation,
        boolean hasChannelDimension,
        String geographyColumn
) {
    public KpiDescriptor {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(dataset, "dataset");
        Objects.requireNonNull(valueColumn, "valueColumn");
        Objects.requireNonNull(aggregation, "aggregation");
        Objects.requireNonNull(geographyColumn, "geographyColumn");
    }

    public String currentColumn() {
        return valueColumn + "_CY";
    }

    public String priorColumn() {
        return valueColumn + "_LY";
    }
}
