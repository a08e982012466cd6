package org.iceforge.kpigate.request;

import org.iceforge.kpigate.registry.KpiDescriptor;
import org.iceforge.kpigate.registry.KpiRegistry;

import java.util.Objects;

/**
 * A validated KPI query: the resolved descriptor plus typed grouping, scope, month and filters.
 */
public record KpiQuery(
        KpiDescriptor kpi,
        GroupBy groupBy,
        Scope scope,
        ReferenceMonth referenceMonth,
        KpiFilters filters
) {
    public KpiQuery {
        Objects.requireNonNull(kpi, "kpi");
        groupBy = groupBy == null ? GroupBy.TIME : groupBy;
        scope = scope == null ? Scope.YTD : scope;
        referenceMonth = referenceMonth == null ? ReferenceMonth.DEFAULT : referenceMonth;
        filters = filters == null ? KpiFilters.NONE : filters;
    }

    /**
     * Validates raw wire values. Throws {@link KpiRequestException} for a missing or unknown KPI
     * and for unknown groupBy/scope tokens.
     */
    public static KpiQuery of(String kpiKey, String groupBy, String scope, String maxMonth, KpiFilters filters) {
        if (kpiKey == null || kpiKey.isBlank()) {
            throw new KpiRequestException("Missing required field 'kpi'");
        }
        KpiDescriptor descriptor = KpiRegistry.resolve(kpiKey)
                .orElseThrow(() -> new KpiRequestException("KPI '" + kpiKey + "' is not yet implemented."));
        return new KpiQuery(
                descriptor,
                GroupBy.fromWire(groupBy),
                Scope.fromWire(scope),
                ReferenceMonth.parseOrDefault(maxMonth),
                filters
        );
    }
}
