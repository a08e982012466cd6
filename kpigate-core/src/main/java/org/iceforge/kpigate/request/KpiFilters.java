package org.iceforge.kpigate.request;

import java.util.List;
import java.util.Objects;

/**
 * Dimension filters of a KPI query. Lists are never null; null entries are dropped.
 *
 * <p>{@code includeAo} is an opt-in: only an explicit {@code TRUE} lifts the default "AO" segment
 * exclusion.
 */
public record KpiFilters(
        List<String> megabrand,
        List<String> region,
        List<String> state,
        List<String> wholesalerId,
        List<String> channel,
        Boolean includeAo
) {
    public static final KpiFilters NONE = new KpiFilters(null, null, null, null, null, null);

    public KpiFilters {
        megabrand = clean(megabrand);
        region = clean(region);
        state = clean(state);
        wholesalerId = clean(wholesalerId);
        channel = clean(channel);
    }

    public boolean excludesSegment() {
        return !Boolean.TRUE.equals(includeAo);
    }

    private static List<String> clean(List<String> values) {
        if (values == null || values.isEmpty()) return List.of();
        return values.stream().filter(Objects::nonNull).toList();
    }
}
