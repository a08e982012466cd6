package org.iceforge.kpigate.sql;

import org.iceforge.kpigate.request.KpiFilters;
import org.iceforge.kpigate.request.KpiQuery;
import org.iceforge.kpigate.request.ReferenceMonth;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a validated {@link KpiQuery} into an ordered list of predicates, each safe to join with
 * {@code AND}.
 *
 * <p>Order is fixed so the generated SQL is deterministic:
 * <ol>
 *   <li>time scope</li>
 *   <li>segment exclusion</li>
 *   <li>megabrand, region, state, wholesaler, channel IN lists</li>
 * </ol>
 * A channel filter on a KPI without a channel column compiles to {@link #MATCH_NONE}.
 */
public final class FilterCompiler {

    public static final String MATCH_NONE = "1 = 0";

    private FilterCompiler() {}

    public static List<String> compile(KpiQuery query) {
        List<String> predicates = new ArrayList<>();
        predicates.add(timeScope(query));

        KpiFilters f = query.filters();
        if (f.excludesSegment()) {
            predicates.add(Columns.SEGMENT + " <> " + SqlLiterals.quote(Columns.EXCLUDED_SEGMENT));
        }

        addIn(predicates, Columns.MEGABRAND, f.megabrand());
        addIn(predicates, Columns.REGION, f.region());
        addIn(predicates, Columns.STATE, f.state());
        addIn(predicates, Columns.WHOLESALER, f.wholesalerId());

        if (!f.channel().isEmpty()) {
            if (query.kpi().hasChannelDimension()) {
                predicates.add(SqlLiterals.inList(Columns.CHANNEL, f.channel()));
            } else {
                predicates.add(MATCH_NONE);
            }
        }
        return predicates;
    }

    static String timeScope(KpiQuery query) {
        ReferenceMonth month = query.referenceMonth();
        return switch (query.scope()) {
            case MTD -> Columns.MONTH + " = " + month.token();
            case YTD -> Columns.MONTH + " BETWEEN " + month.yearStart().token() + " AND " + month.token();
        };
    }

    private static void addIn(List<String> predicates, String column, List<String> values) {
        if (!values.isEmpty()) {
            predicates.add(SqlLiterals.inList(column, values));
        }
    }
}
