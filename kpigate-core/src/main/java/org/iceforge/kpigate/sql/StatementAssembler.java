package org.iceforge.kpigate.sql;

import org.iceforge.kpigate.registry.KpiDescriptor;
import org.iceforge.kpigate.request.KpiQuery;

import java.util.List;

/**
 * Builds the single aggregate SELECT for a {@link KpiQuery}.
 *
 * <p>Result columns are always {@code dimension, value_cy, value_ly}, in that order.
 */
public final class StatementAssembler {

    public static final int ROW_CAP = 1000;

    static final String TOTAL_LABEL = "Total";
    static final String ALL_CHANNELS_LABEL = "All Channels";

    private StatementAssembler() {}

    private record Grouping(String dimension, String groupBy, String orderBy) {

        static Grouping byColumn(String column, String orderBy) {
            return new Grouping(column, column, orderBy);
        }

        static Grouping literal(String label) {
            return new Grouping(SqlLiterals.quote(label), null, null);
        }
    }

    public static String assemble(KpiQuery query) {
        KpiDescriptor kpi = query.kpi();
        List<String> predicates = FilterCompiler.compile(query);
        Grouping g = grouping(query);

        StringBuilder sql = new StringBuilder(256);
        sql.append("SELECT ")
                .append(g.dimension()).append(" AS ").append(Columns.DIMENSION_ALIAS).append(", ")
                .append(kpi.aggregation().apply(kpi.currentColumn())).append(" AS ").append(Columns.CURRENT_ALIAS).append(", ")
                .append(kpi.aggregation().apply(kpi.priorColumn())).append(" AS ").append(Columns.PRIOR_ALIAS)
                .append('\n');
        sql.append("FROM ").append(kpi.dataset()).append('\n');
        sql.append("WHERE ").append(String.join(" AND ", predicates)).append('\n');
        if (g.groupBy() != null) {
            sql.append("GROUP BY ").append(g.groupBy()).append('\n');
        }
        if (g.orderBy() != null) {
            sql.append("ORDER BY ").append(g.orderBy()).append('\n');
        }
        sql.append("LIMIT ").append(ROW_CAP);
        return sql.toString();
    }

    private static Grouping grouping(KpiQuery query) {
        String byValue = Columns.CURRENT_ALIAS + " DESC";
        return switch (query.groupBy()) {
            case TIME -> Grouping.byColumn(Columns.MONTH, Columns.MONTH + " ASC");
            case MEGABRAND -> Grouping.byColumn(Columns.MEGABRAND, byValue);
            case REGION -> Grouping.byColumn(Columns.REGION, byValue);
            case STATE -> Grouping.byColumn(Columns.STATE, byValue);
            case WHOLESALER -> Grouping.byColumn(query.kpi().geographyColumn(), byValue);
            case CHANNEL -> query.kpi().hasChannelDimension()
                    ? Grouping.byColumn(Columns.CHANNEL, byValue)
                    : Grouping.literal(ALL_CHANNELS_LABEL);
            case TOTAL -> Grouping.literal(TOTAL_LABEL);
        };
    }
}
