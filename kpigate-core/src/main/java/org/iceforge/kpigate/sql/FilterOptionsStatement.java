package org.iceforge.kpigate.sql;

import org.iceforge.kpigate.request.KpiRequestException;

import java.util.Set;

/**
 * Distinct-value lookup used to populate dashboard dropdowns.
 *
 * <p>Both the column and the table are caller-named, so both are checked against closed
 * allowlists before being rendered as identifiers.
 */
public final class FilterOptionsStatement {

    public static final int ROW_CAP = 2000;

    static final String SCHEMA = "commercial_dev.capabilities.";

    static final Set<String> ALLOWED_DIMENSIONS = Set.of(
            Columns.WHOLESALER, Columns.STATE, Columns.REGION, Columns.CHANNEL, Columns.MEGABRAND);

    static final Set<String> ALLOWED_TABLES = Set.of(
            "mbmc_actuals_volume", "mbmc_actuals_revenue", "mbmc_actuals_distro");

    private FilterOptionsStatement() {}

    public static String assemble(String dimension, String table) {
        if (dimension == null || table == null
                || !ALLOWED_DIMENSIONS.contains(dimension) || !ALLOWED_TABLES.contains(table)) {
            throw new KpiRequestException("Invalid dimension or table requested");
        }
        return "SELECT DISTINCT " + dimension + " AS label\n"
                + "FROM " + SCHEMA + table + "\n"
                + "WHERE " + dimension + " IS NOT NULL\n"
                + "ORDER BY " + dimension + " ASC\n"
                + "LIMIT " + ROW_CAP;
    }
}
