package org.iceforge.kpigate.sql;

/**
 * Closed set of column identifiers that may appear in generated SQL.
 */
public final class Columns {
    private Columns() {}

    public static final String MONTH = "cal_yr_mo_nbr";
    public static final String SEGMENT = "segment";
    public static final String MEGABRAND = "megabrand";
    public static final String REGION = "sls_regn_cd";
    public static final String STATE = "mktng_st_cd";
    public static final String WHOLESALER = "wslr_nbr";
    public static final String CHANNEL = "channel";

    /** Segment suppressed unless the caller opts in. */
    public static final String EXCLUDED_SEGMENT = "AO";

    public static final String DIMENSION_ALIAS = "dimension";
    public static final String CURRENT_ALIAS = "value_cy";
    public static final String PRIOR_ALIAS = "value_ly";
}
