package org.iceforge.kpigate.registry;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Process-wide table of supported KPIs, keyed by metric identifier.
 *
 * <p>Lookups are exact and case-sensitive. The table is built once and never mutated.
 */
public final class KpiRegistry {

    private static final String CATALOG = "commercial_dev.capabilities.";

    private static final Map<String, KpiDescriptor> DESCRIPTORS = Map.of(
            "volume", new KpiDescriptor("volume", CATALOG + "mbmc_actuals_volume",
                    "STRs", Aggregation.SUM, true, "wslr_nbr"),
            "revenue", new KpiDescriptor("revenue", CATALOG + "mbmc_actuals_revenue",
                    "net_rev", Aggregation.SUM, true, "wslr_nbr"),
            "share", new KpiDescriptor("share", CATALOG + "mbmc_actuals_share",
                    "share", Aggregation.AVG, false, "mktng_st_cd"),
            "distro", new KpiDescriptor("distro", CATALOG + "mbmc_actuals_distro",
                    "distro_pts", Aggregation.AVG, false, "wslr_nbr")
    );

    private KpiRegistry() {}

    public static Optional<KpiDescriptor> resolve(String key) {
        if (key == null) return Optional.empty();
        return Optional.ofNullable(DESCRIPTORS.get(key));
    }

    public static Collection<KpiDescriptor> all() {
        return DESCRIPTORS.values();
    }
}
