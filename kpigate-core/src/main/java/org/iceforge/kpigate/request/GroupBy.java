package org.iceforge.kpigate.request;

import java.util.Locale;

public enum GroupBy {
    TIME,
    MEGABRAND,
    REGION,
    STATE,
    WHOLESALER,
    CHANNEL,
    TOTAL;

    /** Parses the wire token ("time", "megabrand", ...). {@code null} or blank means {@link #TIME}. */
    public static GroupBy fromWire(String token) {
        if (token == null || token.isBlank()) return TIME;
        for (GroupBy g : values()) {
            if (g.wireName().equals(token)) return g;
        }
        throw new KpiRequestException("Unsupported groupBy '" + token + "'");
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
