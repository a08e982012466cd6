package org.iceforge.kpigate.request;

/** Time-window policy: the reference month alone, or the year through the reference month. */
public enum Scope {
    MTD,
    YTD;

    public static Scope fromWire(String token) {
        if (token == null || token.isBlank()) return YTD;
        try {
            return Scope.valueOf(token);
        } catch (IllegalArgumentException e) {
            throw new KpiRequestException("Unsupported scope '" + token + "'");
        }
    }
}
