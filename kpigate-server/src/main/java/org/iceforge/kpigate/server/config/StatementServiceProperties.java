package org.iceforge.kpigate.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection settings for the Databricks SQL Statement Execution API.
 *
 * <p>Host, token and warehouse normally come from {@code DATABRICKS_HOST}, {@code DATABRICKS_TOKEN}
 * and {@code WAREHOUSE_ID}. Never log {@link #token()}.
 */
@ConfigurationProperties(prefix = "kpigate.statement-service")
public record StatementServiceProperties(
        String host,
        String token,
        String warehouseId,
        Duration pollInterval,
        Duration timeout,
        Duration connectTimeout,
        Duration callTimeout
) {
    public StatementServiceProperties {
        pollInterval = positiveOr(pollInterval, Duration.ofMillis(350));
        timeout = positiveOr(timeout, Duration.ofSeconds(15));
        connectTimeout = positiveOr(connectTimeout, Duration.ofSeconds(10));
        callTimeout = positiveOr(callTimeout, Duration.ofSeconds(5));
    }

    public boolean isConfigured() {
        return notBlank(host) && notBlank(token) && notBlank(warehouseId);
    }

    /** Host with a scheme and without a trailing slash. */
    public String baseUrl() {
        if (!notBlank(host)) return "";
        String h = host.trim();
        if (!h.startsWith("http://") && !h.startsWith("https://")) {
            h = "https://" + h;
        }
        while (h.endsWith("/")) {
            h = h.substring(0, h.length() - 1);
        }
        return h;
    }

    private static Duration positiveOr(Duration d, Duration fallback) {
        return (d == null || d.isNegative() || d.isZero()) ? fallback : d;
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
