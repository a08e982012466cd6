package org.iceforge.kpigate.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * HTTP surface settings: reported API version and browser origin policy.
 */
@ConfigurationProperties(prefix = "kpigate")
public record KpiGatewayProperties(
        String apiVersion,
        Cors cors
) {
    public KpiGatewayProperties {
        apiVersion = (apiVersion == null || apiVersion.isBlank()) ? "dev" : apiVersion;
        cors = cors == null ? new Cors(null, true) : cors;
    }

    /**
     * @param allowedOrigins exact origins allowed to call the API
     * @param allowLocalhost also allow any localhost / 127.0.0.1 origin, on any port
     */
    public record Cors(
            List<String> allowedOrigins,
            boolean allowLocalhost
    ) {
        public Cors {
            allowedOrigins = allowedOrigins == null ? List.of() : List.copyOf(allowedOrigins);
        }
    }
}
