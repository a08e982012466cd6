package org.iceforge.kpigate.server.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Browser-facing glue: CORS for the dashboard origins and the {@code x-mc-*} debug headers.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    static final String API_HEADER = "x-mc-api";
    static final String VERSION_HEADER = "x-mc-version";

    private final KpiGatewayProperties props;

    public WebConfig(KpiGatewayProperties props) {
        this.props = Objects.requireNonNull(props);
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOriginPatterns(originPatterns().toArray(String[]::new))
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("Content-Type", "Authorization", "Accept", API_HEADER, VERSION_HEADER)
                .exposedHeaders(API_HEADER, "x-mc-origin", VERSION_HEADER, "Content-Length", "Access-Control-Allow-Origin")
                .maxAge(86400);
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new DiagnosticHeaders(props.apiVersion())).addPathPatterns("/api/**");
    }

    List<String> originPatterns() {
        List<String> patterns = new ArrayList<>(props.cors().allowedOrigins());
        if (props.cors().allowLocalhost()) {
            patterns.add("http://localhost:[*]");
            patterns.add("https://localhost:[*]");
            patterns.add("http://127.0.0.1:[*]");
        }
        return patterns;
    }

    /** Names the handling endpoint and API version on every response. */
    static final class DiagnosticHeaders implements HandlerInterceptor {
        private final String version;

        DiagnosticHeaders(String version) {
            this.version = version;
        }

        @Override
        public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
            String uri = request.getRequestURI();
            response.setHeader(API_HEADER, uri.substring(uri.lastIndexOf('/') + 1));
            response.setHeader(VERSION_HEADER, version);
            String origin = request.getHeader("Origin");
            if (origin != null) {
                response.setHeader("x-mc-origin", origin);
            }
            return true;
        }
    }
}
