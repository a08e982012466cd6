package org.iceforge.kpigate.server;

import org.iceforge.kpigate.server.config.KpiGatewayProperties;
import org.iceforge.kpigate.server.config.StatementServiceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({KpiGatewayProperties.class, StatementServiceProperties.class})
public class KpiGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(KpiGatewayApplication.class, args);
    }
}
