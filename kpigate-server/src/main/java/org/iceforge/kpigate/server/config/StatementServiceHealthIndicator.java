package org.iceforge.kpigate.server.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Reports whether statement-service credentials are present. Makes no remote call.
 */
@Component("statementService")
public class StatementServiceHealthIndicator implements HealthIndicator {

    private final StatementServiceProperties props;

    public StatementServiceHealthIndicator(StatementServiceProperties props) {
        this.props = Objects.requireNonNull(props);
    }

    @Override
    public Health health() {
        if (!props.isConfigured()) {
            return Health.outOfService().withDetail("reason", "host, token or warehouse id missing").build();
        }
        return Health.up()
                .withDetail("host", props.baseUrl())
                .withDetail("warehouseId", props.warehouseId())
                .build();
    }
}
