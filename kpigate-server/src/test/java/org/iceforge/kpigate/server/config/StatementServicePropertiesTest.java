package org.iceforge.kpigate.server.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class StatementServicePropertiesTest {

    @Test
    void defaultsApplyWhenUnsetOrNonPositive() {
        StatementServiceProperties p = new StatementServiceProperties(
                "h", "t", "w", null, Duration.ZERO, Duration.ofSeconds(-1), null);

        assertThat(p.pollInterval()).isEqualTo(Duration.ofMillis(350));
        assertThat(p.timeout()).isEqualTo(Duration.ofSeconds(15));
        assertThat(p.connectTimeout()).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void baseUrl_addsSchemeAndStripsTrailingSlash() {
        assertThat(props("adb-123.azuredatabricks.net/").baseUrl())
                .isEqualTo("https://adb-123.azuredatabricks.net");
        assertThat(props(" http://localhost:9999// ").baseUrl()).isEqualTo("http://localhost:9999");
        assertThat(props(null).baseUrl()).isEmpty();
    }

    @Test
    void configuredOnlyWithHostTokenAndWarehouse() {
        assertThat(new StatementServiceProperties("h", "t", "w", null, null, null, null).isConfigured()).isTrue();
        assertThat(new StatementServiceProperties("h", " ", "w", null, null, null, null).isConfigured()).isFalse();
        assertThat(new StatementServiceProperties("h", "t", null, null, null, null, null).isConfigured()).isFalse();
    }

    @Test
    void healthIndicator_followsConfiguration() {
        assertThat(new StatementServiceHealthIndicator(props(null)).health().getStatus())
                .isEqualTo(Status.OUT_OF_SERVICE);

        StatementServiceHealthIndicator up = new StatementServiceHealthIndicator(props("dbx.example.com"));
        assertThat(up.health().getStatus()).isEqualTo(Status.UP);
        assertThat(up.health().getDetails())
                .containsEntry("host", "https://dbx.example.com")
                .doesNotContainValue("secret");
    }

    private static StatementServiceProperties props(String host) {
        return new StatementServiceProperties(host, "secret", "wh-1", null, null, null, null);
    }
}
