package org.iceforge.kpigate.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import org.iceforge.kpigate.server.execution.DatabricksStatementClient;
import org.iceforge.kpigate.server.execution.Sleeper;
import org.iceforge.kpigate.server.execution.StatementExecutionClient;
import org.iceforge.kpigate.server.execution.StatementPoller;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;

@Configuration
public class StatementServiceConfig {

    @Bean
    public Clock statementClock() {
        return Clock.systemUTC();
    }

    @Bean
    public StatementExecutionClient statementExecutionClient(WebClient.Builder builder,
                                                             StatementServiceProperties props,
                                                             ObjectMapper mapper) {
        HttpClient httpClient = HttpClient.create()
                .compress(true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) props.connectTimeout().toMillis());

        WebClient.Builder b = builder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .baseUrl(props.baseUrl());
        if (props.token() != null) {
            b.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.token());
        }
        return new DatabricksStatementClient(b.build(), mapper, props.callTimeout());
    }

    @Bean
    public StatementPoller statementPoller(StatementExecutionClient client,
                                           StatementServiceProperties props,
                                           Clock statementClock) {
        return new StatementPoller(client, props, statementClock, Sleeper.threadSleep());
    }
}
