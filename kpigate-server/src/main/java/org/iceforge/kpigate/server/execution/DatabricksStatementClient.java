package org.iceforge.kpigate.server.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.codec.CodecException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Objects;

/**
 * {@link StatementExecutionClient} over the Databricks SQL Statement Execution REST API
 * ({@code /api/2.0/sql/statements}).
 *
 * <p>The {@link WebClient} is expected to carry the base URL and bearer token already.
 */
public class DatabricksStatementClient implements StatementExecutionClient {
    private static final Logger log = LoggerFactory.getLogger(DatabricksStatementClient.class);

    static final String STATEMENTS_PATH = "/api/2.0/sql/statements";
    private static final int MAX_MESSAGE_CHARS = 2_000;

    private final WebClient webClient;
    private final ObjectMapper mapper;
    private final Duration callTimeout;

    public DatabricksStatementClient(WebClient webClient, ObjectMapper mapper, Duration callTimeout) {
        this.webClient = Objects.requireNonNull(webClient, "webClient");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.callTimeout = callTimeout == null ? Duration.ofSeconds(10) : callTimeout;
    }

    @Override
    public StatementModels.StatementResponse submit(String sql, String warehouseId) {
        StatementModels.StatementResponse resp;
        try {
            resp = webClient.post()
                    .uri(STATEMENTS_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(new StatementModels.ExecuteRequest(sql, warehouseId))
                    .exchangeToMono(r -> readOrReject(r, sql))
                    .timeout(callTimeout)
                    .block();
        } catch (StatementSubmissionException | ContractViolationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Statement submit did not reach the service: {}", e.toString());
            throw new StatementSubmissionException(502, e.getMessage(), sql, e);
        }
        if (resp == null) {
            throw new ContractViolationException("Empty submit response");
        }
        return resp;
    }

    @Override
    public StatementModels.StatementResponse fetch(String statementId, Duration timeout) {
        StatementModels.StatementResponse resp;
        try {
            resp = webClient.get()
                    .uri(STATEMENTS_PATH + "/{id}", statementId)
                    .exchangeToMono(r -> {
                        if (r.statusCode().is2xxSuccessful()) {
                            return decode(r, "status");
                        }
                        return r.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(body -> Mono.error(new StatementServiceException(
                                        "Status fetch returned HTTP " + r.statusCode().value() + ": " + remoteMessage(body))));
                    })
                    .timeout(timeout == null ? callTimeout : timeout)
                    .block();
        } catch (StatementServiceException | ContractViolationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StatementServiceException("Status fetch failed: " + e.getMessage(), e);
        }
        if (resp == null) {
            throw new StatementServiceException("Empty status response for " + statementId);
        }
        return resp;
    }

    private Mono<StatementModels.StatementResponse> readOrReject(ClientResponse r, String sql) {
        if (r.statusCode().is2xxSuccessful()) {
            return decode(r, "submit");
        }
        int status = r.statusCode().value();
        return r.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> Mono.error(new StatementSubmissionException(status, remoteMessage(body), sql)));
    }

    private static Mono<StatementModels.StatementResponse> decode(ClientResponse r, String call) {
        return r.bodyToMono(StatementModels.StatementResponse.class)
                .onErrorMap(CodecException.class,
                        e -> new ContractViolationException("Malformed " + call + " response body", e));
    }

    /** The service's {@code message} field when the body is JSON, otherwise the (truncated) raw body. */
    String remoteMessage(String body) {
        if (body == null || body.isBlank()) return null;
        try {
            JsonNode n = mapper.readTree(body);
            if (n != null && n.hasNonNull("message")) {
                return n.get("message").asText();
            }
        } catch (Exception e) {
            log.debug("Non-JSON error body from statement service");
        }
        return body.length() > MAX_MESSAGE_CHARS ? body.substring(0, MAX_MESSAGE_CHARS) : body;
    }
}
