package org.iceforge.kpigate.server.execution;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Wire models of the Databricks SQL Statement Execution API (only the fields we read or send).
 */
public final class StatementModels {

    private StatementModels() {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ExecuteRequest(
            String statement,
            @JsonProperty("warehouse_id") String warehouseId
    ) {}

    /**
     * Body of both the submit response and the status fetch. {@code result} is kept as a raw tree
     * because it is passed back to the caller unchanged.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StatementResponse(
            @JsonProperty("statement_id") String statementId,
            Status status,
            JsonNode result
    ) {
        public String stateToken() {
            return status == null ? null : status.state();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Status(
            String state,
            ServiceError error
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ServiceError(
            @JsonProperty("error_code") String errorCode,
            String message
    ) {}
}
