package org.iceforge.kpigate.server.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import org.iceforge.kpigate.request.KpiFilters;
import org.iceforge.kpigate.server.result.QueryResult;

import java.util.List;

/**
 * JSON contract of the dashboard-facing endpoints.
 */
public final class KpiApiModels {

    private KpiApiModels() {}

    public static final String CONTRACT_VERSION = "kpi_request.v1";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record KpiRequest(
            @JsonProperty("contract_version") String contractVersion,
            String kpi,
            String groupBy,
            @JsonProperty("max_month") String maxMonth,
            String scope,
            Filters filters,
            Boolean ping
    ) {
        public boolean isPing() {
            return Boolean.TRUE.equals(ping);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Filters(
            List<String> megabrand,
            List<String> region,
            List<String> state,
            @JsonProperty("wholesaler_id") List<String> wholesalerId,
            List<String> channel,
            @JsonProperty("include_ao") JsonNode includeAo
    ) {
        /** Only a JSON {@code true} lifts the AO exclusion; strings and numbers do not. */
        public KpiFilters toKpiFilters() {
            boolean optIn = includeAo != null && includeAo.isBoolean() && includeAo.booleanValue();
            return new KpiFilters(megabrand, region, state, wholesalerId, channel, optIn);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record KpiResponse(
            boolean ok,
            JsonNode result,
            List<QueryResult.Row> rows,
            String version,
            Meta meta
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Meta(
            String sql,
            @JsonProperty("statement_id") String statementId
    ) {}

    public record PingResponse(boolean ok, String mode, String version) {}

    public record StatusResponse(boolean ok, String status, String version, String note) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FilterOptionsRequest(String dimension, String table) {}

    public record FilterOptionsResponse(boolean ok, List<Option> options) {}

    public record Option(String label, String value) {}

    /** Error envelope; only the fields relevant to the failure kind are present. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorResponse(
            boolean ok,
            String error,
            @JsonProperty("dbx_msg") String dbxMsg,
            String sql,
            String state,
            String details
    ) {
        public static ErrorResponse of(String error) {
            return new ErrorResponse(false, error, null, null, null, null);
        }
    }
}
