package org.iceforge.kpigate.server.result;

import com.fasterxml.jackson.databind.JsonNode;
import org.iceforge.kpigate.server.execution.ContractViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the {@code result.data_array} payload of a SUCCEEDED statement.
 *
 * <p>KPI statements return {@code dimension, value_cy, value_ly}. Anything that does not fit is a
 * broken contract with the statement service, never a client error. Exception messages never carry
 * remote values; those go to the log.
 */
public final class ResultNormalizer {
    private static final Logger log = LoggerFactory.getLogger(ResultNormalizer.class);

    private static final String DATA_ARRAY = "data_array";
    private static final String ROW_COUNT = "row_count";

    private ResultNormalizer() {}

    public static QueryResult normalize(JsonNode result) {
        List<QueryResult.Row> rows = new ArrayList<>();
        for (JsonNode row : dataArray(result)) {
            if (!row.isArray() || row.size() < 3) {
                log.error("Malformed KPI result row: {}", row);
                throw new ContractViolationException("Result row does not have 3 columns");
            }
            rows.add(new QueryResult.Row(
                    text(row.get(0)),
                    number(row.get(1)),
                    number(row.get(2))
            ));
        }
        return new QueryResult(rows);
    }

    /** First column of every row, for single-column lookups such as filter options. */
    public static List<String> firstColumn(JsonNode result) {
        List<String> out = new ArrayList<>();
        for (JsonNode row : dataArray(result)) {
            if (!row.isArray() || row.isEmpty()) {
                log.error("Malformed option result row: {}", row);
                throw new ContractViolationException("Result row is empty");
            }
            out.add(text(row.get(0)));
        }
        return out;
    }

    private static Iterable<JsonNode> dataArray(JsonNode result) {
        if (result == null || result.isNull() || !result.isObject()) {
            throw new ContractViolationException("SUCCEEDED statement without a result payload");
        }
        JsonNode data = result.get(DATA_ARRAY);
        if (data == null || data.isNull()) {
            // the service omits data_array for empty results
            if (result.path(ROW_COUNT).asLong(-1) == 0) return List.of();
            throw new ContractViolationException("Result payload has no data_array");
        }
        if (!data.isArray()) {
            throw new ContractViolationException("data_array is not an array");
        }
        return data;
    }

    private static String text(JsonNode n) {
        return (n == null || n.isNull()) ? null : n.asText();
    }

    private static BigDecimal number(JsonNode n) {
        if (n == null || n.isNull()) return null;
        if (n.isNumber()) return n.decimalValue();
        String s = n.asText().trim();
        if (s.isEmpty()) return null;
        try {
            return new BigDecimal(s);
        } catch (NumberFormatException e) {
            log.error("Non-numeric KPI value in result: {}", s);
            throw new ContractViolationException("Non-numeric value in result", e);
        }
    }
}
