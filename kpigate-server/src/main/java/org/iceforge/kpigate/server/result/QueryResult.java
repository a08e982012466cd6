package org.iceforge.kpigate.server.result;

import java.math.BigDecimal;
import java.util.List;

/**
 * Typed rows of a KPI query, in the order the warehouse returned them.
 */
public record QueryResult(List<Row> rows) {

    public QueryResult {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public record Row(
            String dimension,
            BigDecimal currentValue,
            BigDecimal priorValue
    ) {}
}
