package org.iceforge.kpigate.request;

/**
 * Raised when a caller's query cannot be compiled (unknown KPI, bad enum token, wrong contract).
 * Always a client error; nothing has been sent to the warehouse when this is thrown.
 */
public class KpiRequestException extends RuntimeException {

    public KpiRequestException(String message) {
        super(message);
    }
}
