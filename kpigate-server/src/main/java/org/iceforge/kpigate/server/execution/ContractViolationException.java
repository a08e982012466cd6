package org.iceforge.kpigate.server.execution;

/**
 * The statement service answered with something outside its documented contract (missing handle,
 * SUCCEEDED without a result, malformed rows). Reported as an internal fault.
 */
public class ContractViolationException extends RuntimeException {

    public ContractViolationException(String message) {
        super(message);
    }

    public ContractViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
