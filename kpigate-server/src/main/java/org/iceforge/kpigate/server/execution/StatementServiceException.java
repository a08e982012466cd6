package org.iceforge.kpigate.server.execution;

/** A status fetch against the statement service failed (non-2xx, I/O error or call timeout). */
public class StatementServiceException extends RuntimeException {

    public StatementServiceException(String message) {
        super(message);
    }

    public StatementServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
