package org.iceforge.kpigate.server.execution;

import java.time.Duration;

/**
 * Submit/poll contract of the remote asynchronous SQL service.
 */
public interface StatementExecutionClient {

    /**
     * Submits one statement. Not idempotent; callers never retry it.
     *
     * @throws StatementSubmissionException when the service rejects the call or cannot be reached
     */
    StatementModels.StatementResponse submit(String sql, String warehouseId);

    /**
     * Fetches the current status (and result, once finished) of a submitted statement.
     *
     * @param timeout upper bound for this call
     * @throws StatementServiceException when the status call fails or exceeds {@code timeout}
     */
    StatementModels.StatementResponse fetch(String statementId, Duration timeout);
}
