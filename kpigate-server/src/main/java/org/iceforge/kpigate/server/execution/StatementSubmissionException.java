package org.iceforge.kpigate.server.execution;

/**
 * The service refused the statement at submit time. Carries the upstream HTTP status (mirrored to
 * the caller) and the generated SQL for diagnosis.
 */
public class StatementSubmissionException extends RuntimeException {

    private final int upstreamStatus;
    private final String remoteMessage;
    private final String sql;

    public StatementSubmissionException(int upstreamStatus, String remoteMessage, String sql) {
        super("Statement submission failed with HTTP " + upstreamStatus);
        this.upstreamStatus = upstreamStatus;
        this.remoteMessage = remoteMessage;
        this.sql = sql;
    }

    public StatementSubmissionException(int upstreamStatus, String remoteMessage, String sql, Throwable cause) {
        super("Statement submission failed with HTTP " + upstreamStatus, cause);
        this.upstreamStatus = upstreamStatus;
        this.remoteMessage = remoteMessage;
        this.sql = sql;
    }

    public int upstreamStatus() { return upstreamStatus; }
    public String remoteMessage() { return remoteMessage; }
    public String sql() { return sql; }
}
