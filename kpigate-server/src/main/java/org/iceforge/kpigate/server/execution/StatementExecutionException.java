package org.iceforge.kpigate.server.execution;

/**
 * A submitted statement ended without a usable result: FAILED, CANCELED, or locally TIMED_OUT.
 */
public class StatementExecutionException extends RuntimeException {

    private final StatementState state;
    private final String statementId;
    private final String remoteMessage;

    public StatementExecutionException(StatementJob job) {
        super("Statement " + job.statementId() + " ended in " + job.state());
        this.state = job.state();
        this.statementId = job.statementId();
        this.remoteMessage = job.errorMessage();
    }

    public StatementState state() { return state; }
    public String statementId() { return statementId; }
    public String remoteMessage() { return remoteMessage; }

    public boolean timedOut() {
        return state == StatementState.TIMED_OUT;
    }
}
