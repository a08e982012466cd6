package org.iceforge.kpigate.server.execution;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One submitted statement, as seen by the polling loop.
 *
 * <p>Transitions: PENDING -> RUNNING -> {SUCCEEDED | FAILED | CANCELED}, plus the local TIMED_OUT.
 * Once terminal, further updates are ignored. Confined to the request thread that created it.
 */
public final class StatementJob {

    private final String statementId;
    private final Instant submittedAt;
    private final Instant deadline;

    private StatementState state;
    private JsonNode result;
    private String errorMessage;
    private int polls;
    private Instant updatedAt;

    private StatementJob(String statementId, Instant submittedAt, Instant deadline) {
        this.statementId = statementId;
        this.submittedAt = submittedAt;
        this.deadline = deadline;
        this.state = StatementState.PENDING;
        this.updatedAt = submittedAt;
    }

    /**
     * Starts tracking a statement from its submit response.
     *
     * @throws ContractViolationException if the response is non-terminal but carries no handle
     */
    public static StatementJob submitted(StatementModels.StatementResponse response, Instant now, Duration timeout) {
        Objects.requireNonNull(response, "response");
        StatementJob job = new StatementJob(response.statementId(), now, now.plus(timeout));
        job.apply(response, now);
        if (!job.isTerminal() && (job.statementId == null || job.statementId.isBlank())) {
            throw new ContractViolationException("No statement_id returned");
        }
        return job;
    }

    /** Replaces the last-known status with a fresh poll response. */
    public void update(StatementModels.StatementResponse response, Instant now) {
        if (state.isTerminal() || response == null) return;
        polls++;
        apply(response, now);
    }

    public void markTimedOut(Instant now) {
        if (state.isTerminal()) return;
        state = StatementState.TIMED_OUT;
        updatedAt = now;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public boolean isExpired(Instant now) {
        return remaining(now).isZero();
    }

    /** Time left before the deadline, never negative. */
    public Duration remaining(Instant now) {
        Duration left = Duration.between(now, deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    private void apply(StatementModels.StatementResponse response, Instant now) {
        // unknown tokens leave the state as it was; the deadline still ends the loop
        StatementState.fromRemote(response.stateToken()).ifPresent(s -> state = s);
        if (response.result() != null) {
            result = response.result();
        }
        if (response.status() != null && response.status().error() != null) {
            errorMessage = response.status().error().message();
        }
        updatedAt = now;
    }

    public String statementId() { return statementId; }
    public StatementState state() { return state; }
    public JsonNode result() { return result; }
    public String errorMessage() { return errorMessage; }
    public int polls() { return polls; }
    public Instant submittedAt() { return submittedAt; }
    public Instant deadline() { return deadline; }
    public Instant updatedAt() { return updatedAt; }

    public Duration elapsed() {
        return Duration.between(submittedAt, updatedAt);
    }
}
