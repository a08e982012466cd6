package org.iceforge.kpigate.server.execution;

import org.iceforge.kpigate.server.config.StatementServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Drives submit-then-poll for one statement on the calling thread.
 *
 * <p>The loop sleeps a fixed interval between status fetches and stops at the first terminal state
 * or when the deadline passes. Sleeps and status calls are both cut short at the deadline. No backoff, no resubmission, no remote cancel: a timed-out statement
 * keeps running on the warehouse.
 */
public class StatementPoller {
    private static final Logger log = LoggerFactory.getLogger(StatementPoller.class);

    private final StatementExecutionClient client;
    private final StatementServiceProperties props;
    private final Clock clock;
    private final Sleeper sleeper;

    public StatementPoller(StatementExecutionClient client,
                           StatementServiceProperties props,
                           Clock clock,
                           Sleeper sleeper) {
        this.client = Objects.requireNonNull(client, "client");
        this.props = Objects.requireNonNull(props, "props");
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Runs the statement to a terminal state. The returned job is SUCCEEDED, FAILED, CANCELED or
     * TIMED_OUT; interpreting that is up to the caller.
     *
     * @throws StatementSubmissionException if submission is rejected; nothing is polled
     * @throws ContractViolationException   if the submit response has no handle
     */
    public StatementJob run(String sql) {
        StatementModels.StatementResponse submitted = client.submit(sql, props.warehouseId());
        StatementJob job = StatementJob.submitted(submitted, clock.instant(), props.timeout());
        log.info("Submitted statement {} state={}", job.statementId(), job.state());

        Duration interval = props.pollInterval();
        while (!job.isTerminal()) {
            Duration remaining = job.remaining(clock.instant());
            if (remaining.isZero()) {
                job.markTimedOut(clock.instant());
                break;
            }
            pause(min(interval, remaining), job);
            remaining = job.remaining(clock.instant());
            if (remaining.isZero()) {
                continue;
            }
            try {
                // a status call never runs past the deadline
                job.update(client.fetch(job.statementId(), min(props.callTimeout(), remaining)), clock.instant());
                log.debug("Polled statement {} state={} poll={}", job.statementId(), job.state(), job.polls());
            } catch (StatementServiceException e) {
                log.warn("Status fetch failed for statement {}: {}", job.statementId(), e.getMessage());
            }
        }

        log.info("Statement {} finished state={} polls={} elapsedMs={}",
                job.statementId(), job.state(), job.polls(), job.elapsed().toMillis());
        return job;
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private void pause(Duration interval, StatementJob job) {
        try {
            sleeper.sleep(interval);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while polling statement " + job.statementId(), e);
        }
    }
}
