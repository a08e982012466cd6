package org.iceforge.kpigate.server.execution;

import java.util.Optional;

/**
 * Lifecycle of a submitted statement. {@link #TIMED_OUT} is local: the remote service never reports
 * it, it means this process stopped waiting.
 */
public enum StatementState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELED,
    TIMED_OUT;

    /** Terminal as reported by the remote service. */
    public boolean isRemoteTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELED;
    }

    public boolean isTerminal() {
        return isRemoteTerminal() || this == TIMED_OUT;
    }

    /** Maps a remote {@code status.state} token. Unknown tokens (and the local-only TIMED_OUT) map to empty. */
    public static Optional<StatementState> fromRemote(String token) {
        if (token == null) return Optional.empty();
        for (StatementState s : values()) {
            if (s != TIMED_OUT && s.name().equals(token)) return Optional.of(s);
        }
        return Optional.empty();
    }
}
