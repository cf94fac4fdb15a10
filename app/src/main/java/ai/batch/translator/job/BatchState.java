package ai.batch.translator.job;

/**
 * Lifecycle of one batch: {@code PENDING -> WAITING -> IN_FLIGHT -> SUCCEEDED}, looping through {@code BACKOFF}
 * on failure, with {@code CANCELLED} reachable from every non-terminal state.
 */
public enum BatchState {
    PENDING,
    WAITING,
    IN_FLIGHT,
    BACKOFF,
    SUCCEEDED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == CANCELLED;
    }
}
