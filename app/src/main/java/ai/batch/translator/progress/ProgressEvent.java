package ai.batch.translator.progress;

import java.util.Objects;

/**
 * One progress notification. Worker id {@value #AGGREGATE_WORKER} denotes the job as a whole; {@code append}
 * marks a fragment to concatenate to the worker's current text rather than a replacement status line.
 */
public record ProgressEvent(int workerId, int current, int total, String message, boolean append) {

    public static final int AGGREGATE_WORKER = 0;

    public ProgressEvent {
        Objects.requireNonNull(message, "message");
        if (workerId < 0) {
            throw new IllegalArgumentException("workerId must not be negative");
        }
    }

    public static ProgressEvent status(int workerId, int current, int total, String message) {
        return new ProgressEvent(workerId, current, total, message, false);
    }

    public static ProgressEvent fragment(int workerId, int current, int total, String fragment) {
        return new ProgressEvent(workerId, current, total, fragment, true);
    }

    public static ProgressEvent aggregate(int current, int total, String message) {
        return status(AGGREGATE_WORKER, current, total, message);
    }

    public boolean isAggregate() {
        return workerId == AGGREGATE_WORKER;
    }
}
