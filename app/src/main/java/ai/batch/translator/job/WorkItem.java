package ai.batch.translator.job;

import java.util.Objects;

/**
 * One input line together with its position in the output buffer.
 */
public record WorkItem(int index, String rawLine) {

    public WorkItem {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative");
        }
        Objects.requireNonNull(rawLine, "rawLine");
    }
}
