package ai.batch.translator.job;

import java.util.Objects;

/**
 * Result of one job. The output file only exists when the status is {@link JobStatus#COMPLETED}.
 */
public record JobOutcome(JobStatus status, int completedBatches, int totalBatches, int lineCount) {

    public JobOutcome {
        Objects.requireNonNull(status, "status");
    }

    public boolean isCompleted() {
        return status == JobStatus.COMPLETED;
    }
}
