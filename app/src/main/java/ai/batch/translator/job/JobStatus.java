package ai.batch.translator.job;

public enum JobStatus {
    COMPLETED,
    CANCELLED
}
