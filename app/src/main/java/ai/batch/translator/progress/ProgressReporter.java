package ai.batch.translator.progress;

/**
 * Observer of job progress. Called concurrently from every worker; implementations must be thread-safe and must
 * not block.
 */
@FunctionalInterface
public interface ProgressReporter {

    void report(ProgressEvent event);
}
