package ai.batch.translator.job;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Well-known files inside the working directory.
 */
public record WorkspacePaths(Path root) {

    public static final String SNAPSHOT_FILE = "temp_translating.txt";
    public static final String WORKER_LOG_FILE = "thread.txt";
    public static final String OUTPUT_FILE = "tran.txt";

    public WorkspacePaths {
        root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    public Path snapshotFile() {
        return root.resolve(SNAPSHOT_FILE);
    }

    public Path workerLogFile() {
        return root.resolve(WORKER_LOG_FILE);
    }

    public Path outputFile() {
        return root.resolve(OUTPUT_FILE);
    }
}
