package ai.batch.translator.job;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends one {@code Thread <id>: <start>-<end>} line per dispatched batch. Write failures are logged only.
 */
class WorkerActivityLog {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerActivityLog.class);

    private final Path file;

    WorkerActivityLog(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    synchronized void reset() {
        try {
            Files.writeString(file, "", StandardCharsets.UTF_8);
        } catch (IOException ex) {
            LOGGER.warn("Failed to reset worker log {}: {}", file, ex.getMessage());
        }
    }

    synchronized void record(int workerId, Batch batch) {
        String entry = "Thread " + workerId + ": " + batch.firstLabel() + "-" + batch.lastLabel() + "\n";
        try {
            Files.writeString(file, entry, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException ex) {
            LOGGER.warn("Failed to append to worker log {}: {}", file, ex.getMessage());
        }
    }
}
