package ai.batch.translator.job;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared, index-addressed result buffer of one job.
 *
 * <p>Every merge rewrites the snapshot file while still holding the lock, so the snapshot always reflects a
 * consistent set of whole batches. Snapshot failures are logged and otherwise ignored.
 */
public class OutputBuffer {

    private static final Logger LOGGER = LoggerFactory.getLogger(OutputBuffer.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final List<String> lines;
    private final BitSet merged;
    private final Path snapshotFile;

    public OutputBuffer(List<String> initialLines, Path snapshotFile) {
        this.lines = new ArrayList<>(Objects.requireNonNull(initialLines, "initialLines"));
        this.merged = new BitSet(lines.size());
        this.snapshotFile = Objects.requireNonNull(snapshotFile, "snapshotFile");
    }

    /**
     * Writes {@code texts} at {@code indices} and refreshes the snapshot.
     *
     * @throws IllegalArgumentException if the lists differ in length or an index is out of range
     * @throws IllegalStateException if an index was already merged during this job
     */
    public void merge(List<Integer> indices, List<String> texts) {
        Objects.requireNonNull(indices, "indices");
        Objects.requireNonNull(texts, "texts");
        if (indices.size() != texts.size()) {
            throw new IllegalArgumentException(
                    "indices and texts differ in length: " + indices.size() + " != " + texts.size());
        }
        lock.lock();
        try {
            for (int index : indices) {
                if (index < 0 || index >= lines.size()) {
                    throw new IllegalArgumentException("index out of range: " + index);
                }
                if (merged.get(index)) {
                    throw new IllegalStateException("index merged twice: " + index);
                }
            }
            for (int i = 0; i < indices.size(); i++) {
                int index = indices.get(i);
                lines.set(index, texts.get(i));
                merged.set(index);
            }
            writeSnapshot();
        } finally {
            lock.unlock();
        }
    }

    public List<String> lines() {
        lock.lock();
        try {
            return List.copyOf(lines);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        return lines.size();
    }

    public int mergedCount() {
        lock.lock();
        try {
            return merged.cardinality();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Writes every line followed by a newline to {@code target}.
     */
    public void writeTo(Path target) {
        StringBuilder content = new StringBuilder();
        for (String line : lines()) {
            content.append(line).append('\n');
        }
        try {
            Files.writeString(target, content, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write output file: " + target, ex);
        }
    }

    private void writeSnapshot() {
        try {
            Files.writeString(snapshotFile, String.join("\n", lines), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            LOGGER.warn("Failed to write snapshot {}: {}", snapshotFile, ex.getMessage());
        }
    }
}
