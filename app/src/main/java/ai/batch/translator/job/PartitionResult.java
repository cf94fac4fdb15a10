package ai.batch.translator.job;

import java.util.List;
import java.util.Objects;

/**
 * Initial output buffer contents plus the batches that will overwrite parts of it.
 */
public record PartitionResult(List<String> initialLines, List<Batch> batches) {

    public PartitionResult {
        initialLines = List.copyOf(Objects.requireNonNull(initialLines, "initialLines"));
        batches = List.copyOf(Objects.requireNonNull(batches, "batches"));
    }

    public int lineCount() {
        return initialLines.size();
    }

    public int batchCount() {
        return batches.size();
    }
}
