package ai.batch.translator.job;

import ai.batch.translator.line.LineFormat;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits file content into fixed-size batches.
 *
 * <p>A leading {@code 0:::} header line is kept verbatim and never translated. Every other line becomes a work item;
 * its initial buffer entry is {@code "<id>:::"}, so re-partitioning a partially translated snapshot yields the same
 * buffer as partitioning the source.
 */
public class LinePartitioner {

    private final int batchSize;

    public LinePartitioner(int batchSize) {
        this.batchSize = Math.max(1, batchSize);
    }

    public PartitionResult partition(String content) {
        List<String> lines = content == null ? List.of() : content.lines().toList();
        List<String> initialLines = new ArrayList<>(lines.size());
        List<WorkItem> items = new ArrayList<>(lines.size());
        for (int index = 0; index < lines.size(); index++) {
            String line = lines.get(index);
            if (index == 0 && LineFormat.isHeader(line)) {
                initialLines.add(line);
                continue;
            }
            initialLines.add(LineFormat.placeholder(line));
            items.add(new WorkItem(index, line));
        }

        List<Batch> batches = new ArrayList<>();
        for (int start = 0; start < items.size(); start += batchSize) {
            int end = Math.min(start + batchSize, items.size());
            batches.add(new Batch(batches.size(), items.subList(start, end)));
        }
        return new PartitionResult(initialLines, batches);
    }
}
