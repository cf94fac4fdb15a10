package ai.batch.translator.job;

import ai.batch.translator.line.LineFormat;
import java.util.List;
import java.util.Objects;

/**
 * Contiguous, non-empty run of work items translated by a single request.
 */
public record Batch(int number, List<WorkItem> items) {

    public Batch {
        if (number < 0) {
            throw new IllegalArgumentException("number must not be negative");
        }
        items = List.copyOf(Objects.requireNonNull(items, "items"));
        if (items.isEmpty()) {
            throw new IllegalArgumentException("batch must contain at least one item");
        }
    }

    public int size() {
        return items.size();
    }

    public List<Integer> indices() {
        return items.stream().map(WorkItem::index).toList();
    }

    public List<String> lines() {
        return items.stream().map(WorkItem::rawLine).toList();
    }

    public String firstLabel() {
        return LineFormat.label(items.get(0).rawLine());
    }

    public String lastLabel() {
        return LineFormat.label(items.get(items.size() - 1).rawLine());
    }
}
