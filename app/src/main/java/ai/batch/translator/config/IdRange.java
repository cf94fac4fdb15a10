package ai.batch.translator.config;

/**
 * Inclusive range of numeric line IDs.
 */
public record IdRange(long fromId, long toId) {

    public IdRange {
        if (fromId > toId) {
            throw new IllegalArgumentException("--from-id must not be greater than --to-id");
        }
    }

    public boolean contains(long id) {
        return id >= fromId && id <= toId;
    }
}
