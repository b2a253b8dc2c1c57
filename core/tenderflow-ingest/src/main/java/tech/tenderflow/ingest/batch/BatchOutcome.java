package tech.tenderflow.ingest.batch;

/**
 * Counts for one batch, or an aggregate of several.
 *
 * @param processed messages acknowledged by the success queue
 * @param failed messages written to the dead-letter queue
 * @param deleted messages removed from the source queue
 */
public record BatchOutcome(int processed, int failed, int deleted) {

    private static final BatchOutcome EMPTY = new BatchOutcome(0, 0, 0);

    public static BatchOutcome empty() {
        return EMPTY;
    }

    public BatchOutcome plus(BatchOutcome other) {
        return new BatchOutcome(processed + other.processed, failed + other.failed, deleted + other.deleted);
    }
}
