package tech.tenderflow.ingest.invocation;

import java.time.Duration;

/**
 * Totals for one invocation.
 */
public record InvocationSummary(int batches, int processed, int failed, int deleted, Duration elapsed) {

    /**
     * The invocation's result string, e.g.
     * {@code "Batches: 3, Processed: 27, Failed: 1, Deleted: 27, Duration: 5120ms"}.
     */
    public String describe() {
        return String.format("Batches: %d, Processed: %d, Failed: %d, Deleted: %d, Duration: %dms",
            batches, processed, failed, deleted, elapsed.toMillis());
    }
}
