package tech.tenderflow.ingest.batch;

import java.time.Instant;

/**
 * Body written to the dead-letter queue.
 */
public record DeadLetterEntry(
    String originalMessage,
    String classificationKey,
    String errorMessage,
    ErrorCategory errorCategory,
    String errorType,
    String processedBy,
    Instant processedAt
) {
    public static DeadLetterEntry from(FailedMessage failed, String processedBy, Instant processedAt) {
        return new DeadLetterEntry(
            failed.payload(),
            failed.source().classificationKey(),
            failed.errorMessage(),
            failed.category(),
            failed.errorType(),
            processedBy,
            processedAt
        );
    }
}
