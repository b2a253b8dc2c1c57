package tech.tenderflow.ingest.batch;

import tech.tenderflow.queue.ReceivedMessage;

/**
 * A message that could not complete the pipeline, on its way to the dead-letter queue.
 *
 * @param source the delivered message
 * @param payload the original body, or the serialized processed tender for downstream failures
 * @param category pipeline stage that failed
 * @param errorMessage captured error description
 * @param errorType simple class name of the error
 */
public record FailedMessage(
    ReceivedMessage source,
    String payload,
    ErrorCategory category,
    String errorMessage,
    String errorType
) {
    public static FailedMessage of(ReceivedMessage source, String payload, ErrorCategory category, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new FailedMessage(source, payload, category, message, error.getClass().getSimpleName());
    }

    public static FailedMessage rejected(ReceivedMessage source, String payload, ErrorCategory category, String reason) {
        return new FailedMessage(source, payload, category, reason, "QueueRejection");
    }

    public String messageId() {
        return source.messageId();
    }
}
