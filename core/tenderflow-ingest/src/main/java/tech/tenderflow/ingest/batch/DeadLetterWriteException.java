package tech.tenderflow.ingest.batch;

/**
 * The dead-letter queue did not accept every failure record of a batch.
 *
 * <p>Fatal for the invocation: it must propagate so the runtime redelivers the batch.
 */
public class DeadLetterWriteException extends RuntimeException {

    public DeadLetterWriteException(String message) {
        super(message);
    }

    public DeadLetterWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
