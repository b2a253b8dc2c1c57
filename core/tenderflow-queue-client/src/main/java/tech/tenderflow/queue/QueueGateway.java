package tech.tenderflow.queue;

import java.util.List;

/**
 * Batch access to named queues.
 *
 * <p>All batch operations are split into calls of at most {@link #MAX_BATCH_SIZE} entries.
 * Per-entry failures are reported in the returned result; implementations do not throw
 * for rejected entries or transport errors on a chunk.
 */
public interface QueueGateway {

    /** Wire-protocol limit for batch send/delete entries per call. */
    int MAX_BATCH_SIZE = 10;

    /**
     * Send multiple messages in batches.
     * Messages without a group ID are rejected when the target is a FIFO queue.
     */
    QueuePublishResult sendBatch(String queueUrl, List<QueueMessage> messages);

    /**
     * Delete delivered messages in batches, using each message's receipt handle.
     */
    QueueDeleteResult deleteBatch(String queueUrl, List<ReceivedMessage> messages);

    /**
     * Receive up to {@code maxMessages} messages, waiting up to {@code waitTimeSeconds}.
     * Unlike the batch operations, receive failures propagate to the caller.
     */
    List<ReceivedMessage> receive(String queueUrl, int maxMessages, int waitTimeSeconds);
}
