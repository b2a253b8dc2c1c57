package tech.tenderflow.queue;

/**
 * One entry of an outgoing batch.
 *
 * <p>The entry id is echoed back in {@link QueuePublishResult}, so callers use the id of the
 * inbound message they are forwarding. FIFO queues also need a group, and the deduplication id
 * defaults to the entry id so a retried send of the same entry is dropped by the queue.
 *
 * @param messageId batch-entry id, unique within one send call
 * @param messageGroupId ordering group on a FIFO queue, ignored by standard queues
 * @param deduplicationId FIFO deduplication id
 * @param body JSON payload
 */
public record QueueMessage(
    String messageId,
    String messageGroupId,
    String deduplicationId,
    String body
) {

    public static QueueMessage of(String messageId, String messageGroupId, String body) {
        return new QueueMessage(messageId, messageGroupId, messageId, body);
    }

    /**
     * Entry without a group. Rejected by FIFO queues.
     */
    public static QueueMessage ungrouped(String messageId, String body) {
        return new QueueMessage(messageId, null, messageId, body);
    }

    public boolean hasMessageGroupId() {
        return messageGroupId != null && !messageGroupId.isBlank();
    }
}
