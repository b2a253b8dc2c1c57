package tech.tenderflow.queue;

import java.util.List;
import java.util.Map;

/**
 * Result of sending message(s) to a queue.
 *
 * <p>A batch send can succeed for some entries and fail for others. Callers must
 * treat only {@link #publishedMessageIds()} as acknowledged by the queue.
 *
 * @param publishedMessageIds entry IDs the queue acknowledged
 * @param failedMessageIds entry IDs the queue rejected, mapped to the failure reason
 */
public record QueuePublishResult(
    List<String> publishedMessageIds,
    Map<String, String> failedMessageIds
) {
    public QueuePublishResult {
        publishedMessageIds = List.copyOf(publishedMessageIds);
        failedMessageIds = Map.copyOf(failedMessageIds);
    }

    /**
     * Create a success result for batch messages.
     */
    public static QueuePublishResult success(List<String> messageIds) {
        return new QueuePublishResult(messageIds, Map.of());
    }

    /**
     * Check if all messages were published successfully.
     */
    public boolean allPublished() {
        return failedMessageIds.isEmpty();
    }

    public boolean isPublished(String messageId) {
        return publishedMessageIds.contains(messageId);
    }

    /**
     * Human readable summary of the failed entries, e.g. {@code "msg-1: Throttled; msg-2: Too large"}.
     */
    public String errorSummary() {
        StringBuilder errors = new StringBuilder();
        failedMessageIds.forEach((id, reason) -> {
            if (!errors.isEmpty()) errors.append("; ");
            errors.append(id).append(": ").append(reason);
        });
        return errors.toString();
    }
}
