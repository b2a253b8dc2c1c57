package tech.tenderflow.queue;

import java.util.List;
import java.util.Map;

/**
 * Result of deleting message(s) from a queue.
 *
 * @param deletedMessageIds message IDs removed from the queue
 * @param failedMessageIds message IDs still in the queue, mapped to the failure reason
 */
public record QueueDeleteResult(
    List<String> deletedMessageIds,
    Map<String, String> failedMessageIds
) {
    public QueueDeleteResult {
        deletedMessageIds = List.copyOf(deletedMessageIds);
        failedMessageIds = Map.copyOf(failedMessageIds);
    }

    public static QueueDeleteResult empty() {
        return new QueueDeleteResult(List.of(), Map.of());
    }

    public boolean allDeleted() {
        return failedMessageIds.isEmpty();
    }
}
