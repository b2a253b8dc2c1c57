package tech.tenderflow.queue;

import java.util.Map;

/**
 * A message as delivered by the source queue.
 *
 * <p>Immutable. The receipt handle is the acknowledgment token needed to delete the
 * message; it is only valid for the current visibility window.
 *
 * @param messageId queue-assigned message ID
 * @param body raw UTF-8 body
 * @param receiptHandle acknowledgment token used for deletion
 * @param classificationKey routing tag, {@link MessageGroupKeys#UNKNOWN} when unresolved
 * @param attributes transport attributes (system attributes and string message attributes)
 */
public record ReceivedMessage(
    String messageId,
    String body,
    String receiptHandle,
    String classificationKey,
    Map<String, String> attributes
) {
    public ReceivedMessage {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        classificationKey = classificationKey == null ? MessageGroupKeys.UNKNOWN : classificationKey;
    }
}
