package tech.tenderflow.queue;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Resolves the classification key of an inbound message.
 *
 * <p>The queue-level {@code MessageGroupId} attribute wins. If it is absent, a custom
 * message attribute with the same name is used. Anything else resolves to {@link #UNKNOWN},
 * which no router accepts.
 */
public final class MessageGroupKeys {

    public static final String ATTRIBUTE_NAME = "MessageGroupId";
    public static final String UNKNOWN = "Unknown";

    /**
     * Characters and length SQS accepts for a FIFO message group ID.
     */
    private static final Pattern VALID_GROUP_ID = Pattern.compile("[\\p{Alnum}\\p{Punct}]{1,128}");

    private MessageGroupKeys() {
    }

    /**
     * @param systemAttributes queue system attributes, may be null
     * @param messageAttributes string values of custom message attributes, may be null
     */
    public static String resolve(Map<String, String> systemAttributes, Map<String, String> messageAttributes) {
        if (systemAttributes != null) {
            String groupId = systemAttributes.get(ATTRIBUTE_NAME);
            if (groupId != null) {
                return groupId;
            }
        }
        if (messageAttributes != null && messageAttributes.containsKey(ATTRIBUTE_NAME)) {
            String groupId = messageAttributes.get(ATTRIBUTE_NAME);
            return groupId != null ? groupId : UNKNOWN;
        }
        return UNKNOWN;
    }

    /**
     * Whether the key can be sent as a FIFO message group ID.
     */
    public static boolean isValidGroupId(String key) {
        return key != null && VALID_GROUP_ID.matcher(key).matches();
    }
}
