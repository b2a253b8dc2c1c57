package tech.tenderflow.queue.sqs;

import org.jboss.logging.Logger;
import software.amazon.awssdk.awscore.AwsRequestOverrideConfiguration;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.*;
import tech.tenderflow.queue.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * SQS implementation of QueueGateway.
 * Supports both standard and FIFO queues; a queue is FIFO when its URL ends in {@code .fifo}.
 */
public class SqsQueueGateway implements QueueGateway {

    private static final Logger LOG = Logger.getLogger(SqsQueueGateway.class);
    private static final String FIFO_SUFFIX = ".fifo";

    private final SqsClient sqsClient;

    public SqsQueueGateway(SqsClient sqsClient) {
        this.sqsClient = sqsClient;
    }

    @Override
    public QueuePublishResult sendBatch(String queueUrl, List<QueueMessage> messages) {
        if (messages.isEmpty()) {
            return QueuePublishResult.success(List.of());
        }

        boolean fifo = isFifo(queueUrl);
        List<String> allPublished = new ArrayList<>();
        Map<String, String> allFailed = new LinkedHashMap<>();

        List<QueueMessage> sendable = new ArrayList<>();
        for (QueueMessage message : messages) {
            if (fifo && !message.hasMessageGroupId()) {
                // FIFO entries without a group are rejected, never defaulted
                LOG.warnf("Rejecting message [%s] for FIFO queue [%s]: no message group ID", message.messageId(), queueUrl);
                allFailed.put(message.messageId(), "Missing message group ID for FIFO queue");
            } else {
                sendable.add(message);
            }
        }

        // Split into batches of 10 (SQS limit)
        for (int i = 0; i < sendable.size(); i += MAX_BATCH_SIZE) {
            List<QueueMessage> batch = sendable.subList(i, Math.min(i + MAX_BATCH_SIZE, sendable.size()));

            try {
                List<SendMessageBatchRequestEntry> entries = batch.stream()
                    .map(m -> toEntry(m, fifo))
                    .collect(Collectors.toList());

                SendMessageBatchRequest request = SendMessageBatchRequest.builder()
                    .queueUrl(queueUrl)
                    .entries(entries)
                    .build();

                SendMessageBatchResponse response = sqsClient.sendMessageBatch(request);

                response.successful().forEach(success -> allPublished.add(success.id()));

                response.failed().forEach(failure -> {
                    LOG.warnf("Failed to send message [%s] to [%s]: %s - %s",
                        failure.id(), queueUrl, failure.code(), failure.message());
                    allFailed.put(failure.id(), failure.code() + ": " + failure.message());
                });

                LOG.infof("Batch sent to [%s]. Successful: %d, Failed: %d",
                    queueUrl, response.successful().size(), response.failed().size());

            } catch (Exception e) {
                LOG.errorf(e, "Failed to send batch of %d messages to [%s]", batch.size(), queueUrl);
                batch.forEach(m -> allFailed.put(m.messageId(), describe(e)));
            }
        }

        return new QueuePublishResult(allPublished, allFailed);
    }

    private SendMessageBatchRequestEntry toEntry(QueueMessage message, boolean fifo) {
        SendMessageBatchRequestEntry.Builder builder = SendMessageBatchRequestEntry.builder()
            .id(message.messageId())
            .messageBody(message.body());

        if (fifo) {
            builder.messageGroupId(message.messageGroupId());
            builder.messageDeduplicationId(message.deduplicationId() != null
                ? message.deduplicationId()
                : message.messageId());
        }

        return builder.build();
    }

    @Override
    public QueueDeleteResult deleteBatch(String queueUrl, List<ReceivedMessage> messages) {
        if (messages.isEmpty()) {
            return QueueDeleteResult.empty();
        }

        List<String> allDeleted = new ArrayList<>();
        Map<String, String> allFailed = new LinkedHashMap<>();

        for (int i = 0; i < messages.size(); i += MAX_BATCH_SIZE) {
            List<ReceivedMessage> batch = messages.subList(i, Math.min(i + MAX_BATCH_SIZE, messages.size()));

            try {
                List<DeleteMessageBatchRequestEntry> entries = batch.stream()
                    .map(m -> DeleteMessageBatchRequestEntry.builder()
                        .id(m.messageId())
                        .receiptHandle(m.receiptHandle())
                        .build())
                    .collect(Collectors.toList());

                DeleteMessageBatchResponse response = sqsClient.deleteMessageBatch(DeleteMessageBatchRequest.builder()
                    .queueUrl(queueUrl)
                    .entries(entries)
                    .build());

                response.successful().forEach(success -> allDeleted.add(success.id()));
                response.failed().forEach(failure -> {
                    LOG.warnf("Failed to delete message [%s] from [%s]: %s - %s - message will be redelivered",
                        failure.id(), queueUrl, failure.code(), failure.message());
                    allFailed.put(failure.id(), failure.code() + ": " + failure.message());
                });

            } catch (Exception e) {
                LOG.errorf(e, "Failed to delete batch of %d messages from [%s] - messages will be redelivered",
                    batch.size(), queueUrl);
                batch.forEach(m -> allFailed.put(m.messageId(), describe(e)));
            }
        }

        return new QueueDeleteResult(allDeleted, allFailed);
    }

    @Override
    public List<ReceivedMessage> receive(String queueUrl, int maxMessages, int waitTimeSeconds) {
        // Per-request timeout: long poll plus 5s buffer
        AwsRequestOverrideConfiguration overrideConfig = AwsRequestOverrideConfiguration.builder()
            .apiCallTimeout(Duration.ofSeconds(waitTimeSeconds + 5L))
            .build();

        ReceiveMessageRequest request = ReceiveMessageRequest.builder()
            .queueUrl(queueUrl)
            .maxNumberOfMessages(Math.min(maxMessages, MAX_BATCH_SIZE))
            .waitTimeSeconds(waitTimeSeconds)
            .attributeNamesWithStrings(MessageGroupKeys.ATTRIBUTE_NAME)
            .messageAttributeNames("All")
            .overrideConfiguration(overrideConfig)
            .build();

        ReceiveMessageResponse response = sqsClient.receiveMessage(request);

        List<ReceivedMessage> received = new ArrayList<>(response.messages().size());
        for (Message msg : response.messages()) {
            received.add(toReceivedMessage(msg));
        }
        LOG.debugf("Received %d messages from [%s]", received.size(), queueUrl);
        return received;
    }

    private ReceivedMessage toReceivedMessage(Message msg) {
        Map<String, String> systemAttributes = msg.hasAttributes() ? msg.attributesAsStrings() : Map.of();

        Map<String, String> messageAttributes = new HashMap<>();
        if (msg.hasMessageAttributes()) {
            msg.messageAttributes().forEach((name, value) -> {
                if (value.stringValue() != null) {
                    messageAttributes.put(name, value.stringValue());
                }
            });
        }

        Map<String, String> attributes = new HashMap<>(messageAttributes);
        attributes.putAll(systemAttributes);

        return new ReceivedMessage(
            msg.messageId(),
            msg.body(),
            msg.receiptHandle(),
            MessageGroupKeys.resolve(systemAttributes, messageAttributes),
            attributes
        );
    }

    static boolean isFifo(String queueUrl) {
        return queueUrl != null && queueUrl.endsWith(FIFO_SUFFIX);
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
