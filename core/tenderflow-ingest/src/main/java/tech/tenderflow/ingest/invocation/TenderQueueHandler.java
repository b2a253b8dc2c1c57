package tech.tenderflow.ingest.invocation;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.SQSEvent;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jboss.logging.Logger;
import tech.tenderflow.queue.MessageGroupKeys;
import tech.tenderflow.queue.ReceivedMessage;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Lambda entry point for the tender source queue.
 */
@Named("tender-queue")
public class TenderQueueHandler implements RequestHandler<SQSEvent, String> {

    private static final Logger LOG = Logger.getLogger(TenderQueueHandler.class);

    private final PollLoop pollLoop;

    @Inject
    public TenderQueueHandler(PollLoop pollLoop) {
        this.pollLoop = pollLoop;
    }

    @Override
    public String handleRequest(SQSEvent event, Context context) {
        List<ReceivedMessage> delivered = event.getRecords() == null
            ? List.of()
            : event.getRecords().stream().map(TenderQueueHandler::toReceivedMessage).toList();

        LOG.infof("Invocation [%s] started with %d delivered messages", context.getAwsRequestId(), delivered.size());

        InvocationSummary summary = pollLoop.run(delivered,
            () -> Duration.ofMillis(context.getRemainingTimeInMillis()));

        String result = summary.describe();
        LOG.infof("Invocation [%s] complete - %s", context.getAwsRequestId(), result);
        return result;
    }

    static ReceivedMessage toReceivedMessage(SQSEvent.SQSMessage message) {
        Map<String, String> systemAttributes = message.getAttributes() != null ? message.getAttributes() : Map.of();

        Map<String, String> messageAttributes = new HashMap<>();
        if (message.getMessageAttributes() != null) {
            message.getMessageAttributes().forEach((name, value) -> {
                if (value != null && value.getStringValue() != null) {
                    messageAttributes.put(name, value.getStringValue());
                }
            });
        }

        Map<String, String> attributes = new HashMap<>(messageAttributes);
        systemAttributes.forEach((name, value) -> {
            if (value != null) {
                attributes.put(name, value);
            }
        });

        return new ReceivedMessage(
            message.getMessageId(),
            message.getBody(),
            message.getReceiptHandle(),
            MessageGroupKeys.resolve(systemAttributes, messageAttributes),
            attributes
        );
    }
}
