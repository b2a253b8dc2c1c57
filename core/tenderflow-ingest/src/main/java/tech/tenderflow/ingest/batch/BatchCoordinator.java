package tech.tenderflow.ingest.batch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jboss.logging.Logger;
import tech.tenderflow.ingest.config.PipelineQueues;
import tech.tenderflow.ingest.config.TenderPipelineConfig;
import tech.tenderflow.ingest.model.TenderJson;
import tech.tenderflow.ingest.model.TenderMessage;
import tech.tenderflow.ingest.processor.TenderMessageProcessor;
import tech.tenderflow.ingest.router.TenderMessageRouter;
import tech.tenderflow.queue.MessageGroupKeys;
import tech.tenderflow.queue.QueueDeleteResult;
import tech.tenderflow.queue.QueueGateway;
import tech.tenderflow.queue.QueueMessage;
import tech.tenderflow.queue.QueuePublishResult;
import tech.tenderflow.queue.ReceivedMessage;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one batch of delivered messages through the commit protocol:
 * <ol>
 *   <li>Classify and process every message. Failures are collected, the batch continues.</li>
 *   <li>Send processed tenders to the success queue. Anything the queue does not acknowledge
 *       becomes a failure.</li>
 *   <li>Send all failures to the dead-letter queue. If that does not fully succeed a
 *       {@link DeadLetterWriteException} is thrown and nothing is deleted.</li>
 *   <li>Delete from the source queue only the messages acknowledged in step 2. Delete failures
 *       are logged; the messages will be redelivered.</li>
 * </ol>
 * Phases run strictly in order and nothing is rolled back.
 */
@ApplicationScoped
public class BatchCoordinator {

    private static final Logger LOG = Logger.getLogger(BatchCoordinator.class);

    private final TenderMessageRouter router;
    private final TenderMessageProcessor processor;
    private final QueueGateway queueGateway;
    private final PipelineQueues queues;
    private final ObjectMapper objectMapper;
    private final ExecutorService workers;
    private final String processedBy;
    private final Clock clock;

    @Inject
    public BatchCoordinator(TenderMessageRouter router, TenderMessageProcessor processor, QueueGateway queueGateway,
                            PipelineQueues queues, @Named(TenderJson.MAPPER_NAME) ObjectMapper objectMapper,
                            TenderPipelineConfig config) {
        this(router, processor, queueGateway, queues, objectMapper,
            Executors.newFixedThreadPool(config.batch().processingThreads(), workerThreadFactory()),
            config.batch().processedBy(),
            Clock.systemUTC());
    }

    BatchCoordinator(TenderMessageRouter router, TenderMessageProcessor processor, QueueGateway queueGateway,
                     PipelineQueues queues, ObjectMapper objectMapper, ExecutorService workers,
                     String processedBy, Clock clock) {
        this.router = router;
        this.processor = processor;
        this.queueGateway = queueGateway;
        this.queues = queues;
        this.objectMapper = objectMapper;
        this.workers = workers;
        this.processedBy = processedBy;
        this.clock = clock;
    }

    /**
     * @throws DeadLetterWriteException if failure records could not be written
     */
    public BatchOutcome process(List<ReceivedMessage> batch) {
        if (batch.isEmpty()) {
            return BatchOutcome.empty();
        }

        long start = System.currentTimeMillis();
        List<FailedMessage> failed = new ArrayList<>();

        List<ProcessedTender> processed = classifyAndProcess(batch, failed);
        List<ReceivedMessage> committed = commitSuccesses(processed, failed);
        commitFailures(failed);
        int deleted = deleteCommitted(committed);

        BatchOutcome outcome = new BatchOutcome(committed.size(), failed.size(), deleted);
        LOG.infof("Batch complete - received: %d, processed: %d, failed: %d, deleted: %d, duration: %dms",
            batch.size(), outcome.processed(), outcome.failed(), outcome.deleted(), System.currentTimeMillis() - start);
        return outcome;
    }

    private List<ProcessedTender> classifyAndProcess(List<ReceivedMessage> batch, List<FailedMessage> failed) {
        List<Classified> classified = new ArrayList<>(batch.size());
        for (ReceivedMessage message : batch) {
            try {
                classified.add(new Classified(message, router.classify(message.body(), message.classificationKey())));
            } catch (RuntimeException e) {
                LOG.warnf("Classification failed - messageId: %s, key: %s, error: %s",
                    message.messageId(), message.classificationKey(), e.getMessage());
                failed.add(FailedMessage.of(message, message.body(), ErrorCategory.CLASSIFICATION, e));
            }
        }

        List<CompletableFuture<ProcessedTender>> futures = new ArrayList<>(classified.size());
        for (Classified item : classified) {
            futures.add(CompletableFuture.supplyAsync(() -> processOne(item), workers));
        }

        List<ProcessedTender> processed = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            ReceivedMessage message = classified.get(i).source();
            try {
                processed.add(futures.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                LOG.errorf(cause, "Processing failed - messageId: %s, key: %s",
                    message.messageId(), message.classificationKey());
                failed.add(FailedMessage.of(message, message.body(), ErrorCategory.PROCESSING, cause));
            }
        }
        return processed;
    }

    private ProcessedTender processOne(Classified item) {
        TenderMessage tender = processor.process(item.tender());
        try {
            return new ProcessedTender(item.source(), tender, objectMapper.writeValueAsString(tender));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize processed tender: " + e.getOriginalMessage(), e);
        }
    }

    private List<ReceivedMessage> commitSuccesses(List<ProcessedTender> processed, List<FailedMessage> failed) {
        if (processed.isEmpty()) {
            return List.of();
        }

        List<QueueMessage> outgoing = processed.stream()
            .map(p -> QueueMessage.of(p.source().messageId(), p.tender().groupKey(), p.json()))
            .toList();

        QueuePublishResult result;
        try {
            result = queueGateway.sendBatch(queues.successUrl(), outgoing);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Success queue send failed for %d messages - routing all to dead-letter queue",
                processed.size());
            processed.forEach(p -> failed.add(FailedMessage.of(p.source(), p.json(), ErrorCategory.DOWNSTREAM, e)));
            return List.of();
        }

        List<ReceivedMessage> committed = new ArrayList<>(processed.size());
        for (ProcessedTender p : processed) {
            String messageId = p.source().messageId();
            if (result.isPublished(messageId)) {
                committed.add(p.source());
            } else {
                String reason = result.failedMessageIds().getOrDefault(messageId, "Not acknowledged by success queue");
                LOG.warnf("Success queue rejected message - messageId: %s, reason: %s", messageId, reason);
                failed.add(FailedMessage.rejected(p.source(), p.json(), ErrorCategory.DOWNSTREAM, reason));
            }
        }
        return committed;
    }

    private void commitFailures(List<FailedMessage> failed) {
        if (failed.isEmpty()) {
            return;
        }

        List<QueueMessage> entries = new ArrayList<>(failed.size());
        for (FailedMessage failure : failed) {
            try {
                String body = objectMapper.writeValueAsString(DeadLetterEntry.from(failure, processedBy, clock.instant()));
                entries.add(QueueMessage.of(failure.messageId(), deadLetterGroupId(failure), body));
            } catch (JsonProcessingException e) {
                throw new DeadLetterWriteException("Failed to serialize dead-letter entry for " + failure.messageId(), e);
            }
        }

        QueuePublishResult result;
        try {
            result = queueGateway.sendBatch(queues.deadLetterUrl(), entries);
        } catch (RuntimeException e) {
            throw new DeadLetterWriteException("Dead-letter queue send failed for " + entries.size() + " messages", e);
        }

        if (!result.allPublished()) {
            throw new DeadLetterWriteException("Dead-letter queue rejected " + result.failedMessageIds().size()
                + " of " + entries.size() + " messages: " + result.errorSummary());
        }
        LOG.infof("Sent %d messages to dead-letter queue", entries.size());
    }

    private static String deadLetterGroupId(FailedMessage failure) {
        String key = failure.source().classificationKey();
        if (MessageGroupKeys.isValidGroupId(key)) {
            return key;
        }
        LOG.warnf("Classification key [%s] of message %s is not a valid group id, dead-lettering under [%s]",
            key, failure.messageId(), MessageGroupKeys.UNKNOWN);
        return MessageGroupKeys.UNKNOWN;
    }

    private int deleteCommitted(List<ReceivedMessage> committed) {
        if (committed.isEmpty()) {
            return 0;
        }
        try {
            QueueDeleteResult result = queueGateway.deleteBatch(queues.sourceUrl(), committed);
            result.failedMessageIds().forEach((messageId, reason) ->
                LOG.warnf("Delete failed - messageId: %s, reason: %s - message will be redelivered", messageId, reason));
            return result.deletedMessageIds().size();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Delete of %d messages failed - messages will be redelivered", committed.size());
            return 0;
        }
    }

    @PreDestroy
    void shutdown() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "tender-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record Classified(ReceivedMessage source, TenderMessage tender) {
    }

    private record ProcessedTender(ReceivedMessage source, TenderMessage tender, String json) {
    }
}
