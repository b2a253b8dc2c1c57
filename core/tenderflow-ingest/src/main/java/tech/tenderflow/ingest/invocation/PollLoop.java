package tech.tenderflow.ingest.invocation;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.tenderflow.ingest.batch.BatchCoordinator;
import tech.tenderflow.ingest.batch.BatchOutcome;
import tech.tenderflow.ingest.config.PipelineQueues;
import tech.tenderflow.ingest.config.TenderPipelineConfig;
import tech.tenderflow.ingest.time.InvocationBudget;
import tech.tenderflow.ingest.time.Sleeper;
import tech.tenderflow.queue.QueueGateway;
import tech.tenderflow.queue.ReceivedMessage;

import java.time.Duration;
import java.util.List;

/**
 * Drives one invocation: processes the messages delivered with it, then keeps receiving
 * batches from the source queue until the queue is empty or the remaining time falls below
 * the safety margin.
 *
 * <p>The budget is only checked before a receive. A batch already received always runs to the
 * end of its commit protocol. Exceptions from receive or from a batch propagate and fail the
 * invocation.
 */
@ApplicationScoped
public class PollLoop {

    private static final Logger LOG = Logger.getLogger(PollLoop.class);

    private final BatchCoordinator coordinator;
    private final QueueGateway queueGateway;
    private final String sourceUrl;
    private final int maxMessages;
    private final int waitTimeSeconds;
    private final Duration interPollDelay;
    private final Duration safetyMargin;
    private final Sleeper sleeper;

    @Inject
    public PollLoop(BatchCoordinator coordinator, QueueGateway queueGateway, PipelineQueues queues,
                    TenderPipelineConfig config) {
        this(coordinator, queueGateway, queues.sourceUrl(),
            config.poll().maxMessages(),
            config.poll().waitTimeSeconds(),
            config.poll().interPollDelay(),
            config.poll().safetyMargin(),
            Sleeper.threadSleep());
    }

    PollLoop(BatchCoordinator coordinator, QueueGateway queueGateway, String sourceUrl, int maxMessages,
             int waitTimeSeconds, Duration interPollDelay, Duration safetyMargin, Sleeper sleeper) {
        this.coordinator = coordinator;
        this.queueGateway = queueGateway;
        this.sourceUrl = sourceUrl;
        this.maxMessages = Math.min(maxMessages, QueueGateway.MAX_BATCH_SIZE);
        this.waitTimeSeconds = waitTimeSeconds;
        this.interPollDelay = interPollDelay;
        this.safetyMargin = safetyMargin;
        this.sleeper = sleeper;
    }

    public InvocationSummary run(List<ReceivedMessage> delivered, InvocationBudget budget) {
        long start = System.nanoTime();
        int batches = 0;
        BatchOutcome totals = BatchOutcome.empty();

        for (int i = 0; i < delivered.size(); i += QueueGateway.MAX_BATCH_SIZE) {
            List<ReceivedMessage> chunk = delivered.subList(i, Math.min(i + QueueGateway.MAX_BATCH_SIZE, delivered.size()));
            totals = totals.plus(coordinator.process(chunk));
            batches++;
        }
        if (!delivered.isEmpty()) {
            LOG.infof("Processed %d delivered messages in %d batches", delivered.size(), batches);
        }

        while (true) {
            Duration remaining = budget.remaining();
            if (remaining.compareTo(safetyMargin) < 0) {
                LOG.infof("Stopping poll loop: %dms remaining is below the %dms safety margin",
                    remaining.toMillis(), safetyMargin.toMillis());
                break;
            }

            List<ReceivedMessage> received = queueGateway.receive(sourceUrl, maxMessages, waitTimeSeconds);
            if (received.isEmpty()) {
                LOG.debugf("Source queue [%s] is empty, stopping poll loop", sourceUrl);
                break;
            }

            LOG.debugf("Received %d messages from [%s]", received.size(), sourceUrl);
            totals = totals.plus(coordinator.process(received));
            batches++;

            try {
                sleeper.sleep(interPollDelay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Poll loop interrupted, stopping");
                break;
            }
        }

        return new InvocationSummary(batches, totals.processed(), totals.failed(), totals.deleted(),
            Duration.ofNanos(System.nanoTime() - start));
    }
}
