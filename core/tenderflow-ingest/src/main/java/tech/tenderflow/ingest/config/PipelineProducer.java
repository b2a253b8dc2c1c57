package tech.tenderflow.ingest.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.runtime.Startup;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import software.amazon.awssdk.services.sqs.SqsClient;
import tech.tenderflow.ingest.model.TenderJson;
import tech.tenderflow.queue.QueueGateway;
import tech.tenderflow.queue.sqs.SqsQueueGateway;

/**
 * Produces the pipeline's shared collaborators.
 */
@ApplicationScoped
public class PipelineProducer {

    private static final Logger LOG = Logger.getLogger(PipelineProducer.class);

    /**
     * Resolved eagerly so a missing queue URL fails the cold start, not the first message.
     */
    @Produces
    @Singleton
    @Startup
    public PipelineQueues pipelineQueues(TenderPipelineConfig config) {
        PipelineQueues queues = PipelineQueues.from(config);
        LOG.infof("Pipeline queues - source: [%s], success: [%s], dead-letter: [%s]",
            queues.sourceUrl(), queues.successUrl(), queues.deadLetterUrl());
        return queues;
    }

    @Produces
    @Singleton
    @Named(TenderJson.MAPPER_NAME)
    public ObjectMapper tenderObjectMapper() {
        return TenderJson.newMapper();
    }

    @Produces
    @Singleton
    public QueueGateway queueGateway(SqsClient sqsClient) {
        return new SqsQueueGateway(sqsClient);
    }
}
