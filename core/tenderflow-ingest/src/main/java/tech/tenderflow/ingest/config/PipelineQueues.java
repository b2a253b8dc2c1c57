package tech.tenderflow.ingest.config;

/**
 * Resolved queue URLs for one pipeline.
 *
 * @param sourceUrl queue messages are received from and deleted on
 * @param successUrl queue processed tenders are written to
 * @param deadLetterUrl queue failure records are written to
 */
public record PipelineQueues(String sourceUrl, String successUrl, String deadLetterUrl) {

    public PipelineQueues {
        requireUrl("source-url", sourceUrl);
        requireUrl("success-url", successUrl);
        requireUrl("dead-letter-url", deadLetterUrl);
    }

    public static PipelineQueues from(TenderPipelineConfig config) {
        TenderPipelineConfig.Queues queues = config.queues();
        return new PipelineQueues(queues.sourceUrl(), queues.successUrl(), queues.deadLetterUrl());
    }

    private static void requireUrl(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Missing required queue URL: tender-pipeline.queues." + name);
        }
    }
}
