package tech.tenderflow.ingest.processor;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.tenderflow.ingest.config.TenderPipelineConfig;
import tech.tenderflow.ingest.model.TenderMessage;
import tech.tenderflow.ingest.model.TenderSource;
import tech.tenderflow.ingest.summary.TenderSummaryService;

import java.util.EnumSet;
import java.util.Set;

/**
 * Applies per-message processing: processing tags, plus a generated summary for the
 * sources that have enrichment enabled.
 */
@ApplicationScoped
public class TenderMessageProcessor {

    private static final Logger LOG = Logger.getLogger(TenderMessageProcessor.class);

    static final String PROCESSED_TAG = "Processed";

    private final TenderSummaryService summaryService;
    private final Set<TenderSource> enrichedSources;

    @Inject
    public TenderMessageProcessor(TenderSummaryService summaryService, TenderPipelineConfig config) {
        this(summaryService, config.enrichment().enabled()
            ? config.enrichment().sources()
            : Set.of());
    }

    TenderMessageProcessor(TenderSummaryService summaryService, Set<TenderSource> enrichedSources) {
        this.summaryService = summaryService;
        this.enrichedSources = enrichedSources.isEmpty()
            ? EnumSet.noneOf(TenderSource.class)
            : EnumSet.copyOf(enrichedSources);
    }

    /**
     * Processes the message in place and returns it.
     */
    public TenderMessage process(TenderMessage message) {
        TenderSource source = message.tenderSource();

        message.getTags().add(PROCESSED_TAG);
        message.getTags().add(handlerTag(source));

        if (enrichedSources.contains(source)) {
            message.setSummary(summaryService.summarize(message));
        }

        LOG.debugf("Processed %s tender [%s]", source.displayName(), message.getTenderNumber());
        return message;
    }

    static String handlerTag(TenderSource source) {
        return "ProcessedBy" + source.displayName() + "Handler";
    }
}
