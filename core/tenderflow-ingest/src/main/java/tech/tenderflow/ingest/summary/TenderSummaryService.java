package tech.tenderflow.ingest.summary;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jboss.logging.Logger;
import tech.tenderflow.ingest.config.TenderPipelineConfig;
import tech.tenderflow.ingest.model.TenderJson;
import tech.tenderflow.ingest.model.TenderMessage;
import tech.tenderflow.ingest.time.Sleeper;

import java.time.Duration;

/**
 * Generates tender summaries with the model, under a process-wide concurrency cap.
 *
 * <p>Throttled calls are retried with exponential backoff up to the configured attempt limit.
 * Any other failure (model error, prompt lookup, serialization) is not retried. Whatever goes
 * wrong, {@link #summarize(TenderMessage)} returns the {@link FallbackSummary} instead of throwing.
 *
 * <p>A caller holds its concurrency slot for the whole retry sequence, backoff waits included.
 */
@ApplicationScoped
public class TenderSummaryService {

    private static final Logger LOG = Logger.getLogger(TenderSummaryService.class);

    private final ModelInvoker modelInvoker;
    private final PromptService promptService;
    private final ObjectMapper objectMapper;
    private final ConcurrencyLimiter limiter;
    private final BackoffCalculator backoff;
    private final Sleeper sleeper;
    private final int maxAttempts;

    @Inject
    public TenderSummaryService(ModelInvoker modelInvoker, PromptService promptService,
                                @Named(TenderJson.MAPPER_NAME) ObjectMapper objectMapper, TenderPipelineConfig config) {
        this(modelInvoker, promptService, objectMapper,
            new ConcurrencyLimiter(config.enrichment().maxConcurrency()),
            new BackoffCalculator(config.enrichment().baseDelay(), config.enrichment().maxDelay()),
            Sleeper.threadSleep(),
            config.enrichment().maxAttempts());
    }

    TenderSummaryService(ModelInvoker modelInvoker, PromptService promptService, ObjectMapper objectMapper,
                         ConcurrencyLimiter limiter, BackoffCalculator backoff, Sleeper sleeper, int maxAttempts) {
        this.modelInvoker = modelInvoker;
        this.promptService = promptService;
        this.objectMapper = objectMapper;
        this.limiter = limiter;
        this.backoff = backoff;
        this.sleeper = sleeper;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Never throws and never returns an empty string.
     */
    public String summarize(TenderMessage tender) {
        long start = System.currentTimeMillis();
        String tenderNumber = tender.getTenderNumber().isEmpty() ? "Unknown" : tender.getTenderNumber();
        String source = tender.tenderSource().displayName();

        try (ConcurrencyLimiter.Permit permit = limiter.acquire()) {
            String prompt = promptService.promptFor(tender.tenderSource())
                + "\n\nTender: " + objectMapper.writeValueAsString(tender.compactProjection());

            String summary = invokeWithBackoff(prompt, tenderNumber);
            if (summary != null && !summary.isBlank()) {
                LOG.infof("Summary generated - tender: %s, source: %s, duration: %dms, length: %d",
                    tenderNumber, source, System.currentTimeMillis() - start, summary.length());
                return summary;
            }

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warnf("Interrupted while generating summary for tender %s", tenderNumber);

        } catch (Exception e) {
            LOG.errorf(e, "Summary generation failed - tender: %s, source: %s, duration: %dms, errorType: %s",
                tenderNumber, source, System.currentTimeMillis() - start, e.getClass().getSimpleName());
        }

        LOG.infof("Using fallback summary for tender %s (%s)", tenderNumber, source);
        return FallbackSummary.build(tender);
    }

    /**
     * @return the generated text, or null when the attempts are exhausted or the call failed
     */
    private String invokeWithBackoff(String prompt, String tenderNumber) throws InterruptedException {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            ModelInvocationOutcome outcome = modelInvoker.invoke(prompt);

            switch (outcome.result()) {
                case SUCCESS:
                    LOG.debugf("Model call succeeded on attempt %d - tender: %s", attempt, tenderNumber);
                    return outcome.text();

                case FAILED:
                    LOG.errorf("Model call failed with non-retryable error - tender: %s, attempt: %d, error: %s",
                        tenderNumber, attempt, outcome.errorDescription());
                    return null;

                case THROTTLED:
                    if (attempt == maxAttempts) {
                        LOG.errorf("Model throttling - max attempts (%d) exceeded - tender: %s",
                            maxAttempts, tenderNumber);
                        return null;
                    }
                    Duration delay = backoff.delayFor(attempt);
                    LOG.warnf("Model throttling - attempt %d/%d, retrying in %dms - tender: %s",
                        attempt, maxAttempts, delay.toMillis(), tenderNumber);
                    sleeper.sleep(delay);
                    break;

                default:
                    throw new IllegalStateException("Unhandled invocation result: " + outcome.result());
            }
        }
        return null;
    }
}
