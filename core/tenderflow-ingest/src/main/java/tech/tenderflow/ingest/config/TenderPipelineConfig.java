package tech.tenderflow.ingest.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import tech.tenderflow.ingest.model.TenderSource;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Configuration for the tender ingest pipeline.
 */
@ConfigMapping(prefix = "tender-pipeline")
public interface TenderPipelineConfig {

    Queues queues();

    Poll poll();

    Batch batch();

    Enrichment enrichment();

    Aws aws();

    /**
     * The three queues the pipeline reads from and writes to. All are required.
     */
    interface Queues {

        /**
         * Queue the scrapers publish raw tenders to.
         */
        String sourceUrl();

        /**
         * Queue processed tenders are written to.
         */
        String successUrl();

        /**
         * Queue for messages that could not complete the pipeline.
         */
        String deadLetterUrl();
    }

    interface Poll {

        /**
         * Maximum messages per receive call (queue limit is 10).
         */
        @WithDefault("10")
        int maxMessages();

        /**
         * Long-poll wait per receive call.
         */
        @WithDefault("1")
        int waitTimeSeconds();

        /**
         * Pause between two receive calls.
         */
        @WithDefault("100ms")
        Duration interPollDelay();

        /**
         * No new receive call is started once less than this much invocation time remains.
         */
        @WithDefault("30s")
        Duration safetyMargin();
    }

    interface Batch {

        /**
         * Worker threads for the per-message processing phase.
         */
        @WithDefault("10")
        int processingThreads();

        /**
         * Written into every dead-letter entry.
         */
        @WithDefault("tenderflow-ingest")
        String processedBy();
    }

    interface Enrichment {

        @WithDefault("true")
        boolean enabled();

        /**
         * Sources whose tenders get a generated summary.
         */
        @WithDefault("ETENDERS,ESKOM,TRANSNET")
        Set<TenderSource> sources();

        /**
         * Process-wide cap on simultaneous model calls.
         */
        @WithDefault("3")
        int maxConcurrency();

        /**
         * Attempts per summary, including the first, while the model is throttling.
         */
        @WithDefault("5")
        int maxAttempts();

        @WithDefault("1s")
        Duration baseDelay();

        @WithDefault("30s")
        Duration maxDelay();

        @WithDefault("amazon.nova-pro-v1:0")
        String modelId();

        @WithDefault("800")
        int maxTokens();

        @WithDefault("0.3")
        double temperature();

        @WithDefault("0.9")
        double topP();

        /**
         * Parameter Store path holding the prompts, e.g. {@code /TenderSummary/Prompts/eTenders}.
         */
        @WithDefault("/TenderSummary/Prompts/")
        String promptPath();

        @WithDefault("System")
        String systemPromptKey();
    }

    interface Aws {

        Optional<String> region();

        /**
         * Endpoint override for all AWS clients (LocalStack testing).
         */
        Optional<String> endpointOverride();
    }
}
