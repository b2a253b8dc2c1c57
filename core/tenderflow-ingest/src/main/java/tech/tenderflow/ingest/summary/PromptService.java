package tech.tenderflow.ingest.summary;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.GetParameterRequest;
import software.amazon.awssdk.services.ssm.model.GetParameterResponse;
import software.amazon.awssdk.services.ssm.model.ParameterNotFoundException;
import tech.tenderflow.ingest.config.TenderPipelineConfig;
import tech.tenderflow.ingest.model.TenderSource;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads summary prompts from SSM Parameter Store.
 *
 * <p>Each source has its own prompt under {@code {promptPath}{displayName}}, prefixed by one
 * shared system prompt. Parameters are cached for the lifetime of the process after the first
 * successful read; failed reads are not cached.
 */
@ApplicationScoped
public class PromptService {

    private static final Logger LOG = Logger.getLogger(PromptService.class);

    private final SsmClient ssmClient;
    private final String promptPath;
    private final String systemPromptKey;
    private final Map<String, String> cache = new ConcurrentHashMap<>();

    @Inject
    public PromptService(SsmClient ssmClient, TenderPipelineConfig config) {
        this(ssmClient, config.enrichment().promptPath(), config.enrichment().systemPromptKey());
    }

    PromptService(SsmClient ssmClient, String promptPath, String systemPromptKey) {
        this.ssmClient = ssmClient;
        this.promptPath = promptPath.endsWith("/") ? promptPath : promptPath + "/";
        this.systemPromptKey = systemPromptKey;
    }

    /**
     * The full instruction text for a source: system prompt, blank line, source prompt.
     *
     * @throws PromptUnavailableException if either parameter is missing, empty or unreadable
     */
    public String promptFor(TenderSource source) {
        return parameter(systemPromptKey) + "\n\n" + parameter(source.displayName());
    }

    private String parameter(String key) {
        String name = promptPath + key;
        String cached = cache.get(name);
        if (cached != null) {
            return cached;
        }

        String value = fetch(name);
        String previous = cache.putIfAbsent(name, value);
        return previous != null ? previous : value;
    }

    private String fetch(String name) {
        GetParameterResponse response;
        try {
            response = ssmClient.getParameter(GetParameterRequest.builder()
                .name(name)
                .withDecryption(true)
                .build());
        } catch (ParameterNotFoundException e) {
            throw new PromptUnavailableException("Prompt parameter not found: " + name, e);
        } catch (SdkException e) {
            throw new PromptUnavailableException("Failed to read prompt parameter " + name + ": " + e.getMessage(), e);
        }

        String value = response.parameter() != null ? response.parameter().value() : null;
        if (value == null || value.isBlank()) {
            throw new PromptUnavailableException("Prompt parameter is empty: " + name);
        }

        LOG.infof("Loaded prompt parameter [%s] (%d chars)", name, value.length());
        return value;
    }

    /**
     * Number of cached parameters.
     */
    int cachedCount() {
        return cache.size();
    }
}
