package tech.tenderflow.ingest.summary;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jboss.logging.Logger;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkServiceException;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;
import software.amazon.awssdk.services.bedrockruntime.model.ThrottlingException;
import tech.tenderflow.ingest.config.TenderPipelineConfig;
import tech.tenderflow.ingest.model.TenderJson;

/**
 * Invokes an Amazon Nova model through Bedrock's InvokeModel API.
 *
 * <p>Request body:
 * <pre>
 * {"messages":[{"role":"user","content":[{"text":"..."}]}],
 *  "inferenceConfig":{"max_new_tokens":800,"temperature":0.3,"top_p":0.9}}
 * </pre>
 * The summary is the first {@code text} element under {@code output.message.content}.
 */
@ApplicationScoped
public class BedrockModelInvoker implements ModelInvoker {

    private static final Logger LOG = Logger.getLogger(BedrockModelInvoker.class);

    static final String UNPARSEABLE_RESPONSE = "Summary generated but response parsing failed.";
    private static final String CONTENT_TYPE = "application/json";
    private static final int HTTP_TOO_MANY_REQUESTS = 429;

    private final BedrockRuntimeClient bedrockClient;
    private final ObjectMapper objectMapper;
    private final String modelId;
    private final int maxTokens;
    private final double temperature;
    private final double topP;

    @Inject
    public BedrockModelInvoker(BedrockRuntimeClient bedrockClient, @Named(TenderJson.MAPPER_NAME) ObjectMapper objectMapper,
                               TenderPipelineConfig config) {
        this(bedrockClient, objectMapper,
            config.enrichment().modelId(),
            config.enrichment().maxTokens(),
            config.enrichment().temperature(),
            config.enrichment().topP());
    }

    BedrockModelInvoker(BedrockRuntimeClient bedrockClient, ObjectMapper objectMapper,
                        String modelId, int maxTokens, double temperature, double topP) {
        this.bedrockClient = bedrockClient;
        this.objectMapper = objectMapper;
        this.modelId = modelId;
        this.maxTokens = maxTokens;
        this.temperature = temperature;
        this.topP = topP;
    }

    @Override
    public ModelInvocationOutcome invoke(String prompt) {
        try {
            InvokeModelRequest request = InvokeModelRequest.builder()
                .modelId(modelId)
                .contentType(CONTENT_TYPE)
                .accept(CONTENT_TYPE)
                .body(SdkBytes.fromUtf8String(objectMapper.writeValueAsString(buildPayload(prompt))))
                .build();

            InvokeModelResponse response = bedrockClient.invokeModel(request);
            return ModelInvocationOutcome.success(parseResponse(response.body().asUtf8String()));

        } catch (Exception e) {
            if (isThrottling(e)) {
                LOG.debugf("Model [%s] throttled: %s", modelId, e.getMessage());
                return ModelInvocationOutcome.throttled(e);
            }
            LOG.warnf("Model [%s] invocation failed: %s", modelId, e.getMessage());
            return ModelInvocationOutcome.failed(e);
        }
    }

    ObjectNode buildPayload(String prompt) {
        ObjectNode payload = objectMapper.createObjectNode();

        ObjectNode message = payload.putArray("messages").addObject();
        message.put("role", "user");
        message.putArray("content").addObject().put("text", prompt);

        ObjectNode inferenceConfig = payload.putObject("inferenceConfig");
        inferenceConfig.put("max_new_tokens", maxTokens);
        inferenceConfig.put("temperature", temperature);
        inferenceConfig.put("top_p", topP);

        return payload;
    }

    String parseResponse(String responseJson) {
        try {
            JsonNode content = objectMapper.readTree(responseJson).path("output").path("message").path("content");
            if (content.isArray()) {
                for (JsonNode item : content) {
                    JsonNode text = item.get("text");
                    if (text != null && text.isTextual() && !text.asText().isBlank()) {
                        return text.asText();
                    }
                }
            }
            LOG.warnf("Unexpected response format from model [%s]", modelId);
        } catch (Exception e) {
            LOG.warnf(e, "Failed to parse response from model [%s]", modelId);
        }
        return UNPARSEABLE_RESPONSE;
    }

    static boolean isThrottling(Exception e) {
        if (e instanceof ThrottlingException) {
            return true;
        }
        if (e instanceof SdkServiceException serviceException) {
            return serviceException.statusCode() == HTTP_TOO_MANY_REQUESTS || serviceException.isThrottlingException();
        }
        if (e instanceof SdkClientException) {
            String message = e.getMessage();
            return message != null && message.contains("Too many requests");
        }
        return false;
    }
}
