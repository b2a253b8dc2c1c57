package tech.tenderflow.ingest.router;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jboss.logging.Logger;
import tech.tenderflow.ingest.model.TenderJson;
import tech.tenderflow.ingest.model.TenderMessage;
import tech.tenderflow.ingest.model.TenderSource;

/**
 * Classifies raw queue bodies into tender messages.
 *
 * <p>The classification key selects the source, the source selects the message type. There is
 * no generic fallback type: anything that does not resolve to a known source and deserialize
 * cleanly into that source's type is a {@link ClassificationException}.
 */
@ApplicationScoped
public class TenderMessageRouter {

    private static final Logger LOG = Logger.getLogger(TenderMessageRouter.class);

    private final ObjectMapper objectMapper;

    @Inject
    public TenderMessageRouter(@Named(TenderJson.MAPPER_NAME) ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public TenderMessage classify(String body, String classificationKey) {
        if (classificationKey == null || classificationKey.isBlank()) {
            throw new ClassificationException(classificationKey, "Message has no classification key");
        }

        TenderSource source = TenderSource.fromClassificationKey(classificationKey)
            .orElseThrow(() -> new ClassificationException(classificationKey,
                "Unknown classification key: " + classificationKey));

        if (body == null || body.isBlank()) {
            throw new ClassificationException(classificationKey, "Message body is empty");
        }

        TenderMessage message;
        try {
            message = objectMapper.readValue(body, source.messageType());
        } catch (JsonProcessingException e) {
            throw new ClassificationException(classificationKey,
                "Failed to deserialize " + source.displayName() + " message: " + e.getOriginalMessage(), e);
        }

        if (message == null) {
            throw new ClassificationException(classificationKey, "Message body deserialized to null");
        }

        LOG.debugf("Classified message with key [%s] as %s", classificationKey, source.displayName());
        return message;
    }
}
