package tech.tenderflow.ingest.router;

/**
 * A raw message could not be turned into a tender: unknown or missing classification key,
 * or a body that does not match the bound message type.
 */
public class ClassificationException extends RuntimeException {

    private final String classificationKey;

    public ClassificationException(String classificationKey, String message) {
        super(message);
        this.classificationKey = classificationKey;
    }

    public ClassificationException(String classificationKey, String message, Throwable cause) {
        super(message, cause);
        this.classificationKey = classificationKey;
    }

    public String getClassificationKey() {
        return classificationKey;
    }
}
