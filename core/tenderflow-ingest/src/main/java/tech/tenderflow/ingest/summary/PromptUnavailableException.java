package tech.tenderflow.ingest.summary;

/**
 * A prompt could not be read from the parameter store.
 */
public class PromptUnavailableException extends RuntimeException {

    public PromptUnavailableException(String message) {
        super(message);
    }

    public PromptUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
