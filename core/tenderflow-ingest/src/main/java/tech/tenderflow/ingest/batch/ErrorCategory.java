package tech.tenderflow.ingest.batch;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where in the pipeline a message failed.
 */
public enum ErrorCategory {
    /** Unknown or missing classification key, or a body that does not match its type. */
    CLASSIFICATION("classification"),

    /** Classified, but tagging, summarizing or serializing the tender failed. */
    PROCESSING("processing"),

    /** Processed, but the success queue did not acknowledge it. */
    DOWNSTREAM("downstream");

    private final String wireName;

    ErrorCategory(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
