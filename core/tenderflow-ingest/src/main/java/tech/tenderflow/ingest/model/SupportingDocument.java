package tech.tenderflow.ingest.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Reference to a document published alongside a tender.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SupportingDocument(String name, String url) {
}
