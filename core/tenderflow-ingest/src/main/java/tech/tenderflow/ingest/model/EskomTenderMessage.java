package tech.tenderflow.ingest.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tender scraped from the Eskom procurement portal.
 */
public class EskomTenderMessage extends TenderMessage {

    private String source = "";
    private LocalDateTime publishedDate;
    private LocalDateTime closingDate;

    @Override
    public TenderSource tenderSource() {
        return TenderSource.ESKOM;
    }

    @Override
    protected void addVariantProjection(Map<String, Object> fields) {
        putIfPresent(fields, "sourceDetail", source);
        putIfPresent(fields, "published", publishedDate);
        putIfPresent(fields, "closing", closingDate);
    }

    @Override
    public Map<String, String> fallbackDetails() {
        Map<String, String> details = new LinkedHashMap<>();
        putIfPresent(details, "Source Detail", source);
        putIfPresent(details, "Closing", closingDate);
        return details;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = nullToEmpty(source);
    }

    public LocalDateTime getPublishedDate() {
        return publishedDate;
    }

    @JsonDeserialize(using = TenderDateDeserializer.class)
    public void setPublishedDate(LocalDateTime publishedDate) {
        this.publishedDate = publishedDate;
    }

    public LocalDateTime getClosingDate() {
        return closingDate;
    }

    @JsonDeserialize(using = TenderDateDeserializer.class)
    public void setClosingDate(LocalDateTime closingDate) {
        this.closingDate = closingDate;
    }
}
