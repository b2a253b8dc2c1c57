package tech.tenderflow.ingest.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tender scraped from the national eTender portal.
 */
public class ETenderMessage extends TenderMessage {

    private int id;
    private String status = "";
    private LocalDateTime datePublished;
    private LocalDateTime dateClosing;
    private String url = "";

    @Override
    public TenderSource tenderSource() {
        return TenderSource.ETENDERS;
    }

    @Override
    protected void addVariantProjection(Map<String, Object> fields) {
        if (id > 0) {
            fields.put("id", id);
        }
        putIfPresent(fields, "status", status);
        putIfPresent(fields, "url", url);
        putIfPresent(fields, "published", datePublished);
        putIfPresent(fields, "closing", dateClosing);
    }

    @Override
    public Map<String, String> fallbackDetails() {
        Map<String, String> details = new LinkedHashMap<>();
        putIfPresent(details, "Status", status);
        putIfPresent(details, "Closing", dateClosing);
        putIfPresent(details, "URL", url);
        return details;
    }

    public int getId() {
        return id;
    }

    public void setId(int id) {
        this.id = id;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = nullToEmpty(status);
    }

    public LocalDateTime getDatePublished() {
        return datePublished;
    }

    @JsonDeserialize(using = TenderDateDeserializer.class)
    public void setDatePublished(LocalDateTime datePublished) {
        this.datePublished = datePublished;
    }

    public LocalDateTime getDateClosing() {
        return dateClosing;
    }

    @JsonDeserialize(using = TenderDateDeserializer.class)
    public void setDateClosing(LocalDateTime dateClosing) {
        this.dateClosing = dateClosing;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = nullToEmpty(url);
    }
}
