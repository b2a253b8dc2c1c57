package tech.tenderflow.ingest.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tender scraped from the Transnet eTender portal.
 */
public class TransnetTenderMessage extends TenderMessage {

    private String institution = "";
    private String category = "";
    private String tenderType = "";
    private String location = "";
    private String contactPerson = "";
    private String source = "";
    private LocalDateTime publishedDate;
    private LocalDateTime closingDate;

    @Override
    public TenderSource tenderSource() {
        return TenderSource.TRANSNET;
    }

    @Override
    protected void addVariantProjection(Map<String, Object> fields) {
        putIfPresent(fields, "institution", institution);
        putIfPresent(fields, "category", category);
        putIfPresent(fields, "type", tenderType);
        putIfPresent(fields, "location", location);
        putIfPresent(fields, "contact", contactPerson);
        putIfPresent(fields, "sourceDetail", source);
        putIfPresent(fields, "published", publishedDate);
        putIfPresent(fields, "closing", closingDate);
    }

    @Override
    public Map<String, String> fallbackDetails() {
        Map<String, String> details = new LinkedHashMap<>();
        putIfPresent(details, "Institution", institution);
        putIfPresent(details, "Category", category);
        putIfPresent(details, "Location", location);
        putIfPresent(details, "Contact", contactPerson);
        putIfPresent(details, "Closing", closingDate);
        return details;
    }

    public String getInstitution() {
        return institution;
    }

    public void setInstitution(String institution) {
        this.institution = nullToEmpty(institution);
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = nullToEmpty(category);
    }

    public String getTenderType() {
        return tenderType;
    }

    public void setTenderType(String tenderType) {
        this.tenderType = nullToEmpty(tenderType);
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = nullToEmpty(location);
    }

    public String getContactPerson() {
        return contactPerson;
    }

    public void setContactPerson(String contactPerson) {
        this.contactPerson = nullToEmpty(contactPerson);
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
