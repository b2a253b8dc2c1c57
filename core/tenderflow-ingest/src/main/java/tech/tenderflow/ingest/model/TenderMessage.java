package tech.tenderflow.ingest.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Common shape of every tender, whatever scraper produced it.
 *
 * <p>Subtypes are closed: one per {@link TenderSource}. Each subtype knows its own source,
 * and therefore its own outgoing group key, and contributes its variant fields to the compact
 * projection and the fallback summary, so no caller needs to inspect the runtime type.
 *
 * <p>String fields are never null after deserialization; missing values read as {@code ""}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class TenderMessage {

    private static final DateTimeFormatter SUMMARY_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private String title = "";
    private String description = "";
    private String tenderNumber = "";
    private String reference = "";
    private String audience = "";
    private String officeLocation = "";
    private String email = "";
    private String address = "";
    private String province = "";
    private List<SupportingDocument> supportingDocs = new ArrayList<>();
    private List<String> tags = new ArrayList<>();
    private String summary;

    /**
     * The source this message variant belongs to.
     */
    @JsonIgnore
    public abstract TenderSource tenderSource();

    /**
     * Group key used when this message is written to a FIFO queue.
     */
    @JsonIgnore
    public String groupKey() {
        return tenderSource().displayName();
    }

    @JsonProperty(value = "sourceType", access = JsonProperty.Access.READ_ONLY)
    public String getSourceType() {
        return tenderSource().displayName();
    }

    /**
     * Only the non-empty fields, under short keys, for size-bounded model requests.
     */
    public Map<String, Object> compactProjection() {
        Map<String, Object> fields = new LinkedHashMap<>();
        putIfPresent(fields, "number", tenderNumber);
        putIfPresent(fields, "title", title);
        putIfPresent(fields, "description", description);
        putIfPresent(fields, "reference", reference);
        putIfPresent(fields, "audience", audience);
        putIfPresent(fields, "office", officeLocation);
        putIfPresent(fields, "address", address);
        putIfPresent(fields, "province", province);
        putIfPresent(fields, "email", email);
        fields.put("source", tenderSource().displayName());
        if (!supportingDocs.isEmpty()) {
            fields.put("docs", List.copyOf(supportingDocs));
        }
        addVariantProjection(fields);
        return fields;
    }

    /**
     * Variant-specific {@code label -> value} lines for the fallback summary, only for fields present.
     */
    public abstract Map<String, String> fallbackDetails();

    protected abstract void addVariantProjection(Map<String, Object> fields);

    protected static void putIfPresent(Map<String, ? super String> fields, String key, String value) {
        if (value != null && !value.isEmpty()) {
            fields.put(key, value);
        }
    }

    protected static void putIfPresent(Map<String, ? super String> fields, String key, LocalDateTime value) {
        if (value != null) {
            fields.put(key, value.format(SUMMARY_DATE));
        }
    }

    protected static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = nullToEmpty(title);
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = nullToEmpty(description);
    }

    public String getTenderNumber() {
        return tenderNumber;
    }

    @JsonDeserialize(using = TenderNumberDeserializer.class)
    public void setTenderNumber(String tenderNumber) {
        this.tenderNumber = nullToEmpty(tenderNumber);
    }

    public String getReference() {
        return reference;
    }

    public void setReference(String reference) {
        this.reference = nullToEmpty(reference);
    }

    public String getAudience() {
        return audience;
    }

    public void setAudience(String audience) {
        this.audience = nullToEmpty(audience);
    }

    public String getOfficeLocation() {
        return officeLocation;
    }

    public void setOfficeLocation(String officeLocation) {
        this.officeLocation = nullToEmpty(officeLocation);
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = nullToEmpty(email);
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = nullToEmpty(address);
    }

    public String getProvince() {
        return province;
    }

    public void setProvince(String province) {
        this.province = nullToEmpty(province);
    }

    public List<SupportingDocument> getSupportingDocs() {
        return supportingDocs;
    }

    @JsonAlias("supporting_docs")
    public void setSupportingDocs(List<SupportingDocument> supportingDocs) {
        this.supportingDocs = supportingDocs == null ? new ArrayList<>() : new ArrayList<>(supportingDocs);
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags == null ? new ArrayList<>() : new ArrayList<>(tags);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }
}
