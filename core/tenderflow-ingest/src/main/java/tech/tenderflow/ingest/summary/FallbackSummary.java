package tech.tenderflow.ingest.summary;

import tech.tenderflow.ingest.model.TenderMessage;

/**
 * Summary built from the tender's own fields when the model cannot produce one.
 */
public final class FallbackSummary {

    static final String HEADER = "**AUTOMATED SUMMARY (Fallback)**";
    static final String REVIEW_NOTICE = "*AI summary unavailable due to service limitations - manual review required*";

    private FallbackSummary() {
    }

    public static String build(TenderMessage tender) {
        StringBuilder summary = new StringBuilder();
        summary.append(HEADER).append('\n');

        line(summary, "Tender", tender.getTitle());
        line(summary, "Number", tender.getTenderNumber());
        line(summary, "Source", tender.tenderSource().displayName());
        line(summary, "Purpose", tender.getDescription());

        tender.fallbackDetails().forEach((label, value) -> line(summary, label, value));

        line(summary, "Email", tender.getEmail());
        line(summary, "Location", (tender.getOfficeLocation() + " " + tender.getProvince()).trim());

        if (!tender.getSupportingDocs().isEmpty()) {
            line(summary, "Documents", tender.getSupportingDocs().size() + " available");
        }

        summary.append(REVIEW_NOTICE).append('\n');
        return summary.toString();
    }

    private static void line(StringBuilder summary, String label, String value) {
        if (value != null && !value.isEmpty()) {
            summary.append("**").append(label).append(":** ").append(value).append('\n');
        }
    }
}
