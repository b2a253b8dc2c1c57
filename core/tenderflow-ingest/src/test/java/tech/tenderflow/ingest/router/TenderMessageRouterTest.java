package tech.tenderflow.ingest.router;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import tech.tenderflow.ingest.model.ETenderMessage;
import tech.tenderflow.ingest.model.EskomTenderMessage;
import tech.tenderflow.ingest.model.SupportingDocument;
import tech.tenderflow.ingest.model.TenderJson;
import tech.tenderflow.ingest.model.TenderMessage;
import tech.tenderflow.ingest.model.TransnetTenderMessage;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class TenderMessageRouterTest {

    private TenderMessageRouter router;

    @BeforeEach
    void setUp() {
        router = new TenderMessageRouter(TenderJson.newMapper());
    }

    @Test
    void shouldClassifyETender() {
        String body = """
            {
                "id": 9123,
                "title": "Supply of office furniture",
                "tenderNumber": "DPW-2024-17",
                "status": "Published",
                "datePublished": "2024-03-01T09:00:00",
                "dateClosing": "2024-03-29T11:00:00",
                "supporting_docs": [{"name": "Terms", "url": "https://example.org/terms.pdf"}]
            }
            """;

        TenderMessage message = router.classify(body, "eTenderScrape");

        ETenderMessage eTender = assertInstanceOf(ETenderMessage.class, message);
        assertEquals(9123, eTender.getId());
        assertEquals("DPW-2024-17", eTender.getTenderNumber());
        assertEquals(LocalDateTime.of(2024, 3, 29, 11, 0), eTender.getDateClosing());
        assertEquals(List.of(new SupportingDocument("Terms", "https://example.org/terms.pdf")), eTender.getSupportingDocs());
    }

    @Test
    void shouldClassifyEskomWithPascalCaseFields() {
        String body = """
            {"Title": "Boiler refurbishment", "TenderNumber": "E-551", "Source": "Eskom Tender Bulletin", "SupportingDocs": []}
            """;

        TenderMessage message = router.classify(body, "EskomTenderScrape");

        EskomTenderMessage eskom = assertInstanceOf(EskomTenderMessage.class, message);
        assertEquals("Boiler refurbishment", eskom.getTitle());
        assertEquals("E-551", eskom.getTenderNumber());
        assertEquals("Eskom Tender Bulletin", eskom.getSource());
    }

    @Test
    void shouldClassifyTransnet() {
        String body = """
            {"title": "Rail grinding", "institution": "Transnet Freight Rail", "tenderType": "RFP", "closingDate": "2024-08-15T10:00:00"}
            """;

        TransnetTenderMessage transnet = assertInstanceOf(TransnetTenderMessage.class, router.classify(body, "transnetlambda"));
        assertEquals("Transnet Freight Rail", transnet.getInstitution());
        assertEquals("RFP", transnet.getTenderType());
    }

    @Test
    void shouldNormalizeNumericTenderNumber() {
        assertEquals("20241234", router.classify("{\"tenderNumber\": 20241234}", "eTenderScrape").getTenderNumber());
        assertEquals("1234.5", router.classify("{\"tenderNumber\": 1234.50}", "eTenderScrape").getTenderNumber());
        assertEquals("RFQ 12", router.classify("{\"tenderNumber\": \"RFQ 12\"}", "eTenderScrape").getTenderNumber());
    }

    @Test
    void shouldRejectStructuredTenderNumber() {
        ClassificationException e = assertThrows(ClassificationException.class,
            () -> router.classify("{\"tenderNumber\": {\"value\": 1}}", "eTenderScrape"));

        assertEquals("eTenderScrape", e.getClassificationKey());
    }

    @Test
    void shouldReadLocalDateTime() {
        ETenderMessage eTender = (ETenderMessage) router.classify(
            "{\"dateClosing\": \"2025-06-20T11:00:00\"}", "eTenderScrape");

        assertEquals(LocalDateTime.of(2025, 6, 20, 11, 0), eTender.getDateClosing());
    }

    @Test
    void shouldConvertOffsetDateTimeToUtc() {
        ETenderMessage eTender = (ETenderMessage) router.classify(
            "{\"datePublished\": \"2025-06-20T11:00:00+02:00\", \"dateClosing\": \"2025-06-27T09:30:00Z\"}",
            "eTenderScrape");

        assertEquals(LocalDateTime.of(2025, 6, 20, 9, 0), eTender.getDatePublished());
        assertEquals(LocalDateTime.of(2025, 6, 27, 9, 30), eTender.getDateClosing());
    }

    @Test
    void shouldConvertZonedDateTimeToUtc() {
        TransnetTenderMessage transnet = (TransnetTenderMessage) router.classify(
            "{\"closingDate\": \"2025-06-20T11:00:00+02:00[Africa/Johannesburg]\"}", "TransnetTenderScrape");

        assertEquals(LocalDateTime.of(2025, 6, 20, 9, 0), transnet.getClosingDate());
    }

    @Test
    void shouldReadDateOnlyAsStartOfDay() {
        EskomTenderMessage eskom = (EskomTenderMessage) router.classify(
            "{\"PublishedDate\": \"2025-06-20\", \"ClosingDate\": \"\"}", "EskomTenderScrape");

        assertEquals(LocalDateTime.of(2025, 6, 20, 0, 0), eskom.getPublishedDate());
        assertNull(eskom.getClosingDate());
    }

    @ParameterizedTest
    @ValueSource(strings = {"{\"dateClosing\": \"next friday\"}", "{\"dateClosing\": 20250620}", "{\"dateClosing\": \"2025-13-01\"}"})
    void shouldRejectUnreadableDates(String body) {
        ClassificationException e = assertThrows(ClassificationException.class, () -> router.classify(body, "eTenderScrape"));

        assertEquals("eTenderScrape", e.getClassificationKey());
    }

    @ParameterizedTest
    @ValueSource(strings = {"Unknown", "sanralscrape", "eTenders"})
    void shouldRejectUnknownClassificationKey(String key) {
        ClassificationException e = assertThrows(ClassificationException.class,
            () -> router.classify("{\"title\": \"x\"}", key));

        assertThat(e.getMessage()).contains("Unknown classification key").contains(key);
    }

    @Test
    void shouldRejectNullClassificationKey() {
        assertThrows(ClassificationException.class, () -> router.classify("{\"title\": \"x\"}", null));
    }

    @ParameterizedTest
    @ValueSource(strings = {"not json", "[1, 2, 3]", "\"just a string\"", "null", "  "})
    void shouldRejectBodiesThatDoNotMatchTheType(String body) {
        assertThrows(ClassificationException.class, () -> router.classify(body, "eskomlambda"));
    }

    @Test
    void shouldIgnoreUnknownFields() {
        TenderMessage message = router.classify("{\"title\": \"x\", \"scrapedAt\": \"yesterday\"}", "eskomlambda");

        assertEquals("x", message.getTitle());
    }
}
