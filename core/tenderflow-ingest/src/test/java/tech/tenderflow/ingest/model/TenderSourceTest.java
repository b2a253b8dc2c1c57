package tech.tenderflow.ingest.model;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class TenderSourceTest {

    @ParameterizedTest
    @CsvSource({
        "eTenderScrape, ETENDERS",
        "ETENDERLAMBDA, ETENDERS",
        "EskomTenderScrape, ESKOM",
        "eskomlambda, ESKOM",
        "TransnetTenderScrape, TRANSNET",
        "' transnetLambda ', TRANSNET"
    })
    void shouldResolveAliasesCaseInsensitively(String key, TenderSource expected) {
        assertEquals(expected, TenderSource.fromClassificationKey(key).orElseThrow());
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"Unknown", "eTenders", "sanralscrape"})
    void shouldNotResolveUnknownKeys(String key) {
        assertTrue(TenderSource.fromClassificationKey(key).isEmpty());
    }

    @ParameterizedTest
    @CsvSource({"ETENDERS, ETenderMessage", "ESKOM, EskomTenderMessage", "TRANSNET, TransnetTenderMessage"})
    void shouldBindEachSourceToItsMessageType(TenderSource source, String typeName) {
        assertEquals(typeName, source.messageType().getSimpleName());
    }
}
