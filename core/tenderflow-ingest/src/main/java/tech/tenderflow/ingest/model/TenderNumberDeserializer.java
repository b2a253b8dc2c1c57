package tech.tenderflow.ingest.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;

/**
 * Reads a tender number that scrapers publish either as text or as a JSON number.
 * The value is always normalized to text. Decimal numbers are written without exponent or trailing zeros.
 */
public class TenderNumberDeserializer extends JsonDeserializer<String> {

    @Override
    public String deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonToken token = p.currentToken();
        if (token == JsonToken.VALUE_STRING) {
            return p.getText();
        }
        if (token == JsonToken.VALUE_NUMBER_INT) {
            return p.getText();
        }
        if (token == JsonToken.VALUE_NUMBER_FLOAT) {
            return p.getDecimalValue().stripTrailingZeros().toPlainString();
        }
        return (String) ctxt.handleUnexpectedToken(String.class, p);
    }

    @Override
    public String getNullValue(DeserializationContext ctxt) {
        return "";
    }
}
