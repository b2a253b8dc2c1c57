package tech.tenderflow.ingest.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Reads scraper dates into a {@link LocalDateTime}.
 *
 * <p>Accepted forms: local date-time ({@code 2025-06-20T11:00:00}), date-time with an offset or
 * zone ({@code 2025-06-20T11:00:00+02:00}, converted to UTC) and date only ({@code 2025-06-20},
 * start of day). A blank string reads as null.
 */
public class TenderDateDeserializer extends JsonDeserializer<LocalDateTime> {

    @Override
    public LocalDateTime deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (p.currentToken() != JsonToken.VALUE_STRING) {
            return (LocalDateTime) ctxt.handleUnexpectedToken(LocalDateTime.class, p);
        }

        String text = p.getText().trim();
        if (text.isEmpty()) {
            return null;
        }

        try {
            return parse(text);
        } catch (DateTimeParseException e) {
            return (LocalDateTime) ctxt.handleWeirdStringValue(LocalDateTime.class, text,
                "expected an ISO-8601 date or date-time");
        }
    }

    static LocalDateTime parse(String text) {
        if (text.indexOf('T') < 0) {
            return LocalDate.parse(text).atStartOfDay();
        }
        TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text, ZonedDateTime::from, LocalDateTime::from);
        if (parsed instanceof ZonedDateTime) {
            return ((ZonedDateTime) parsed).withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
        return (LocalDateTime) parsed;
    }
}
