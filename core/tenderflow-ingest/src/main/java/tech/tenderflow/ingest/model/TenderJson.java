package tech.tenderflow.ingest.model;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Jackson setup shared by the router, the queue writers and the summary client.
 *
 * <p>Property names match case-insensitively so scrapers using PascalCase or camelCase
 * both deserialize. Output is camelCase with ISO-8601 dates.
 */
public final class TenderJson {

    /**
     * CDI name of the pipeline's mapper, kept apart from the mapper the Lambda runtime uses for events.
     */
    public static final String MAPPER_NAME = "tender-json";

    private TenderJson() {
    }

    public static ObjectMapper newMapper() {
        return JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    }
}
