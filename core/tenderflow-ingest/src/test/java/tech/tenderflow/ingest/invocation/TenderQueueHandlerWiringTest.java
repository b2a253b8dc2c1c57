package tech.tenderflow.ingest.invocation;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.events.SQSEvent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.arc.Arc;
import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.DeleteMessageBatchRequest;
import software.amazon.awssdk.services.sqs.model.DeleteMessageBatchResponse;
import software.amazon.awssdk.services.sqs.model.DeleteMessageBatchResultEntry;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageResponse;
import software.amazon.awssdk.services.sqs.model.SendMessageBatchRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageBatchResponse;
import software.amazon.awssdk.services.sqs.model.SendMessageBatchResultEntry;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.GetParameterRequest;
import software.amazon.awssdk.services.ssm.model.GetParameterResponse;
import software.amazon.awssdk.services.ssm.model.Parameter;
import tech.tenderflow.ingest.config.PipelineQueues;
import tech.tenderflow.ingest.config.TenderPipelineConfig;
import tech.tenderflow.ingest.model.EskomTenderMessage;
import tech.tenderflow.ingest.model.TenderJson;
import tech.tenderflow.ingest.model.TenderSource;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@QuarkusTest
class TenderQueueHandlerWiringTest {

    private static final String SOURCE_URL = "http://localhost:4566/000000000000/tender-source";
    private static final String SUCCESS_URL = "http://localhost:4566/000000000000/tender-processed";

    @InjectMock
    SqsClient sqsClient;

    @InjectMock
    BedrockRuntimeClient bedrockClient;

    @InjectMock
    SsmClient ssmClient;

    @Inject
    @Named(TenderJson.MAPPER_NAME)
    ObjectMapper mapper;

    @Inject
    PipelineQueues queues;

    @Inject
    TenderPipelineConfig config;

    @Inject
    @ConfigProperty(name = "quarkus.lambda.handler")
    String handlerName;

    private Context context;

    @BeforeEach
    void setUp() {
        context = mock(Context.class);
        when(context.getAwsRequestId()).thenReturn("req-wiring");
        when(context.getRemainingTimeInMillis()).thenReturn(60_000);

        when(sqsClient.sendMessageBatch(any(SendMessageBatchRequest.class))).thenAnswer(invocation -> {
            SendMessageBatchRequest request = invocation.getArgument(0);
            return SendMessageBatchResponse.builder()
                .successful(request.entries().stream()
                    .map(e -> SendMessageBatchResultEntry.builder().id(e.id()).messageId("sqs-" + e.id()).build())
                    .toList())
                .build();
        });
        when(sqsClient.deleteMessageBatch(any(DeleteMessageBatchRequest.class))).thenAnswer(invocation -> {
            DeleteMessageBatchRequest request = invocation.getArgument(0);
            return DeleteMessageBatchResponse.builder()
                .successful(request.entries().stream()
                    .map(e -> DeleteMessageBatchResultEntry.builder().id(e.id()).build())
                    .toList())
                .build();
        });
        when(sqsClient.receiveMessage(any(ReceiveMessageRequest.class)))
            .thenReturn(ReceiveMessageResponse.builder().build());

        when(ssmClient.getParameter(any(GetParameterRequest.class))).thenAnswer(invocation -> {
            GetParameterRequest request = invocation.getArgument(0);
            return GetParameterResponse.builder()
                .parameter(Parameter.builder().name(request.name()).value("Prompt for " + request.name()).build())
                .build();
        });
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class))).thenReturn(InvokeModelResponse.builder()
            .body(SdkBytes.fromUtf8String(
                "{\"output\":{\"message\":{\"content\":[{\"text\":\"Office furniture for regional offices.\"}]}}}"))
            .build());
    }

    @Test
    void shouldResolveConfiguredHandlerAndProcessDeliveredMessage() throws Exception {
        // Given
        TenderQueueHandler handler = (TenderQueueHandler) Arc.container().instance(handlerName).get();
        assertNotNull(handler);

        SQSEvent.SQSMessage record = new SQSEvent.SQSMessage();
        record.setMessageId("m-1");
        record.setReceiptHandle("receipt-m-1");
        record.setAttributes(Map.of("MessageGroupId", "eTenderScrape"));
        record.setBody("""
            {"title": "Supply of office furniture", "tenderNumber": 20251234,
             "dateClosing": "2025-06-20T11:00:00+02:00"}
            """);
        SQSEvent event = new SQSEvent();
        event.setRecords(List.of(record));

        // When
        String result = handler.handleRequest(event, context);

        // Then
        assertThat(result).startsWith("Batches: 1, Processed: 1, Failed: 0, Deleted: 1");

        ArgumentCaptor<SendMessageBatchRequest> sent = ArgumentCaptor.forClass(SendMessageBatchRequest.class);
        verify(sqsClient).sendMessageBatch(sent.capture());
        assertEquals(SUCCESS_URL, sent.getValue().queueUrl());

        JsonNode tender = mapper.readTree(sent.getValue().entries().get(0).messageBody());
        assertEquals("20251234", tender.get("tenderNumber").asText());
        assertEquals(LocalDateTime.of(2025, 6, 20, 9, 0), LocalDateTime.parse(tender.get("dateClosing").asText()));
        assertEquals("Office furniture for regional offices.", tender.get("summary").asText());
        assertThat(tender.get("tags").toString()).contains("Processed", "ProcessedByeTendersHandler");

        ArgumentCaptor<GetParameterRequest> prompts = ArgumentCaptor.forClass(GetParameterRequest.class);
        verify(ssmClient, times(2)).getParameter(prompts.capture());
        assertThat(prompts.getAllValues()).extracting(GetParameterRequest::name)
            .containsExactlyInAnyOrder("/TenderSummary/Prompts/System", "/TenderSummary/Prompts/eTenders");

        ArgumentCaptor<DeleteMessageBatchRequest> deleted = ArgumentCaptor.forClass(DeleteMessageBatchRequest.class);
        verify(sqsClient).deleteMessageBatch(deleted.capture());
        assertEquals(SOURCE_URL, deleted.getValue().queueUrl());
        assertEquals("receipt-m-1", deleted.getValue().entries().get(0).receiptHandle());
    }

    @Test
    void shouldLoadQueuesAndDefaultsFromConfiguration() {
        assertEquals(SOURCE_URL, queues.sourceUrl());
        assertEquals(SUCCESS_URL, queues.successUrl());
        assertEquals("http://localhost:4566/000000000000/tender-failed", queues.deadLetterUrl());

        assertEquals(EnumSet.allOf(TenderSource.class), EnumSet.copyOf(config.enrichment().sources()));
        assertEquals(3, config.enrichment().maxConcurrency());
        assertEquals(5, config.enrichment().maxAttempts());
    }

    @Test
    void shouldProvideCaseInsensitivePipelineMapper() throws Exception {
        JsonNode tender = mapper.readTree(mapper.writeValueAsString(
            mapper.readValue("{\"Title\": \"Boiler refurbishment\"}", EskomTenderMessage.class)));

        assertEquals("Boiler refurbishment", tender.get("title").asText());
    }
}
