package tech.tenderflow.ingest.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PipelineQueuesTest {

    @Test
    void shouldResolveQueuesFromConfig() {
        // Given
        TenderPipelineConfig config = mock(TenderPipelineConfig.class);
        TenderPipelineConfig.Queues queues = mock(TenderPipelineConfig.Queues.class);
        when(config.queues()).thenReturn(queues);
        when(queues.sourceUrl()).thenReturn("https://sqs/read");
        when(queues.successUrl()).thenReturn("https://sqs/write");
        when(queues.deadLetterUrl()).thenReturn("https://sqs/failed");

        // When
        PipelineQueues resolved = PipelineQueues.from(config);

        // Then
        assertEquals(new PipelineQueues("https://sqs/read", "https://sqs/write", "https://sqs/failed"), resolved);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    void shouldFailFastOnMissingDeadLetterQueue(String url) {
        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> new PipelineQueues("https://sqs/read", "https://sqs/write", url));

        assertThat(e.getMessage()).contains("tender-pipeline.queues.dead-letter-url");
    }

    @Test
    void shouldFailFastOnMissingSourceQueue() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> new PipelineQueues(null, "https://sqs/write", "https://sqs/failed"));

        assertThat(e.getMessage()).contains("source-url");
    }
}
