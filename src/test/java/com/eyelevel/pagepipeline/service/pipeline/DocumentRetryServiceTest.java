package com.eyelevel.pagepipeline.service.pipeline;

import com.eyelevel.pagepipeline.config.DocumentProcessingConfig;
import com.eyelevel.pagepipeline.exception.DocumentNotFoundException;
import com.eyelevel.pagepipeline.exception.DocumentProcessingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentRetryService")
class DocumentRetryServiceTest {

    private static final Long DOCUMENT_ID = 5L;

    @Mock
    private DocumentPipelineService pipelineService;

    private DocumentRetryService retryService;

    @BeforeEach
    void setUp() {
        DocumentProcessingConfig config = new DocumentProcessingConfig();
        config.getRetry().setMaxRetries(3);
        config.getRetry().setDelayMs(0);
        retryService = new DocumentRetryService(pipelineService, config, new PipelineRetryListener());
    }

    @Test
    @DisplayName("a transient failure on the first attempt completes on the second")
    void process_transientFailure_succeedsOnSecondAttempt() {
        when(pipelineService.run(DOCUMENT_ID))
                .thenThrow(new DocumentProcessingException("storage hiccup"))
                .thenReturn(PipelineResult.success(4, 4));

        PipelineResult result = retryService.process(DOCUMENT_ID);

        assertThat(result.success()).isTrue();
        assertThat(result.attempts()).isEqualTo(2);
        verify(pipelineService, times(2)).run(DOCUMENT_ID);
    }

    @Test
    @DisplayName("a first-time success runs once")
    void process_success_runsOnce() {
        when(pipelineService.run(DOCUMENT_ID)).thenReturn(PipelineResult.success(1, 1));

        PipelineResult result = retryService.process(DOCUMENT_ID);

        assertThat(result.attempts()).isEqualTo(1);
        verify(pipelineService, times(1)).run(DOCUMENT_ID);
    }

    @Test
    @DisplayName("persistent failures stop after max retries and return the last error")
    void process_exhausted_returnsFailure() {
        when(pipelineService.run(DOCUMENT_ID))
                .thenThrow(new DocumentProcessingException("first"))
                .thenThrow(new DocumentProcessingException("second"))
                .thenThrow(new DocumentProcessingException("third"))
                .thenThrow(new DocumentProcessingException("last"));

        PipelineResult result = retryService.process(DOCUMENT_ID);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("last");
        assertThat(result.attempts()).isEqualTo(4);
        verify(pipelineService, times(4)).run(DOCUMENT_ID);
    }

    @Test
    @DisplayName("a failed result from an input error is not retried")
    void process_inputError_notRetried() {
        when(pipelineService.run(DOCUMENT_ID)).thenReturn(PipelineResult.failure("Source file is empty"));

        PipelineResult result = retryService.process(DOCUMENT_ID);

        assertThat(result.success()).isFalse();
        assertThat(result.attempts()).isEqualTo(1);
        verify(pipelineService, times(1)).run(DOCUMENT_ID);
    }

    @Test
    @DisplayName("a missing document is not retried and propagates")
    void process_notFound_propagates() {
        when(pipelineService.run(DOCUMENT_ID)).thenThrow(new DocumentNotFoundException(DOCUMENT_ID));

        assertThatThrownBy(() -> retryService.process(DOCUMENT_ID))
                .isInstanceOf(DocumentNotFoundException.class);
        verify(pipelineService, times(1)).run(DOCUMENT_ID);
    }
}
