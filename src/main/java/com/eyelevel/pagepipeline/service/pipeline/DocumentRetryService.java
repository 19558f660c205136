package com.eyelevel.pagepipeline.service.pipeline;

import com.eyelevel.pagepipeline.config.DocumentProcessingConfig;
import com.eyelevel.pagepipeline.exception.DocumentNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.retry.support.RetryTemplateBuilder;
import org.springframework.stereotype.Service;

/**
 * Runs the pipeline for a document and reruns it after unexpected failures, with a fixed delay
 * between attempts. A missing document is not retried. When all attempts are used up the
 * document keeps the FAILED status and error written by the last attempt.
 */
@Slf4j
@Service
public class DocumentRetryService {

    private final DocumentPipelineService pipelineService;
    private final RetryTemplate retryTemplate;

    public DocumentRetryService(DocumentPipelineService pipelineService, DocumentProcessingConfig config,
                                PipelineRetryListener retryListener) {
        this.pipelineService = pipelineService;
        DocumentProcessingConfig.RetryConfig retry = config.getRetry();
        RetryTemplateBuilder builder = RetryTemplate.builder()
                .maxAttempts(Math.max(0, retry.getMaxRetries()) + 1)
                .notRetryOn(DocumentNotFoundException.class)
                .withListener(retryListener);
        if (retry.getDelayMs() > 0) {
            builder.fixedBackoff(retry.getDelayMs());
        } else {
            builder.noBackoff();
        }
        this.retryTemplate = builder.build();
        log.info("Document retry policy: {} retries with a fixed delay of {} ms.", retry.getMaxRetries(),
                retry.getDelayMs());
    }

    /**
     * @throws DocumentNotFoundException if the document does not exist
     */
    public PipelineResult process(Long documentId) {
        return retryTemplate.execute(
                context -> pipelineService.run(documentId).withAttempts(context.getRetryCount() + 1),
                context -> {
                    Throwable last = context.getLastThrowable();
                    if (last instanceof DocumentNotFoundException notFound) {
                        throw notFound;
                    }
                    String error = last == null ? "unknown error" : last.getMessage();
                    log.error("[DocumentId: {}] Pipeline failed after {} attempts. Giving up: {}", documentId,
                            context.getRetryCount(), error);
                    return PipelineResult.failure(error).withAttempts(context.getRetryCount());
                });
    }
}
