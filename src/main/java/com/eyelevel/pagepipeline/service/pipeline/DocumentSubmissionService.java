package com.eyelevel.pagepipeline.service.pipeline;

import com.eyelevel.pagepipeline.service.asynctask.BackgroundTaskManager;
import com.eyelevel.pagepipeline.service.asynctask.TaskStatusView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point for callers that want a document converted in the background.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentSubmissionService {

    private final BackgroundTaskManager taskManager;
    private final DocumentRetryService retryService;

    /**
     * Queues the document and returns the task id to poll.
     *
     * @throws com.eyelevel.pagepipeline.exception.TaskCapacityExceededException if the worker queue is full
     */
    public String submitDocument(Long documentId) {
        String taskId = taskManager.submit(() -> retryService.process(documentId),
                "process_document_" + documentId);
        log.info("[DocumentId: {}] Queued for processing as task {}.", documentId, taskId);
        return taskId;
    }

    public Optional<TaskStatusView> getTaskStatus(String taskId) {
        return taskManager.status(taskId);
    }
}
