package com.eyelevel.pagepipeline.service.pipeline;

import com.eyelevel.pagepipeline.exception.DocumentNotFoundException;
import com.eyelevel.pagepipeline.exception.TaskCapacityExceededException;
import com.eyelevel.pagepipeline.model.DocumentUpdate;
import com.eyelevel.pagepipeline.model.ProcessingStatus;
import com.eyelevel.pagepipeline.repository.DocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Clears the output of previously processed documents and queues them again.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentReprocessingService {

    private final DocumentRepository documentRepository;
    private final DocumentSubmissionService submissionService;

    /**
     * Deletes the document's pages, resets it to PROCESSING with no error and queues it.
     *
     * @return the id of the queued task
     * @throws DocumentNotFoundException     if the document does not exist
     * @throws TaskCapacityExceededException if the worker queue is full; the document is then marked FAILED
     */
    public String reprocess(Long documentId) {
        documentRepository.getDocument(documentId).orElseThrow(() -> new DocumentNotFoundException(documentId));
        int deleted = documentRepository.deletePages(documentId);
        documentRepository.saveDocument(documentId, DocumentUpdate.processing());
        log.info("[DocumentId: {}] Removed {} pages before reprocessing.", documentId, deleted);
        try {
            return submissionService.submitDocument(documentId);
        } catch (TaskCapacityExceededException e) {
            documentRepository.saveDocument(documentId, DocumentUpdate.failed(e.getMessage()));
            throw e;
        }
    }

    public List<String> reprocessFailed() {
        List<Long> ids = documentRepository.findDocumentIds(ProcessingStatus.FAILED);
        log.info("Reprocessing {} failed documents.", ids.size());
        return reprocessAll(ids);
    }

    public List<String> reprocessAll() {
        List<Long> ids = documentRepository.findAllDocumentIds();
        log.info("Reprocessing all {} documents.", ids.size());
        return reprocessAll(ids);
    }

    private List<String> reprocessAll(List<Long> documentIds) {
        List<String> taskIds = new ArrayList<>();
        for (Long documentId : documentIds) {
            try {
                taskIds.add(reprocess(documentId));
            } catch (TaskCapacityExceededException e) {
                log.error("Worker queue is full. Stopped after queuing {} of {} documents.", taskIds.size(),
                        documentIds.size());
                break;
            } catch (DocumentNotFoundException e) {
                log.warn("Document {} was deleted before it could be reprocessed.", documentId);
            }
        }
        return taskIds;
    }
}
