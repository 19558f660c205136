package com.eyelevel.pagepipeline.repository;

import com.eyelevel.pagepipeline.model.DocumentRecord;
import com.eyelevel.pagepipeline.model.DocumentUpdate;
import com.eyelevel.pagepipeline.model.PageRecord;
import com.eyelevel.pagepipeline.model.PageUpdate;
import com.eyelevel.pagepipeline.model.ProcessingStatus;

import java.util.List;
import java.util.Optional;

/**
 * The storage contract the pipeline consumes. The pipeline only changes documents and pages
 * through these calls and never keeps a loaded document across steps.
 */
public interface DocumentRepository {

    Optional<DocumentRecord> getDocument(Long documentId);

    /**
     * Writes only the non-null fields of {@code update}.
     *
     * @throws com.eyelevel.pagepipeline.exception.DocumentNotFoundException if the document is gone
     */
    void saveDocument(Long documentId, DocumentUpdate update);

    /**
     * Creates or overwrites the page keyed by (document, page number).
     */
    void upsertPage(Long documentId, int pageNumber, PageUpdate update);

    /**
     * @return the document's pages in ascending page-number order
     */
    List<PageRecord> listPages(Long documentId);

    /**
     * @return the number of pages removed
     */
    int deletePages(Long documentId);

    List<Long> findDocumentIds(ProcessingStatus status);

    List<Long> findAllDocumentIds();
}
