package com.eyelevel.pagepipeline.repository;

import com.eyelevel.pagepipeline.exception.DocumentNotFoundException;
import com.eyelevel.pagepipeline.model.Document;
import com.eyelevel.pagepipeline.model.DocumentPage;
import com.eyelevel.pagepipeline.model.DocumentRecord;
import com.eyelevel.pagepipeline.model.DocumentUpdate;
import com.eyelevel.pagepipeline.model.PageRecord;
import com.eyelevel.pagepipeline.model.PageUpdate;
import com.eyelevel.pagepipeline.model.ProcessingStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * {@link DocumentRepository} backed by Spring Data JPA. Every write runs in its own transaction
 * so status changes are visible to pollers as soon as the call returns.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaDocumentRepository implements DocumentRepository {

    private final DocumentJpaRepository documentJpaRepository;
    private final DocumentPageJpaRepository pageJpaRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<DocumentRecord> getDocument(Long documentId) {
        return documentJpaRepository.findById(documentId).map(DocumentRecord::from);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void saveDocument(Long documentId, DocumentUpdate update) {
        Document document = documentJpaRepository.findById(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));

        if (update.processingStatus() != null) {
            document.setProcessingStatus(update.processingStatus());
        }
        if (update.processingError() != null) {
            document.setProcessingError(truncate(update.processingError()));
        }
        if (update.pageCount() != null) {
            document.setPageCount(update.pageCount());
        }
        if (update.coverThumbnail() != null) {
            document.setCoverThumbnail(update.coverThumbnail());
        }
        documentJpaRepository.save(document);
        log.debug("Updated Document ID {} with {}", documentId, update);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void upsertPage(Long documentId, int pageNumber, PageUpdate update) {
        DocumentPage page = pageJpaRepository.findByDocumentIdAndPageNumber(documentId, pageNumber)
                .orElseGet(() -> DocumentPage.builder()
                        .document(documentJpaRepository.getReferenceById(documentId))
                        .pageNumber(pageNumber)
                        .build());

        page.setImage(update.image());
        page.setThumbnail(update.thumbnail());
        page.setWidth(update.width());
        page.setHeight(update.height());
        try {
            pageJpaRepository.saveAndFlush(page);
        } catch (DataIntegrityViolationException e) {
            log.error("CRITICAL: Duplicate page key for Document ID {} page {}. Another writer touched this page.",
                    documentId, pageNumber, e);
            throw e;
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<PageRecord> listPages(Long documentId) {
        return pageJpaRepository.findAllByDocumentIdOrderByPageNumberAsc(documentId).stream()
                .map(page -> PageRecord.from(documentId, page))
                .toList();
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int deletePages(Long documentId) {
        int deleted = pageJpaRepository.deleteAllByDocumentId(documentId);
        log.info("Deleted {} page(s) of Document ID {}.", deleted, documentId);
        return deleted;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Long> findDocumentIds(ProcessingStatus status) {
        return documentJpaRepository.findIdsByProcessingStatus(status);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Long> findAllDocumentIds() {
        return documentJpaRepository.findAllIds();
    }

    private static String truncate(String error) {
        return error.length() <= Document.MAX_ERROR_LENGTH ? error : error.substring(0, Document.MAX_ERROR_LENGTH);
    }
}
