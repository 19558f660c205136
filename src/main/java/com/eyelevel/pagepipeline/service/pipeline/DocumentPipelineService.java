package com.eyelevel.pagepipeline.service.pipeline;

import com.eyelevel.pagepipeline.config.DocumentProcessingConfig;
import com.eyelevel.pagepipeline.config.StorageConfig;
import com.eyelevel.pagepipeline.exception.DocumentNotFoundException;
import com.eyelevel.pagepipeline.exception.DocumentProcessingException;
import com.eyelevel.pagepipeline.exception.InvalidSourceDocumentException;
import com.eyelevel.pagepipeline.model.DocumentRecord;
import com.eyelevel.pagepipeline.model.DocumentUpdate;
import com.eyelevel.pagepipeline.model.PageRecord;
import com.eyelevel.pagepipeline.model.PageUpdate;
import com.eyelevel.pagepipeline.repository.DocumentRepository;
import com.eyelevel.pagepipeline.service.image.ImageFormat;
import com.eyelevel.pagepipeline.service.image.ImagePostProcessor;
import com.eyelevel.pagepipeline.service.image.PlaceholderPageGenerator;
import com.eyelevel.pagepipeline.service.pdf.PdfPageCounter;
import com.eyelevel.pagepipeline.service.render.FallbackRenderChain;
import com.eyelevel.pagepipeline.service.render.RenderResult;
import com.eyelevel.pagepipeline.service.storage.BlobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Converts one document into page images, page thumbnails and a cover thumbnail, recording
 * progress on the document as it goes.
 * <p>
 * Failures are handled at three levels:
 * <ul>
 *     <li>an unreadable source marks the document FAILED and returns a failed result, since running
 *     again would not help;</li>
 *     <li>a failure on a single page is logged and that page is skipped, unless it is a
 *     {@link VirtualMachineError};</li>
 *     <li>anything else marks the document FAILED and is rethrown so the retry wrapper can run the
 *     document again. Exceptions are wrapped in a {@link DocumentProcessingException}, errors are
 *     rethrown as they are.</li>
 * </ul>
 * A document deleted mid-run surfaces as {@link DocumentNotFoundException}, unwrapped, so it is
 * not retried.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentPipelineService {

    private final DocumentRepository documentRepository;
    private final BlobStore blobStore;
    private final PdfPageCounter pdfPageCounter;
    private final FallbackRenderChain renderChain;
    private final PlaceholderPageGenerator placeholderGenerator;
    private final ImagePostProcessor imagePostProcessor;
    private final DocumentProcessingConfig config;
    private final StorageConfig storageConfig;
    private final BlobStoreKeys keys = new BlobStoreKeys();

    /**
     * Runs the full pipeline for a document.
     *
     * @throws DocumentNotFoundException   if the document does not exist
     * @throws DocumentProcessingException on an unexpected failure, after the document is marked FAILED
     * @throws Error                       rethrown after the document is marked FAILED
     */
    public PipelineResult run(final Long documentId) {
        final String contextInfo = "DocumentId: " + documentId;
        final DocumentRecord document = documentRepository.getDocument(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
        log.info("[{}] Beginning page pipeline for '{}'.", contextInfo, document.title());
        documentRepository.saveDocument(documentId, DocumentUpdate.processing());

        try {
            final Path source;
            final int pageCount;
            try {
                source = resolveSource(document);
                pageCount = pdfPageCounter.countPages(source);
            } catch (InvalidSourceDocumentException e) {
                log.error("[{}] Source document rejected: {}", contextInfo, e.getMessage());
                documentRepository.saveDocument(documentId, DocumentUpdate.failed(e.getMessage()));
                return PipelineResult.failure(e.getMessage());
            }
            documentRepository.saveDocument(documentId, DocumentUpdate.pageCount(pageCount));
            log.info("[{}] Document has {} pages.", contextInfo, pageCount);

            int persisted = 0;
            try {
                for (int pageNumber = 1; pageNumber <= pageCount; pageNumber++) {
                    if (processPage(documentId, source, pageNumber, contextInfo)) {
                        persisted++;
                    }
                }
            } finally {
                renderChain.release(source);
            }

            if (pageCount > 0) {
                try {
                    createCover(documentId, contextInfo);
                } catch (RuntimeException e) {
                    log.error("[{}] Failed to create cover thumbnail. Continuing without one.", contextInfo, e);
                }
            }

            documentRepository.saveDocument(documentId, DocumentUpdate.completed());
            log.info("[{}] Pipeline completed. {} of {} pages persisted.", contextInfo, persisted, pageCount);
            return PipelineResult.success(pageCount, persisted);
        } catch (final DocumentNotFoundException e) {
            log.warn("[{}] Document was deleted while it was being processed.", contextInfo);
            throw e;
        } catch (final Exception e) {
            final String summary = markFailed(documentId, contextInfo, e);
            throw new DocumentProcessingException("Pipeline failed for document " + documentId + ": " + summary, e);
        } catch (final Error e) {
            markFailed(documentId, contextInfo, e);
            throw e;
        }
    }

    /**
     * Rebuilds the cover thumbnail from the first page's thumbnail.
     *
     * @return the new cover reference, or empty when page 1 has no thumbnail
     * @throws DocumentNotFoundException if the document does not exist
     */
    public Optional<String> regenerateCover(final Long documentId) {
        documentRepository.getDocument(documentId).orElseThrow(() -> new DocumentNotFoundException(documentId));
        return createCover(documentId, "DocumentId: " + documentId);
    }

    private boolean processPage(final Long documentId, final Path source, final int pageNumber,
                                final String contextInfo) {
        try {
            final BufferedImage page = renderPage(source, pageNumber, contextInfo);
            final DocumentProcessingConfig.Thumbnail thumbnailConfig = config.getThumbnail();
            final BufferedImage thumbnail = imagePostProcessor.thumbnail(page, thumbnailConfig.getMaxWidth(),
                    thumbnailConfig.getMaxHeight());

            final ImageFormat pageFormat = config.getPage().getFormat();
            final byte[] pageBytes = imagePostProcessor.encode(page, pageFormat, config.getPage().getQuality());
            final byte[] thumbnailBytes = imagePostProcessor.encode(thumbnail, thumbnailConfig.getFormat(),
                    thumbnailConfig.getQuality());

            final String imageRef = blobStore.store(keys.page(documentId, pageNumber, pageFormat), pageBytes);
            final String thumbnailRef = blobStore.store(
                    keys.pageThumbnail(documentId, pageNumber, thumbnailConfig.getFormat()), thumbnailBytes);

            documentRepository.upsertPage(documentId, pageNumber,
                    new PageUpdate(imageRef, thumbnailRef, page.getWidth(), page.getHeight()));
            log.debug("[{}] Page {} persisted ({}x{}).", contextInfo, pageNumber, page.getWidth(), page.getHeight());
            return true;
        } catch (final RuntimeException e) {
            log.error("[{}] Failed to process page {}. Skipping it.", contextInfo, pageNumber, e);
            return false;
        } catch (final Error e) {
            // Out of memory and stack overflow fail the whole document.
            if (e instanceof VirtualMachineError) {
                throw e;
            }
            log.error("[{}] Error while processing page {}. Skipping it.", contextInfo, pageNumber, e);
            return false;
        }
    }

    private BufferedImage renderPage(final Path source, final int pageNumber, final String contextInfo) {
        final int dpi = config.getDpi();
        final RenderResult result = renderChain.render(source, pageNumber, dpi);
        if (result instanceof RenderResult.Rendered rendered) {
            return rendered.image();
        }
        log.warn("[{}] No backend rendered page {}. Using a placeholder.", contextInfo, pageNumber);
        return placeholderGenerator.placeholder(pageNumber, placeholderGenerator.defaultWidth(dpi),
                placeholderGenerator.defaultHeight(dpi));
    }

    private Optional<String> createCover(final Long documentId, final String contextInfo) {
        final Optional<PageRecord> firstPage = documentRepository.listPages(documentId).stream()
                .filter(page -> page.pageNumber() == 1).findFirst();
        if (firstPage.isEmpty() || !StringUtils.hasText(firstPage.get().thumbnail())) {
            log.warn("[{}] Page 1 has no thumbnail. Skipping cover thumbnail.", contextInfo);
            return Optional.empty();
        }
        final ImageFormat format = config.getThumbnail().getFormat();
        final String cover = blobStore.copy(keys.pageThumbnail(documentId, 1, format), keys.cover(documentId, format));
        documentRepository.saveDocument(documentId, DocumentUpdate.coverThumbnail(cover));
        log.info("[{}] Cover thumbnail set to '{}'.", contextInfo, cover);
        return Optional.of(cover);
    }

    private String markFailed(final Long documentId, final String contextInfo, final Throwable cause) {
        final String summary = cause.getClass().getSimpleName() + ": " + cause.getMessage();
        log.error("[{}] Pipeline failed: {}", contextInfo, summary, cause);
        try {
            documentRepository.saveDocument(documentId, DocumentUpdate.failed(summary));
        } catch (RuntimeException statusError) {
            log.error("[{}] CRITICAL: Could not mark document as FAILED.", contextInfo, statusError);
            cause.addSuppressed(statusError);
        }
        return summary;
    }

    private Path resolveSource(final DocumentRecord document) {
        if (!StringUtils.hasText(document.sourceFile())) {
            throw new InvalidSourceDocumentException("Document has no source file.");
        }
        final Path path = Paths.get(document.sourceFile());
        return path.isAbsolute() ? path : Paths.get(storageConfig.getLocal().getMediaRoot()).resolve(path);
    }
}
