package com.eyelevel.pagepipeline.model;

/**
 * A read-only snapshot of a document as returned by the repository. The pipeline never
 * holds on to it past the current run.
 */
public record DocumentRecord(
        Long id,
        String title,
        String sourceFile,
        Long fileSize,
        int pageCount,
        ProcessingStatus processingStatus,
        String processingError,
        String coverThumbnail) {

    public static DocumentRecord from(Document document) {
        return new DocumentRecord(document.getId(), document.getTitle(), document.getSourceFile(),
                document.getFileSize(), document.getPageCount() == null ? 0 : document.getPageCount(),
                document.getProcessingStatus(), document.getProcessingError(), document.getCoverThumbnail());
    }
}
