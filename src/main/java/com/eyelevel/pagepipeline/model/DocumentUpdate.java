package com.eyelevel.pagepipeline.model;

import lombok.Builder;

/**
 * The set of document fields a single repository write changes. A {@code null} component
 * leaves the stored value untouched; an empty {@code processingError} clears it.
 */
@Builder
public record DocumentUpdate(
        ProcessingStatus processingStatus,
        String processingError,
        Integer pageCount,
        String coverThumbnail) {

    public static DocumentUpdate processing() {
        return DocumentUpdate.builder().processingStatus(ProcessingStatus.PROCESSING).processingError("").build();
    }

    public static DocumentUpdate completed() {
        return DocumentUpdate.builder().processingStatus(ProcessingStatus.COMPLETED).processingError("").build();
    }

    public static DocumentUpdate failed(String error) {
        return DocumentUpdate.builder().processingStatus(ProcessingStatus.FAILED).processingError(error).build();
    }

    public static DocumentUpdate pageCount(int pageCount) {
        return DocumentUpdate.builder().pageCount(pageCount).build();
    }

    public static DocumentUpdate coverThumbnail(String reference) {
        return DocumentUpdate.builder().coverThumbnail(reference).build();
    }
}
