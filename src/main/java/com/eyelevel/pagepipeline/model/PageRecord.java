package com.eyelevel.pagepipeline.model;

/**
 * A read-only snapshot of one rendered page.
 */
public record PageRecord(
        Long documentId,
        int pageNumber,
        String image,
        String thumbnail,
        int width,
        int height) {

    public static PageRecord from(Long documentId, DocumentPage page) {
        return new PageRecord(documentId, page.getPageNumber(), page.getImage(), page.getThumbnail(),
                page.getWidth(), page.getHeight());
    }
}
