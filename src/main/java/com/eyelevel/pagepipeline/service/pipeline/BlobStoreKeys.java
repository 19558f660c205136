package com.eyelevel.pagepipeline.service.pipeline;

import com.eyelevel.pagepipeline.service.image.ImageFormat;

import java.util.List;

/**
 * Blob key layout for rendered output. Keys depend only on the document id, the page number and
 * the format, so a rerun overwrites the previous objects.
 */
public final class BlobStoreKeys {

    static final String PAGES = "pages/";
    static final String PAGE_THUMBNAILS = "page_thumbnails/";
    static final String COVERS = "thumbnails/";

    /**
     * Every prefix the pipeline writes under. Nothing else in the blob store belongs to it.
     */
    public static final List<String> PREFIXES = List.of(PAGES, PAGE_THUMBNAILS, COVERS);

    String page(Long documentId, int pageNumber, ImageFormat format) {
        return String.format(PAGES + "page_%d_%d.%s", documentId, pageNumber, format.extension());
    }

    String pageThumbnail(Long documentId, int pageNumber, ImageFormat format) {
        return String.format(PAGE_THUMBNAILS + "thumb_%d_%d.%s", documentId, pageNumber, format.extension());
    }

    String cover(Long documentId, ImageFormat format) {
        return String.format(COVERS + "cover_%d.%s", documentId, format.extension());
    }
}
