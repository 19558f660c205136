package com.eyelevel.pagepipeline.service.render;

import java.nio.file.Path;

/**
 * Strategy interface for a third-party PDF rasterizer.
 */
public interface RenderBackend {

    /**
     * Human-readable name for logging.
     */
    String name();

    /**
     * Checks whether the backend can run on this machine. Called once when the fallback chain
     * is built, never per page.
     */
    boolean probe();

    /**
     * Renders one page to an RGB raster.
     *
     * @param pdf        the source document
     * @param pageNumber 1-based page number
     * @param dpi        rendering resolution
     */
    RenderResult render(Path pdf, int pageNumber, int dpi);

    /**
     * Closes anything the backend keeps open between pages of {@code pdf}. Backends that open
     * the document on every call have nothing to release.
     */
    default void release(Path pdf) {
    }
}
