package com.eyelevel.pagepipeline.model;

/**
 * Defines the durable processing states of a {@link Document}. External views poll this field.
 */
public enum ProcessingStatus {
    /**
     * The document has been uploaded and is waiting to be processed.
     */
    PENDING,
    /**
     * A worker is converting the document's pages.
     */
    PROCESSING,
    /**
     * All pages were attempted and the document is ready to view.
     */
    COMPLETED,
    /**
     * The document could not be processed; see the processing error.
     */
    FAILED
}
