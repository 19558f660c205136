package com.eyelevel.pagepipeline.exception;

import java.io.Serial;

/**
 * Thrown when a document id does not resolve to a stored document. Retrying cannot help.
 */
public class DocumentNotFoundException extends DocumentProcessingException {
    @Serial
    private static final long serialVersionUID = 1L;

    public DocumentNotFoundException(Long documentId) {
        super("Document with ID " + documentId + " not found.");
    }
}
