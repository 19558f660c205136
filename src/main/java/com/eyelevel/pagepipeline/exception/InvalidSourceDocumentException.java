package com.eyelevel.pagepipeline.exception;

import java.io.Serial;

/**
 * Thrown when the source file of a document is missing, empty, too large or not a readable PDF.
 */
public class InvalidSourceDocumentException extends DocumentProcessingException {
    @Serial
    private static final long serialVersionUID = 5103057382922194402L;

    public InvalidSourceDocumentException(String message) {
        super(message);
    }

    public InvalidSourceDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
