package com.eyelevel.pagepipeline.exception;

import java.io.Serial;

/**
 * Thrown when an attempt is made to process a file that is password-protected or encrypted.
 */
public class FileProtectedException extends InvalidSourceDocumentException {
    @Serial
    private static final long serialVersionUID = 1L;

    public FileProtectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
