package com.eyelevel.pagepipeline.exception;

import java.io.Serial;

/**
 * Thrown when a blob store write or copy fails.
 */
public class BlobStorageException extends DocumentProcessingException {
    @Serial
    private static final long serialVersionUID = 1L;

    public BlobStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
