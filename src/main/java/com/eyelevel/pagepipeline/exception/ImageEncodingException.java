package com.eyelevel.pagepipeline.exception;

import java.io.Serial;

/**
 * Thrown when a raster cannot be encoded into the requested image format.
 */
public class ImageEncodingException extends DocumentProcessingException {
    @Serial
    private static final long serialVersionUID = 1L;

    public ImageEncodingException(String message) {
        super(message);
    }

    public ImageEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
