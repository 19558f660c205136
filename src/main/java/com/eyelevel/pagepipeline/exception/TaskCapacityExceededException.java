package com.eyelevel.pagepipeline.exception;

import java.io.Serial;

/**
 * Thrown by the background task manager when its bounded queue is full.
 */
public class TaskCapacityExceededException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    public TaskCapacityExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
