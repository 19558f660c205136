package com.eyelevel.pagepipeline.service.pipeline;

/**
 * Outcome of one document run, stored as the result of its background task.
 *
 * @param success        whether the document reached COMPLETED
 * @param pageCount      pages in the source, 0 when it could not be read
 * @param pagesPersisted pages written, never more than {@code pageCount}
 * @param error          failure reason, {@code null} on success
 * @param attempts       how many times the pipeline ran, 0 until the retry wrapper sets it
 */
public record PipelineResult(boolean success, int pageCount, int pagesPersisted, String error, int attempts) {

    public static PipelineResult success(int pageCount, int pagesPersisted) {
        return new PipelineResult(true, pageCount, pagesPersisted, null, 0);
    }

    public static PipelineResult failure(String error) {
        return new PipelineResult(false, 0, 0, error, 0);
    }

    public PipelineResult withAttempts(int attempts) {
        return new PipelineResult(success, pageCount, pagesPersisted, error, attempts);
    }
}
