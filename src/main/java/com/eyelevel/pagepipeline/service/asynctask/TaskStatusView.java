package com.eyelevel.pagepipeline.service.asynctask;

import java.time.Instant;

/**
 * An immutable snapshot of a background task, safe to hand to callers while the task keeps running.
 */
public record TaskStatusView(
        String id,
        String name,
        TaskStatus status,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        String error,
        Object result) {
}
