package com.eyelevel.pagepipeline.service.asynctask;

import java.time.Instant;

/**
 * Mutable state of one submitted unit of work. Status only moves forward
 * (PENDING, RUNNING, then COMPLETED or FAILED) and a terminal task is never changed again.
 */
class BackgroundTask {

    private final String id;
    private final String name;
    private final Instant createdAt;
    private TaskStatus status = TaskStatus.PENDING;
    private Instant startedAt;
    private Instant completedAt;
    private String error;
    private Object result;

    BackgroundTask(String id, String name, Instant createdAt) {
        this.id = id;
        this.name = name;
        this.createdAt = createdAt;
    }

    String id() {
        return id;
    }

    synchronized boolean markRunning(Instant now) {
        if (status != TaskStatus.PENDING) {
            return false;
        }
        status = TaskStatus.RUNNING;
        startedAt = now;
        return true;
    }

    synchronized void markCompleted(Object value, Instant now) {
        if (status.isTerminal()) {
            return;
        }
        status = TaskStatus.COMPLETED;
        result = value;
        completedAt = now;
    }

    synchronized void markFailed(String message, Instant now) {
        if (status.isTerminal()) {
            return;
        }
        status = TaskStatus.FAILED;
        error = message;
        completedAt = now;
    }

    synchronized boolean finishedBefore(Instant cutoff) {
        return status.isTerminal() && completedAt != null && completedAt.isBefore(cutoff);
    }

    synchronized TaskStatusView snapshot() {
        return new TaskStatusView(id, name, status, createdAt, startedAt, completedAt, error, result);
    }
}
