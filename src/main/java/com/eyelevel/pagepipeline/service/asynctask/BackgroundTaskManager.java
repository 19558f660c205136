package com.eyelevel.pagepipeline.service.asynctask;

import com.eyelevel.pagepipeline.exception.TaskCapacityExceededException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs named units of work on the bounded pipeline worker pool and keeps an in-memory table of
 * their status for polling. The table and the id counter share one lock. Task state is lost on
 * restart; the durable state of a document lives in the repository.
 */
@Slf4j
@Service
public class BackgroundTaskManager {

    private static final DateTimeFormatter ID_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final AsyncTaskExecutor taskExecutor;
    private final Clock clock;
    private final Map<String, BackgroundTask> tasks = new HashMap<>();
    private long counter;

    public BackgroundTaskManager(@Qualifier("pipelineTaskExecutor") AsyncTaskExecutor taskExecutor, Clock clock) {
        this.taskExecutor = taskExecutor;
        this.clock = clock;
    }

    /**
     * Queues {@code work} and returns its task id without waiting for it to start. Whatever the
     * work throws is recorded on the task and never reaches the worker thread.
     *
     * @throws TaskCapacityExceededException if the worker queue is full
     */
    public String submit(Callable<?> work, String name) {
        BackgroundTask task;
        synchronized (tasks) {
            counter++;
            String id = "task_" + counter + "_" + LocalDateTime.now(clock).format(ID_TIMESTAMP);
            task = new BackgroundTask(id, name, clock.instant());
            tasks.put(id, task);
        }

        try {
            taskExecutor.execute(() -> runTask(task, work));
        } catch (RejectedExecutionException e) {
            synchronized (tasks) {
                tasks.remove(task.id());
            }
            log.warn("Rejected task '{}': the worker queue is full.", name);
            throw new TaskCapacityExceededException("Worker queue is full, cannot accept task '" + name + "'", e);
        }
        log.info("Submitted task {} ('{}').", task.id(), name);
        return task.id();
    }

    public Optional<TaskStatusView> status(String taskId) {
        BackgroundTask task;
        synchronized (tasks) {
            task = tasks.get(taskId);
        }
        return Optional.ofNullable(task).map(BackgroundTask::snapshot);
    }

    /**
     * Drops finished tasks that completed more than {@code maxAge} ago. Pending and running tasks
     * are always kept.
     *
     * @return the number of tasks removed
     */
    public int sweep(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        int removed = 0;
        synchronized (tasks) {
            Iterator<BackgroundTask> iterator = tasks.values().iterator();
            while (iterator.hasNext()) {
                if (iterator.next().finishedBefore(cutoff)) {
                    iterator.remove();
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.info("Swept {} finished tasks older than {}.", removed, maxAge);
        }
        return removed;
    }

    public int size() {
        synchronized (tasks) {
            return tasks.size();
        }
    }

    private void runTask(BackgroundTask task, Callable<?> work) {
        if (!task.markRunning(clock.instant())) {
            return;
        }
        log.debug("Task {} started.", task.id());
        try {
            Object result = work.call();
            task.markCompleted(result, clock.instant());
            log.info("Task {} completed.", task.id());
        } catch (Throwable e) {
            // Errors included: every started task must reach a terminal state.
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
            task.markFailed(message, clock.instant());
            log.error("Task {} failed: {}", task.id(), message, e);
        }
    }
}
