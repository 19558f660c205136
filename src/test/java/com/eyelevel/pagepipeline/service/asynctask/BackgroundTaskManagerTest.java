package com.eyelevel.pagepipeline.service.asynctask;

import com.eyelevel.pagepipeline.exception.TaskCapacityExceededException;
import com.eyelevel.pagepipeline.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BackgroundTaskManager")
class BackgroundTaskManagerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T10:15:30Z"));
    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    @DisplayName("100 tasks on 4 workers all complete with distinct ids")
    void submit_manyTasks_allComplete() throws Exception {
        BackgroundTaskManager manager = newManager(4, 200);
        List<String> ids = new ArrayList<>();

        for (int i = 0; i < 100; i++) {
            int value = i;
            ids.add(manager.submit(() -> value * 2, "task-" + i));
        }

        Set<String> unique = new HashSet<>(ids);
        assertThat(unique).hasSize(100);
        for (int i = 0; i < ids.size(); i++) {
            TaskStatusView view = awaitTerminal(manager, ids.get(i));
            assertThat(view.status()).isEqualTo(TaskStatus.COMPLETED);
            assertThat(view.result()).isEqualTo(i * 2);
            assertThat(view.error()).isNull();
        }
    }

    @Test
    @DisplayName("task ids carry a counter and a timestamp")
    void submit_idFormat() {
        BackgroundTaskManager manager = newManager(1, 10);

        String first = manager.submit(() -> null, "a");
        String second = manager.submit(() -> null, "b");

        assertThat(first).isEqualTo("task_1_20240301101530");
        assertThat(second).isEqualTo("task_2_20240301101530");
    }

    @Test
    @DisplayName("status of an unknown id is empty")
    void status_unknownId_isEmpty() {
        BackgroundTaskManager manager = newManager(1, 10);

        assertThat(manager.status("task_999_20240101000000")).isEmpty();
    }

    @Test
    @DisplayName("an exception thrown by the work marks the task FAILED with its message")
    void submit_workThrows_taskFailed() throws Exception {
        BackgroundTaskManager manager = newManager(2, 10);

        String withMessage = manager.submit(() -> {
            throw new IllegalStateException("boom");
        }, "failing");
        String withoutMessage = manager.submit(() -> {
            throw new NullPointerException();
        }, "npe");

        TaskStatusView failed = awaitTerminal(manager, withMessage);
        assertThat(failed.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(failed.error()).isEqualTo("boom");
        assertThat(failed.startedAt()).isNotNull();
        assertThat(failed.completedAt()).isNotNull();

        assertThat(awaitTerminal(manager, withoutMessage).error()).isEqualTo("java.lang.NullPointerException");
    }

    @Test
    @DisplayName("an Error thrown by the work marks the task FAILED and lets it be swept")
    void submit_workThrowsError_taskFailedAndSweepable() throws Exception {
        BackgroundTaskManager manager = newManager(1, 10);

        String id = manager.submit(() -> {
            throw new StackOverflowError("nested too deep");
        }, "overflowing");

        TaskStatusView failed = awaitTerminal(manager, id);
        assertThat(failed.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(failed.error()).isEqualTo("nested too deep");

        clock.advance(Duration.ofDays(2));
        assertThat(manager.sweep(Duration.ofHours(24))).isEqualTo(1);
        assertThat(manager.size()).isZero();
    }

    @Test
    @DisplayName("a worker survives an Error and keeps running later tasks")
    void submit_afterError_workerStillRuns() throws Exception {
        BackgroundTaskManager manager = newManager(1, 10);

        String broken = manager.submit(() -> {
            throw new AssertionError();
        }, "broken");
        String next = manager.submit(() -> "ok", "next");

        assertThat(awaitTerminal(manager, broken).error()).isEqualTo("java.lang.AssertionError");
        assertThat(awaitTerminal(manager, next).result()).isEqualTo("ok");
    }

    @Test
    @DisplayName("sweep removes only finished tasks older than the max age")
    void sweep_removesOldFinishedTasks() throws Exception {
        BackgroundTaskManager manager = newManager(2, 10);
        CountDownLatch release = new CountDownLatch(1);

        String finished = manager.submit(() -> "done", "finished");
        awaitTerminal(manager, finished);
        String running = manager.submit(() -> release.await(5, TimeUnit.SECONDS), "running");

        clock.advance(Duration.ofHours(25));
        int removed = manager.sweep(Duration.ofHours(24));
        release.countDown();

        assertThat(removed).isEqualTo(1);
        assertThat(manager.status(finished)).isEmpty();
        assertThat(manager.status(running)).isPresent();
    }

    @Test
    @DisplayName("sweep keeps recently finished tasks")
    void sweep_keepsRecentTasks() throws Exception {
        BackgroundTaskManager manager = newManager(1, 10);
        String id = manager.submit(() -> "done", "recent");
        awaitTerminal(manager, id);

        clock.advance(Duration.ofHours(1));

        assertThat(manager.sweep(Duration.ofHours(24))).isZero();
        assertThat(manager.status(id)).isPresent();
    }

    @Test
    @DisplayName("a full worker queue rejects new work immediately")
    void submit_queueFull_rejected() throws Exception {
        BackgroundTaskManager manager = newManager(1, 0);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        String blocking = manager.submit(() -> {
            started.countDown();
            return release.await(5, TimeUnit.SECONDS);
        }, "blocking");
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> manager.submit(() -> "never", "overflow"))
                .isInstanceOf(TaskCapacityExceededException.class)
                .hasMessageContaining("overflow");
        assertThat(manager.size()).isEqualTo(1);

        release.countDown();
        assertThat(awaitTerminal(manager, blocking).status()).isEqualTo(TaskStatus.COMPLETED);
    }

    private BackgroundTaskManager newManager(int workers, int queueCapacity) {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("test-worker-");
        executor.initialize();
        return new BackgroundTaskManager(executor, clock);
    }

    static TaskStatusView awaitTerminal(BackgroundTaskManager manager, String taskId) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (System.nanoTime() < deadline) {
            TaskStatusView view = manager.status(taskId).orElseThrow();
            if (view.status().isTerminal()) {
                return view;
            }
            Thread.sleep(10);
        }
        throw new AssertionError("Task " + taskId + " did not finish in time");
    }
}
