package com.eyelevel.pagepipeline.scheduler;

import com.eyelevel.pagepipeline.config.TaskManagerConfig;
import com.eyelevel.pagepipeline.service.asynctask.BackgroundTaskManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops finished background tasks so the in-memory task table does not grow
 * without bound.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TaskSweepScheduler {

    private final BackgroundTaskManager taskManager;
    private final TaskManagerConfig config;

    @Scheduled(cron = "${app.tasks.sweep-cron:0 0 * * * *}")
    public void sweepFinishedTasks() {
        log.debug("Running task sweep. Removing finished tasks older than {}.", config.getMaxAge());
        int removed = taskManager.sweep(config.getMaxAge());
        log.info("Finished task sweep. Removed {} tasks, {} remain.", removed, taskManager.size());
    }
}
