package com.eyelevel.pagepipeline.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configures the fixed-size worker pool that runs document pipelines in the background.
 * The queue is bounded and a full queue rejects new work instead of growing.
 */
@Slf4j
@Configuration
public class TaskExecutorConfig {

    /**
     * Creates the worker pool. Core and maximum size are equal so the pool never grows
     * past {@code app.tasks.workers}.
     *
     * @param config task manager configuration
     * @return an initialized executor
     */
    @Bean("pipelineTaskExecutor")
    public ThreadPoolTaskExecutor pipelineTaskExecutor(TaskManagerConfig config) {
        int workers = Math.max(1, config.getWorkers());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(Math.max(0, config.getQueueCapacity()));
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(config.getAwaitTerminationSeconds());
        executor.setThreadNamePrefix("pipeline-worker-");
        executor.initialize();
        log.info("Pipeline worker pool initialized with {} workers and a queue capacity of {}.", workers,
                config.getQueueCapacity());
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
