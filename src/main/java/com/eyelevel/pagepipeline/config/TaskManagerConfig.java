package com.eyelevel.pagepipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds properties under "app.tasks" for the background task manager worker pool.
 */
@Data
@ConfigurationProperties(prefix = "app.tasks")
public class TaskManagerConfig {

    private int workers = 4;
    private int queueCapacity = 100;
    private int awaitTerminationSeconds = 60;
    private Duration maxAge = Duration.ofHours(24);
    private String sweepCron = "0 0 * * * *";
}
