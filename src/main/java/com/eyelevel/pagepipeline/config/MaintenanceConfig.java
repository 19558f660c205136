package com.eyelevel.pagepipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds properties under "app.maintenance" for the media housekeeping jobs.
 * <p>
 * The orphan cleanup is off unless {@code orphan-cleanup-cron} is set; a cron of {@code "-"}
 * disables a job. With {@code orphan-dry-run} the job only reports what it would delete.
 */
@Data
@ConfigurationProperties(prefix = "app.maintenance")
public class MaintenanceConfig {

    private String orphanCleanupCron = "-";
    private boolean orphanDryRun = false;
    private Duration orphanGracePeriod = Duration.ofHours(1);
    private String tempCleanupCron = "0 15 * * * *";
    private Duration tempMaxAge = Duration.ofHours(1);
}
