package com.eyelevel.pagepipeline.scheduler;

import com.eyelevel.pagepipeline.config.MaintenanceConfig;
import com.eyelevel.pagepipeline.service.maintenance.MediaCleanupReport;
import com.eyelevel.pagepipeline.service.maintenance.MediaCleanupService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the media housekeeping jobs on their configured schedules.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MediaCleanupScheduler {

    private final MediaCleanupService cleanupService;
    private final MaintenanceConfig config;

    @Scheduled(cron = "${app.maintenance.orphan-cleanup-cron:-}")
    public void cleanupOrphanedMedia() {
        log.debug("Running orphaned media sweep (dry run: {}).", config.isOrphanDryRun());
        MediaCleanupReport report = cleanupService.cleanupOrphanedMedia(config.isOrphanDryRun());
        log.info("Finished orphaned media sweep. {} orphans, {} deleted.", report.orphanKeys().size(),
                report.deleted());
    }

    @Scheduled(cron = "${app.maintenance.temp-cleanup-cron:0 15 * * * *}")
    public void cleanupTempFiles() {
        int removed = cleanupService.cleanupTempFiles();
        if (removed > 0) {
            log.info("Finished temp file cleanup. Removed {} entries.", removed);
        }
    }
}
