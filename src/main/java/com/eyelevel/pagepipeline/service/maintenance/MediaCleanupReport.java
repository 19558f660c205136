package com.eyelevel.pagepipeline.service.maintenance;

import java.util.List;

/**
 * Outcome of one orphaned media sweep.
 *
 * @param orphanKeys   keys no document or page references, whether deleted or not
 * @param orphanBytes  total size of those objects
 * @param deleted      number of objects actually removed; zero on a dry run
 * @param dryRun       whether deletion was skipped
 */
public record MediaCleanupReport(List<String> orphanKeys, long orphanBytes, int deleted, boolean dryRun) {
}
