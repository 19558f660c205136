package com.eyelevel.pagepipeline.service.maintenance;

import com.eyelevel.pagepipeline.config.MaintenanceConfig;
import com.eyelevel.pagepipeline.config.RenderingConfig;
import com.eyelevel.pagepipeline.exception.BlobStorageException;
import com.eyelevel.pagepipeline.model.DocumentRecord;
import com.eyelevel.pagepipeline.model.PageRecord;
import com.eyelevel.pagepipeline.repository.DocumentRepository;
import com.eyelevel.pagepipeline.service.pipeline.BlobStoreKeys;
import com.eyelevel.pagepipeline.service.storage.BlobStore;
import com.eyelevel.pagepipeline.service.storage.StoredBlob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.File;
import java.io.IOException;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Housekeeping for the pipeline's output.
 * <p>
 * The orphan sweep removes rendered images that no document or page references any more, such
 * as pages left over when a document is reprocessed with a different image format. Only the
 * pipeline's own key prefixes are scanned, so uploaded source files are never touched. Objects
 * younger than the grace period are kept because a running pipeline stores a page before it
 * records the page row.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MediaCleanupService {

    private final DocumentRepository documentRepository;
    private final BlobStore blobStore;
    private final MaintenanceConfig maintenanceConfig;
    private final RenderingConfig renderingConfig;
    private final Clock clock;

    public MediaCleanupReport cleanupOrphanedMedia(final boolean dryRun) {
        final Set<String> referenced = referencedMedia();
        final Instant cutoff = clock.instant().minus(maintenanceConfig.getOrphanGracePeriod());
        final List<StoredBlob> orphans = new ArrayList<>();
        for (final String prefix : BlobStoreKeys.PREFIXES) {
            for (final StoredBlob blob : blobStore.list(prefix)) {
                final boolean unreferenced = !referenced.contains(blobStore.referenceOf(blob.key()));
                if (unreferenced && blob.lastModified().isBefore(cutoff)) {
                    orphans.add(blob);
                }
            }
        }
        final long orphanBytes = orphans.stream().mapToLong(StoredBlob::size).sum();
        final List<String> orphanKeys = orphans.stream().map(StoredBlob::key).toList();
        if (orphans.isEmpty()) {
            log.info("Orphaned media sweep found nothing to remove.");
            return new MediaCleanupReport(orphanKeys, 0, 0, dryRun);
        }
        log.info("Found {} orphaned media objects ({} KB).", orphans.size(), orphanBytes / 1024);

        int deleted = 0;
        for (final StoredBlob orphan : orphans) {
            if (dryRun) {
                log.info("Would delete '{}' ({} bytes).", orphan.key(), orphan.size());
                continue;
            }
            try {
                blobStore.delete(orphan.key());
                deleted++;
                log.debug("Deleted orphaned media '{}'.", orphan.key());
            } catch (BlobStorageException e) {
                log.error("Failed to delete orphaned media '{}'.", orphan.key(), e);
            }
        }
        if (!dryRun) {
            log.info("Deleted {} of {} orphaned media objects.", deleted, orphans.size());
        }
        return new MediaCleanupReport(orphanKeys, orphanBytes, deleted, dryRun);
    }

    /**
     * Deletes entries below the render temp root older than the configured max age, which only
     * exist when a render was cut short.
     *
     * @return the number of entries removed
     */
    public int cleanupTempFiles() {
        final File tempRoot = Paths.get(renderingConfig.getTempDir()).toFile();
        final File[] entries = tempRoot.listFiles();
        if (entries == null) {
            return 0;
        }
        final Instant cutoff = clock.instant().minus(maintenanceConfig.getTempMaxAge());
        int removed = 0;
        for (final File entry : entries) {
            if (!Instant.ofEpochMilli(entry.lastModified()).isBefore(cutoff)) {
                continue;
            }
            try {
                FileUtils.forceDelete(entry);
                removed++;
                log.info("Deleted stale temp entry '{}'.", entry);
            } catch (IOException e) {
                log.error("Error deleting temp entry '{}'.", entry, e);
            }
        }
        return removed;
    }

    private Set<String> referencedMedia() {
        final Set<String> referenced = new HashSet<>();
        for (final Long documentId : documentRepository.findAllDocumentIds()) {
            documentRepository.getDocument(documentId).map(DocumentRecord::coverThumbnail)
                    .filter(StringUtils::hasText).ifPresent(referenced::add);
            for (final PageRecord page : documentRepository.listPages(documentId)) {
                addIfPresent(referenced, page.image());
                addIfPresent(referenced, page.thumbnail());
            }
        }
        return referenced;
    }

    private static void addIfPresent(final Set<String> referenced, final String reference) {
        if (StringUtils.hasText(reference)) {
            referenced.add(reference);
        }
    }
}
