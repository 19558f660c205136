package com.eyelevel.pagepipeline.service.maintenance;

import com.eyelevel.pagepipeline.config.MaintenanceConfig;
import com.eyelevel.pagepipeline.config.RenderingConfig;
import com.eyelevel.pagepipeline.model.DocumentUpdate;
import com.eyelevel.pagepipeline.model.PageUpdate;
import com.eyelevel.pagepipeline.model.ProcessingStatus;
import com.eyelevel.pagepipeline.support.InMemoryBlobStore;
import com.eyelevel.pagepipeline.support.InMemoryDocumentRepository;
import com.eyelevel.pagepipeline.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MediaCleanupService")
class MediaCleanupServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-10T12:00:00Z");

    @TempDir
    Path tempRoot;

    private final MutableClock clock = new MutableClock(NOW);
    private InMemoryDocumentRepository repository;
    private InMemoryBlobStore blobStore;
    private MediaCleanupService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryDocumentRepository();
        blobStore = new InMemoryBlobStore();
        MaintenanceConfig maintenanceConfig = new MaintenanceConfig();
        maintenanceConfig.setOrphanGracePeriod(Duration.ofHours(1));
        maintenanceConfig.setTempMaxAge(Duration.ofHours(1));
        RenderingConfig renderingConfig = new RenderingConfig();
        renderingConfig.setTempDir(tempRoot.toString());
        service = new MediaCleanupService(repository, blobStore, maintenanceConfig, renderingConfig, clock);

        repository.add(1L, "uploads/book.pdf", ProcessingStatus.COMPLETED);
        String image = blobStore.store("pages/page_1_1.png", new byte[10]);
        String thumbnail = blobStore.store("page_thumbnails/thumb_1_1.png", new byte[4]);
        repository.upsertPage(1L, 1, new PageUpdate(image, thumbnail, 100, 140));
        repository.saveDocument(1L, DocumentUpdate.coverThumbnail(blobStore.copy("page_thumbnails/thumb_1_1.png",
                "thumbnails/cover_1.png")));
    }

    @Test
    @DisplayName("pages left over from an earlier format are deleted and referenced media is kept")
    void cleanupOrphanedMedia_deletesUnreferencedOnly() {
        blobStore.store("pages/page_1_1.jpg", new byte[100]);
        blobStore.store("page_thumbnails/thumb_1_1.jpg", new byte[20]);
        blobStore.store("uploads/book.pdf", new byte[50]);

        MediaCleanupReport report = service.cleanupOrphanedMedia(false);

        assertThat(report.orphanKeys()).containsExactlyInAnyOrder("pages/page_1_1.jpg",
                "page_thumbnails/thumb_1_1.jpg");
        assertThat(report.orphanBytes()).isEqualTo(120);
        assertThat(report.deleted()).isEqualTo(2);
        assertThat(blobStore.keys()).containsExactlyInAnyOrder("pages/page_1_1.png",
                "page_thumbnails/thumb_1_1.png", "thumbnails/cover_1.png", "uploads/book.pdf");
    }

    @Test
    @DisplayName("a dry run reports orphans without deleting them")
    void cleanupOrphanedMedia_dryRun() {
        blobStore.store("thumbnails/cover_9.jpg", new byte[8]);

        MediaCleanupReport report = service.cleanupOrphanedMedia(true);

        assertThat(report.dryRun()).isTrue();
        assertThat(report.orphanKeys()).containsExactly("thumbnails/cover_9.jpg");
        assertThat(report.deleted()).isZero();
        assertThat(blobStore.get("thumbnails/cover_9.jpg")).isNotNull();
    }

    @Test
    @DisplayName("objects written within the grace period are kept")
    void cleanupOrphanedMedia_keepsRecentObjects() {
        blobStore.store("pages/page_2_1.jpg", new byte[8]);
        blobStore.touch("pages/page_2_1.jpg", NOW.minus(Duration.ofMinutes(5)));

        MediaCleanupReport report = service.cleanupOrphanedMedia(false);

        assertThat(report.orphanKeys()).isEmpty();
        assertThat(blobStore.get("pages/page_2_1.jpg")).isNotNull();
    }

    @Test
    @DisplayName("stale temp entries are removed and fresh ones kept")
    void cleanupTempFiles_removesStaleEntries() throws Exception {
        Path stale = Files.createDirectory(tempRoot.resolve("render-poppler-1"));
        Files.write(stale.resolve("page.png"), new byte[]{1});
        stale.toFile().setLastModified(NOW.minus(Duration.ofHours(3)).toEpochMilli());
        Path fresh = Files.createDirectory(tempRoot.resolve("render-mupdf-2"));
        fresh.toFile().setLastModified(NOW.minus(Duration.ofMinutes(10)).toEpochMilli());

        int removed = service.cleanupTempFiles();

        assertThat(removed).isEqualTo(1);
        assertThat(stale).doesNotExist();
        assertThat(fresh).exists();
    }

    @Test
    @DisplayName("a missing temp root is not an error")
    void cleanupTempFiles_missingRoot() throws Exception {
        Files.delete(tempRoot);

        assertThat(service.cleanupTempFiles()).isZero();
    }
}
