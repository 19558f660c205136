package com.eyelevel.pagepipeline.service.storage;

import com.eyelevel.pagepipeline.config.StorageConfig;
import com.eyelevel.pagepipeline.exception.BlobStorageException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Stores blobs below the configured media root and hands out references under the media base
 * URL. Active when {@code app.storage.type} is {@code local} or unset.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "app.storage", name = "type", havingValue = "local", matchIfMissing = true)
public class LocalFileSystemBlobStore implements BlobStore {

    private final Path mediaRoot;
    private final String baseUrl;

    public LocalFileSystemBlobStore(StorageConfig storageConfig) {
        this.mediaRoot = Paths.get(storageConfig.getLocal().getMediaRoot()).toAbsolutePath().normalize();
        String url = storageConfig.getLocal().getBaseUrl();
        this.baseUrl = url.endsWith("/") ? url : url + "/";
        log.info("LocalFileSystemBlobStore initialized with media root '{}' and base URL '{}'.", mediaRoot, baseUrl);
    }

    @Override
    public String store(String key, byte[] content) {
        File target = resolve(key);
        try {
            FileUtils.writeByteArrayToFile(target, content);
        } catch (IOException e) {
            throw new BlobStorageException("Failed to write blob '" + key + "'", e);
        }
        log.debug("Stored {} bytes at '{}'.", content.length, target);
        return referenceOf(key);
    }

    @Override
    public String copy(String sourceKey, String destinationKey) {
        File source = resolve(sourceKey);
        File target = resolve(destinationKey);
        try {
            FileUtils.copyFile(source, target);
        } catch (IOException e) {
            throw new BlobStorageException("Failed to copy blob '" + sourceKey + "' to '" + destinationKey + "'", e);
        }
        log.debug("Copied '{}' to '{}'.", sourceKey, destinationKey);
        return referenceOf(destinationKey);
    }

    @Override
    public List<StoredBlob> list(String prefix) {
        File directory = resolve(prefix);
        if (!directory.isDirectory()) {
            return List.of();
        }
        return FileUtils.listFiles(directory, null, true).stream()
                .map(file -> new StoredBlob(keyOf(file), file.length(), Instant.ofEpochMilli(file.lastModified())))
                .sorted(Comparator.comparing(StoredBlob::key))
                .toList();
    }

    @Override
    public void delete(String key) {
        File target = resolve(key);
        try {
            Files.deleteIfExists(target.toPath());
        } catch (IOException e) {
            throw new BlobStorageException("Failed to delete blob '" + key + "'", e);
        }
        log.debug("Deleted '{}'.", target);
    }

    @Override
    public String referenceOf(String key) {
        return baseUrl + FilenameUtils.separatorsToUnix(key);
    }

    private String keyOf(File file) {
        return FilenameUtils.separatorsToUnix(mediaRoot.relativize(file.toPath().toAbsolutePath().normalize()).toString());
    }

    private File resolve(String key) {
        Path path = mediaRoot.resolve(FilenameUtils.separatorsToSystem(key)).normalize();
        if (!path.startsWith(mediaRoot)) {
            throw new BlobStorageException("Blob key escapes the media root: " + key, null);
        }
        return path.toFile();
    }
}
